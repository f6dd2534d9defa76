package de.mirkosertic.mcp.ruleengine.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Documents a tool request field for {@link SchemaGenerator}. Numeric bounds are inclusive and
 * only emitted when set.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ToolParam {

    String value();

    double minimum() default Double.NaN;

    double maximum() default Double.NaN;
}
