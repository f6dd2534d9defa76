package de.mirkosertic.mcp.ruleengine.mcp.dto;

import org.jspecify.annotations.Nullable;

final class Numbers {

    private Numbers() {
    }

    static @Nullable Double finiteOrNull(final double value) {
        return Double.isFinite(value) ? value : null;
    }
}
