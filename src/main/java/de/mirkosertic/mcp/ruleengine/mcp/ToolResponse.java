package de.mirkosertic.mcp.ruleengine.mcp;

/**
 * Common shape of every tool response: a success flag, and an error message when it is false.
 */
public interface ToolResponse {

    boolean success();

    String error();
}
