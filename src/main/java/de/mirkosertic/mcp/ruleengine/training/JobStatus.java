package de.mirkosertic.mcp.ruleengine.training;

public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    SKIPPED,
    FAILED
}
