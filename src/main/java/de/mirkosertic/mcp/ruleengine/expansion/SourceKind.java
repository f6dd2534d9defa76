package de.mirkosertic.mcp.ruleengine.expansion;

/**
 * Where an expansion term came from. Each kind carries one configured weight.
 */
public enum SourceKind {
    SYNONYM,
    ABBREVIATION,
    SPECIALTY,
    CONTEXT,
    DOCUMENT_TYPE
}
