package de.mirkosertic.mcp.ruleengine.expansion;

/**
 * A term added to a query.
 *
 * @param term       the term as written in the vocabulary or context
 * @param sourceKind which lookup produced it
 * @param weight     weight of the source kind, in (0, 1]
 */
public record ExpansionTerm(String term, SourceKind sourceKind, double weight) {
}
