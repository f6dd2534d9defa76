package de.mirkosertic.mcp.ruleengine.expansion;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one query expansion. Created per query, never persisted.
 *
 * @param originalQuery the query exactly as given
 * @param terms         added terms, weight descending
 * @param expandedQuery original query followed by the added terms
 */
public record ExpansionResult(
        String originalQuery,
        List<ExpansionTerm> terms,
        String expandedQuery
) {

    public ExpansionResult {
        terms = List.copyOf(terms);
    }

    public static ExpansionResult unchanged(final String query) {
        return new ExpansionResult(query, List.of(), query);
    }

    public boolean isExpanded() {
        return !terms.isEmpty();
    }

    /**
     * Added terms grouped by source kind, each group in result order.
     */
    public Map<SourceKind, List<String>> termsBySource() {
        final Map<SourceKind, List<String>> grouped = new EnumMap<>(SourceKind.class);
        for (final ExpansionTerm term : terms) {
            grouped.computeIfAbsent(term.sourceKind(), k -> new ArrayList<>()).add(term.term());
        }
        return grouped;
    }
}
