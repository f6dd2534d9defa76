package de.mirkosertic.mcp.ruleengine;

import de.mirkosertic.mcp.ruleengine.expansion.ExpansionResult;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievedRule;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Expansion and ranked rules for one query.
 *
 * @param expansion  how the query was expanded
 * @param discipline discipline code the rules were filtered by, null when unfiltered
 * @param rules      ranked rules, best first
 */
public record RetrievalResult(ExpansionResult expansion, @Nullable String discipline, List<RetrievedRule> rules) {

    public RetrievalResult {
        rules = List.copyOf(rules);
    }
}
