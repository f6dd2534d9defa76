package de.mirkosertic.mcp.ruleengine.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MemoryIndexRelevanceScorer Tests")
class MemoryIndexRelevanceScorerTest {

    private final MemoryIndexRelevanceScorer scorer = new MemoryIndexRelevanceScorer();

    @Test
    @DisplayName("Rules mentioning the query words close together should score higher")
    void shouldFavorProximity() {
        final Rule close = Rule.of("A", "", "visit frequency must be written in the plan for each week", null);
        final Rule apart = Rule.of("B", "", "frequency must be written in the plan for each week visit", null);

        assertThat(scorer.score("visit frequency", close)).isGreaterThan(scorer.score("visit frequency", apart));
    }

    @Test
    @DisplayName("Unrelated rules and stop-word queries should score zero")
    void shouldScoreZeroWithoutMatch() {
        final Rule rule = Rule.of("A", "Swallowing", "Report diet consistency.", "slp");

        assertThat(scorer.score("gait training", rule)).isZero();
        assertThat(scorer.score("the and of", rule)).isZero();
    }
}
