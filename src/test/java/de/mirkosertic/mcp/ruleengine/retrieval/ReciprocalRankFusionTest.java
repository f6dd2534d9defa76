package de.mirkosertic.mcp.ruleengine.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ReciprocalRankFusion Tests")
class ReciprocalRankFusionTest {

    private final RuleCatalog catalog = RuleCatalog.of(List.of(
            Rule.of("A", "Rule A", "alpha", "pt"),
            Rule.of("B", "Rule B", "beta", "pt"),
            Rule.of("C", "Rule C", "gamma", null)
    ));

    @Test
    @DisplayName("A rule in both lists should score the sum of both contributions")
    void shouldSumContributions() {
        // Given
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60, 1.0, 1.0);

        // When
        final List<RetrievedRule> fused = fusion.fuse(
                List.of(new RankedHit("A", 7.5, 1), new RankedHit("B", 3.0, 2)),
                List.of(new RankedHit("B", 0.9, 1), new RankedHit("C", 0.4, 2)),
                catalog);

        // Then
        assertThat(fused).extracting(RetrievedRule::ruleId).containsExactly("B", "A", "C");
        final RetrievedRule b = fused.get(0);
        assertThat(b.fusedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
        assertThat(b.fusedScore()).isGreaterThan(fusion.contribution(1.0, 2));
        assertThat(b.fusedScore()).isGreaterThan(fusion.contribution(1.0, 1));
        assertThat(b.lexicalRank()).isEqualTo(2);
        assertThat(b.denseRank()).isEqualTo(1);
        assertThat(b.rerankScore()).isNull();
    }

    @Test
    @DisplayName("Equal fused scores should be ordered by lexical score, then by rule id")
    void shouldBreakTiesDeterministically() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60, 1.0, 1.0);

        final List<RetrievedRule> fused = fusion.fuse(
                List.of(new RankedHit("C", 2.0, 1)),
                List.of(new RankedHit("A", 0.8, 1)),
                catalog);

        // same rank in one list each; C carries a lexical score
        assertThat(fused).extracting(RetrievedRule::ruleId).containsExactly("C", "A");
    }

    @Test
    @DisplayName("List weights should scale contributions")
    void shouldApplyListWeights() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60, 1.0, 3.0);

        final List<RetrievedRule> fused = fusion.fuse(
                List.of(new RankedHit("A", 9.0, 1)),
                List.of(new RankedHit("B", 0.2, 5)),
                catalog);

        assertThat(fused.get(0).ruleId()).isEqualTo("B");
    }

    @Test
    @DisplayName("Hits for rules missing from the catalog should be dropped")
    void shouldDropUnknownRules() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60, 1.0, 1.0);

        final List<RetrievedRule> fused = fusion.fuse(
                List.of(new RankedHit("GONE", 5.0, 1), new RankedHit("A", 4.0, 2)),
                List.of(),
                catalog);

        assertThat(fused).extracting(RetrievedRule::ruleId).containsExactly("A");
    }

    @Test
    @DisplayName("Should reject a non-positive k")
    void shouldRejectInvalidK() {
        assertThatThrownBy(() -> new ReciprocalRankFusion(0, 1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
