package de.mirkosertic.mcp.ruleengine.expansion;

import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import de.mirkosertic.mcp.ruleengine.vocabulary.VocabularyStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryExpander Tests")
class QueryExpanderTest {

    private static VocabularyStore vocabulary;

    @BeforeAll
    static void loadVocabulary() {
        vocabulary = new VocabularyStore();
        vocabulary.loadDefaults();
    }

    private static Map<SourceKind, Double> defaultWeights() {
        final Map<SourceKind, Double> weights = new EnumMap<>(SourceKind.class);
        weights.put(SourceKind.SYNONYM, 0.9);
        weights.put(SourceKind.ABBREVIATION, 0.8);
        weights.put(SourceKind.SPECIALTY, 0.7);
        weights.put(SourceKind.CONTEXT, 0.6);
        weights.put(SourceKind.DOCUMENT_TYPE, 0.6);
        return weights;
    }

    private static QueryExpander expander(final int maxTerms) {
        return new QueryExpander(vocabulary, defaultWeights(), maxTerms, 3, 5);
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @ParameterizedTest(name = "cap {0}")
        @ValueSource(ints = {0, 1, 3, 10})
        @DisplayName("Should never return more terms than the cap")
        void shouldRespectCap(final int cap) {
            final QueryExpander expander = expander(cap);

            final ExpansionResult result = expander.expand("PT progress toward ROM and balance goals", "pt",
                    "progress_note", List.of("gait", "pain", "strength"));

            assertThat(result.terms()).hasSizeLessThanOrEqualTo(cap);
        }

        @Test
        @DisplayName("Should keep the original query verbatim at the start of the expanded query")
        void shouldKeepOriginalQuery() {
            final String query = "  PT  Progress!! toward goals ";

            final ExpansionResult result = expander(10).expand(query);

            assertThat(result.originalQuery()).isEqualTo(query);
            assertThat(result.expandedQuery()).startsWith(query);
        }

        @Test
        @DisplayName("Weights should be constant per source kind")
        void shouldUseOneWeightPerSource() {
            final ExpansionResult result = expander(50).expand("PT progress", "pt", "evaluation",
                    List.of("balance"));

            for (final ExpansionTerm term : result.terms()) {
                assertThat(term.weight()).isEqualTo(defaultWeights().get(term.sourceKind()));
            }
        }

        @Test
        @DisplayName("Terms should be ordered by descending weight without duplicates")
        void shouldOrderAndDeduplicate() {
            final ExpansionResult result = expander(50).expand("PT progress", "pt", "progress_note", null);

            assertThat(result.terms())
                    .extracting(ExpansionTerm::weight)
                    .isSortedAccordingTo((a, b) -> Double.compare(b, a));
            assertThat(result.terms())
                    .extracting(term -> term.term().toLowerCase())
                    .doesNotHaveDuplicates()
                    .doesNotContain("pt", "progress");
        }

        @Test
        @DisplayName("Blank queries should be returned unchanged")
        void shouldReturnBlankQueryUnchanged() {
            final ExpansionResult result = expander(10).expand("   ");

            assertThat(result.terms()).isEmpty();
            assertThat(result.isExpanded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Sources")
    class Sources {

        @Test
        @DisplayName("Abbreviation PT should expand to physical therapy at synonym weight")
        void shouldExpandAbbreviation() {
            final ExpansionResult result = expander(10).expand("PT progress");

            // physical therapy is both a reverse synonym and a long form of PT; the higher weight wins
            assertThat(result.terms())
                    .contains(new ExpansionTerm("physical therapy", SourceKind.SYNONYM, 0.9));
            assertThat(result.expandedQuery()).contains("physical therapy");
        }

        @Test
        @DisplayName("Specialty terms should prefer terms overlapping the query")
        void shouldPreferOverlappingSpecialtyTerms() {
            final ExpansionResult result = expander(10).expand("gait", "physical therapy", null, null);

            assertThat(result.termsBySource().get(SourceKind.SPECIALTY)).containsExactly("gait training");
        }

        @Test
        @DisplayName("Specialty terms should fall back to the first terms of the discipline")
        void shouldFallBackToLeadingSpecialtyTerms() {
            final ExpansionResult result = expander(10).expand("documentation review", "pt", null, null);

            assertThat(result.termsBySource().get(SourceKind.SPECIALTY))
                    .containsExactly("gait training", "therapeutic exercise", "manual therapy");
        }

        @Test
        @DisplayName("Context entities should add the entity and two of its synonyms")
        void shouldAddContextEntities() {
            final ExpansionResult result = expander(50).expand("review", null, null, List.of("balance"));

            assertThat(result.termsBySource().get(SourceKind.CONTEXT))
                    .containsExactly("balance", "stability", "equilibrium");
        }

        @Test
        @DisplayName("Only the first context entities up to the limit should be used")
        void shouldLimitContextEntities() {
            final ExpansionResult result = expander(100).expand("review", null, null,
                    List.of("e1", "e2", "e3", "e4", "e5", "e6", "e7"));

            assertThat(result.termsBySource().get(SourceKind.CONTEXT))
                    .containsExactly("e1", "e2", "e3", "e4", "e5");
        }

        @Test
        @DisplayName("Document type terms should be added for a known document type")
        void shouldAddDocumentTypeTerms() {
            final ExpansionResult result = expander(50).expand("review", null, "Discharge Summary", null);

            assertThat(result.termsBySource().get(SourceKind.DOCUMENT_TYPE))
                    .contains("discharge", "outcomes", "summary");
        }
    }

    @Test
    @DisplayName("Should reject weights outside (0, 1]")
    void shouldRejectInvalidWeights() {
        final Map<SourceKind, Double> weights = defaultWeights();
        weights.put(SourceKind.CONTEXT, 0.0);

        assertThatThrownBy(() -> new QueryExpander(vocabulary, weights, 10, 3, 5))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("CONTEXT");
    }
}
