package de.mirkosertic.mcp.ruleengine.analysis;

import org.apache.lucene.analysis.CharArraySet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Rule text analyzers")
class RuleTextAnalyzerTest {

    @Test
    @DisplayName("Should lowercase, fold diacritics and drop stop words")
    void shouldNormalizeText() {
        final RuleTextAnalyzer analyzer = new RuleTextAnalyzer();

        assertThat(Tokens.analyze(analyzer, "content", "The Café Plan of Care"))
                .containsExactly("cafe", "plan", "care");
    }

    @Test
    @DisplayName("Should keep stop words when given an empty set")
    void shouldKeepStopWords() {
        final RuleTextAnalyzer analyzer = new RuleTextAnalyzer(CharArraySet.EMPTY_SET);

        assertThat(Tokens.analyze(analyzer, "content", "Plan of Care"))
                .containsExactly("plan", "of", "care");
    }

    @Test
    @DisplayName("Stemmed analyzer should map singular and plural to one term")
    void shouldStemPlurals() {
        final StemmedRuleTextAnalyzer analyzer = new StemmedRuleTextAnalyzer();

        assertThat(Tokens.analyze(analyzer, "content_stemmed", "exercises"))
                .isEqualTo(Tokens.analyze(analyzer, "content_stemmed", "exercise"));
    }

    @Test
    @DisplayName("Empty text should produce no tokens")
    void shouldHandleEmptyText() {
        assertThat(Tokens.analyze(new RuleTextAnalyzer(), "content", "")).isEmpty();
    }
}
