package de.mirkosertic.mcp.ruleengine.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer for rule text and queries on the unstemmed {@code content} field.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> StopFilter}</p>
 *
 * ICU folding removes diacritics and expands ligatures, so "Therapie", "thérapie" and text
 * extracted from PDFs with ligatures compare equal. English stop words are removed; pass an
 * empty set to keep every token (used for phrase detection in the query expander).
 */
public class RuleTextAnalyzer extends Analyzer {

    private final CharArraySet stopWords;

    public RuleTextAnalyzer() {
        this(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    }

    public RuleTextAnalyzer(final CharArraySet stopWords) {
        this.stopWords = stopWords;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        if (!stopWords.isEmpty()) {
            stream = new StopFilter(stream, stopWords);
        }
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }
}
