package de.mirkosertic.mcp.ruleengine.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * {@link RuleTextAnalyzer} with an English {@link SnowballFilter} appended.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> StopFilter -> SnowballFilter("English")}</p>
 *
 * <p>Feeds the {@code content_stemmed} shadow field. A weighted OR over {@code content} and
 * {@code content_stemmed} lets "requirements" match "required" while exact wording still
 * ranks first. The default embedding provider hashes these stems as well.</p>
 */
public class StemmedRuleTextAnalyzer extends Analyzer {

    private static final String LANGUAGE = "English";

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        stream = new StopFilter(stream, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
        stream = new SnowballFilter(stream, LANGUAGE);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
