package de.mirkosertic.mcp.ruleengine.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs text through an analyzer and collects the terms.
 */
public final class Tokens {

    private Tokens() {
    }

    public static List<String> analyze(final Analyzer analyzer, final String fieldName, final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (final TokenStream tokenStream = analyzer.tokenStream(fieldName, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // analyzers over a String reader do not perform I/O
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }
}
