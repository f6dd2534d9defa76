package de.mirkosertic.mcp.ruleengine.retrieval;

import de.mirkosertic.mcp.ruleengine.analysis.RuleTextAnalyzer;
import de.mirkosertic.mcp.ruleengine.analysis.Tokens;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.memory.MemoryIndex;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores one query against one rule with a single-document Lucene {@link MemoryIndex}.
 * <p>
 * The query is the OR of its terms plus a proximity phrase over all terms:
 * <pre>
 * query:   "PT visit frequency"
 * scores:  pt OR visit OR frequency OR ("pt visit frequency"~3)^2.0
 * </pre>
 * Rules that mention the query words close together therefore beat rules that merely contain
 * them somewhere, which the fused rank lists cannot express.
 */
public class MemoryIndexRelevanceScorer implements RelevanceScorer {

    public static final int DEFAULT_PROXIMITY_SLOP = 3;
    public static final float DEFAULT_PHRASE_BOOST = 2.0f;

    private static final String FIELD = "content";

    private final Analyzer analyzer = new RuleTextAnalyzer();
    private final int proximitySlop;
    private final float phraseBoost;

    public MemoryIndexRelevanceScorer() {
        this(DEFAULT_PROXIMITY_SLOP, DEFAULT_PHRASE_BOOST);
    }

    public MemoryIndexRelevanceScorer(final int proximitySlop, final float phraseBoost) {
        this.proximitySlop = proximitySlop;
        this.phraseBoost = phraseBoost;
    }

    @Override
    public double score(final String query, final Rule rule) {
        final List<String> tokens = Tokens.analyze(analyzer, FIELD, query);
        if (tokens.isEmpty()) {
            return 0.0;
        }
        final MemoryIndex index = new MemoryIndex();
        index.addField(FIELD, rule.searchableText(), analyzer);
        return index.search(buildQuery(tokens));
    }

    Query buildQuery(final List<String> tokens) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        final Set<String> distinct = new LinkedHashSet<>(tokens);
        for (final String token : distinct) {
            builder.add(new TermQuery(new Term(FIELD, token)), BooleanClause.Occur.SHOULD);
        }
        if (tokens.size() > 1) {
            final PhraseQuery.Builder phrase = new PhraseQuery.Builder();
            phrase.setSlop(proximitySlop);
            for (final String token : tokens) {
                phrase.add(new Term(FIELD, token));
            }
            builder.add(new BoostQuery(phrase.build(), phraseBoost), BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }
}
