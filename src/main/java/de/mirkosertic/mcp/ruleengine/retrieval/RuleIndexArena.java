package de.mirkosertic.mcp.ruleengine.retrieval;

import de.mirkosertic.mcp.ruleengine.analysis.RuleTextAnalyzer;
import de.mirkosertic.mcp.ruleengine.analysis.StemmedRuleTextAnalyzer;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Immutable lexical and dense index over one {@link RuleCatalog}, held in memory.
 * <p>
 * Fields:
 * <ul>
 *   <li>{@code id}: rule id, stored, not analyzed</li>
 *   <li>{@code content}: title + text through {@link RuleTextAnalyzer}, BM25</li>
 *   <li>{@code content_stemmed}: same text through {@link StemmedRuleTextAnalyzer}</li>
 *   <li>{@code discipline}: discipline code, not analyzed</li>
 *   <li>{@code document_type}: one value per applicable type, {@value #ALL_DOCUMENT_TYPES} when the rule applies to all</li>
 *   <li>{@code embedding}: L2-normalized vector, dot product similarity (HNSW)</li>
 * </ul>
 * The arena is written once and then only read. Readers take a reference with {@link #tryAcquire()}
 * and give it back with {@link #release()}; after {@link #close()} the index memory is freed as soon
 * as the last in-flight reader has released it.
 */
public final class RuleIndexArena implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(RuleIndexArena.class);

    static final String FIELD_ID = "id";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_CONTENT_STEMMED = "content_stemmed";
    static final String FIELD_DISCIPLINE = "discipline";
    static final String FIELD_DOCUMENT_TYPE = "document_type";
    static final String FIELD_EMBEDDING = "embedding";
    static final String ALL_DOCUMENT_TYPES = "_all";

    /**
     * Boost of the stemmed shadow field relative to the exact {@code content} field.
     */
    static final float STEMMED_FIELD_BOOST = 0.5f;

    private final RuleCatalog catalog;
    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final Analyzer contentAnalyzer;
    private final Analyzer stemmedAnalyzer;
    private final int embeddedRules;
    private final Instant builtAt;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private RuleIndexArena(final RuleCatalog catalog,
                           final Directory directory,
                           final DirectoryReader reader,
                           final Analyzer contentAnalyzer,
                           final Analyzer stemmedAnalyzer,
                           final int embeddedRules) {
        this.catalog = catalog;
        this.directory = directory;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(new BM25Similarity());
        this.contentAnalyzer = contentAnalyzer;
        this.stemmedAnalyzer = stemmedAnalyzer;
        this.embeddedRules = embeddedRules;
        this.builtAt = Instant.now();
        reader.getReaderCacheHelper().addClosedListener(key -> directory.close());
    }

    /**
     * Index every rule of the catalog.
     *
     * @throws IndexUnavailableException if the catalog is empty or indexing fails
     */
    public static RuleIndexArena build(final RuleCatalog catalog, final EmbeddingProvider embeddings) {
        if (catalog.isEmpty()) {
            throw new IndexUnavailableException("Rule catalog is empty, nothing to index");
        }
        final long start = System.currentTimeMillis();
        final Analyzer contentAnalyzer = new RuleTextAnalyzer();
        final Analyzer stemmedAnalyzer = new StemmedRuleTextAnalyzer();
        final Analyzer indexAnalyzer = new PerFieldAnalyzerWrapper(contentAnalyzer,
                Map.of(FIELD_CONTENT_STEMMED, stemmedAnalyzer));

        final Directory directory = new ByteBuffersDirectory();
        int embedded = 0;
        try {
            final IndexWriterConfig config = new IndexWriterConfig(indexAnalyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            config.setSimilarity(new BM25Similarity());
            try (final IndexWriter writer = new IndexWriter(directory, config)) {
                for (final Rule rule : catalog) {
                    final float[] vector = embeddings.embed(rule.searchableText());
                    if (vector.length != embeddings.dimension()) {
                        throw new IndexUnavailableException("Embedding of rule " + rule.id() + " has dimension "
                                + vector.length + ", expected " + embeddings.dimension());
                    }
                    final boolean hasVector = !VectorMath.isZero(vector);
                    writer.addDocument(toDocument(rule, hasVector ? VectorMath.normalize(vector) : null));
                    if (hasVector) {
                        embedded++;
                    }
                }
                writer.commit();
            }
            final DirectoryReader reader = DirectoryReader.open(directory);
            logger.info("Indexed {} rules ({} with embeddings) in {}ms",
                    catalog.size(), embedded, System.currentTimeMillis() - start);
            return new RuleIndexArena(catalog, directory, reader, contentAnalyzer, stemmedAnalyzer, embedded);
        } catch (final IOException | IllegalArgumentException e) {
            closeQuietly(directory);
            throw new IndexUnavailableException("Failed to build rule index: " + e.getMessage(), e);
        } catch (final IndexUnavailableException e) {
            closeQuietly(directory);
            throw e;
        }
    }

    private static Document toDocument(final Rule rule, final float @Nullable [] vector) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_ID, rule.id(), Field.Store.YES));
        doc.add(new StoredField("title", rule.title()));
        final String text = rule.searchableText();
        doc.add(new TextField(FIELD_CONTENT, text, Field.Store.NO));
        doc.add(new TextField(FIELD_CONTENT_STEMMED, text, Field.Store.NO));
        if (rule.discipline() != null) {
            doc.add(new StringField(FIELD_DISCIPLINE, rule.discipline(), Field.Store.NO));
        }
        if (rule.documentTypes().isEmpty()) {
            doc.add(new StringField(FIELD_DOCUMENT_TYPE, ALL_DOCUMENT_TYPES, Field.Store.NO));
        } else {
            for (final String type : rule.documentTypes()) {
                doc.add(new StringField(FIELD_DOCUMENT_TYPE, type, Field.Store.NO));
            }
        }
        if (vector != null) {
            doc.add(new KnnFloatVectorField(FIELD_EMBEDDING, vector, VectorSimilarityFunction.DOT_PRODUCT));
        }
        return doc;
    }

    private static void closeQuietly(final Directory directory) {
        try {
            directory.close();
        } catch (final IOException e) {
            logger.debug("Failed to close index directory", e);
        }
    }

    /**
     * Take a reader reference. Returns false when the arena has already been closed and released
     * by all readers; the caller should then fetch the current arena again.
     */
    public boolean tryAcquire() {
        return reader.tryIncRef();
    }

    public void release() {
        try {
            reader.decRef();
        } catch (final IOException e) {
            logger.warn("Failed to release rule index reader", e);
        }
    }

    /**
     * BM25 search over {@code content} OR boosted {@code content_stemmed}. Must be called between
     * {@link #tryAcquire()} and {@link #release()}.
     */
    public List<RankedHit> searchLexical(final String queryText, final @Nullable Query filter, final int depth)
            throws IOException {
        final Query textQuery = buildTextQuery(queryText);
        if (textQuery == null) {
            return List.of();
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(textQuery, BooleanClause.Occur.MUST);
        if (filter != null) {
            builder.add(filter, BooleanClause.Occur.FILTER);
        }
        return toHits(searcher.search(builder.build(), depth), false, Double.NEGATIVE_INFINITY);
    }

    /**
     * Nearest-neighbour search over rule embeddings with the filter applied during graph search.
     * Hits with cosine similarity at or below {@code minSimilarity} are not matches.
     */
    public List<RankedHit> searchDense(final float[] queryVector, final @Nullable Query filter, final int depth,
                                       final double minSimilarity) throws IOException {
        if (embeddedRules == 0 || VectorMath.isZero(queryVector)) {
            return List.of();
        }
        final float[] normalized = VectorMath.normalize(queryVector.clone());
        final Query knn = new KnnFloatVectorQuery(FIELD_EMBEDDING, normalized, depth, filter);
        return toHits(searcher.search(knn, depth), true, minSimilarity);
    }

    private @Nullable Query buildTextQuery(final String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return null;
        }
        // lower case first so that AND, OR and NOT are searched as words, not operators
        final String escaped = QueryParser.escape(queryText.toLowerCase(Locale.ROOT));
        try {
            final Query exact = new QueryParser(FIELD_CONTENT, contentAnalyzer).parse(escaped);
            final Query stemmed = new QueryParser(FIELD_CONTENT_STEMMED, stemmedAnalyzer).parse(escaped);
            if (isEmpty(exact) && isEmpty(stemmed)) {
                return null;
            }
            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            builder.add(exact, BooleanClause.Occur.SHOULD);
            builder.add(new BoostQuery(stemmed, STEMMED_FIELD_BOOST), BooleanClause.Occur.SHOULD);
            return builder.build();
        } catch (final ParseException e) {
            // escaped input only fails on pathological input such as too many clauses
            throw new IllegalArgumentException("Query could not be parsed: " + e.getMessage(), e);
        }
    }

    private static boolean isEmpty(final Query query) {
        return query instanceof BooleanQuery booleanQuery && booleanQuery.clauses().isEmpty();
    }

    private List<RankedHit> toHits(final TopDocs topDocs, final boolean dotProductScores, final double minSimilarity)
            throws IOException {
        final List<RankedHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            double score = scoreDoc.score;
            if (dotProductScores) {
                // Lucene maps dot product d to (1 + d) / 2
                score = 2.0 * score - 1.0;
                if (score <= minSimilarity) {
                    continue;
                }
            }
            final String id = searcher.storedFields().document(scoreDoc.doc).get(FIELD_ID);
            hits.add(new RankedHit(id, score, hits.size() + 1));
        }
        return hits;
    }

    /**
     * Filter for discipline and document type, or null when neither is given.
     */
    static @Nullable Query buildFilter(final @Nullable String discipline, final @Nullable String documentType) {
        final boolean hasDiscipline = discipline != null && !discipline.isBlank();
        final boolean hasDocumentType = documentType != null && !documentType.isBlank();
        if (!hasDiscipline && !hasDocumentType) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        if (hasDiscipline) {
            builder.add(new TermQuery(new Term(FIELD_DISCIPLINE, discipline.trim().toLowerCase(Locale.ROOT))),
                    BooleanClause.Occur.FILTER);
        }
        if (hasDocumentType) {
            final BooleanQuery.Builder types = new BooleanQuery.Builder();
            types.add(new TermQuery(new Term(FIELD_DOCUMENT_TYPE, Rule.normalizeDocumentType(documentType))),
                    BooleanClause.Occur.SHOULD);
            types.add(new TermQuery(new Term(FIELD_DOCUMENT_TYPE, ALL_DOCUMENT_TYPES)), BooleanClause.Occur.SHOULD);
            builder.add(types.build(), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }

    public int getDocumentCount() {
        return reader.numDocs();
    }

    public int getEmbeddedRuleCount() {
        return embeddedRules;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    /**
     * Drop the arena's own reference. In-flight readers keep the index open until they release.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release();
        }
    }
}
