package de.mirkosertic.mcp.ruleengine.expansion;

import de.mirkosertic.mcp.ruleengine.analysis.RuleTextAnalyzer;
import de.mirkosertic.mcp.ruleengine.analysis.Tokens;
import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import de.mirkosertic.mcp.ruleengine.vocabulary.VocabularyStore;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds weighted domain terms to a short analysis query.
 * <p>
 * Key terms are the folded query tokens (stop words and single characters removed) plus every
 * two- and three-word phrase of the query the vocabulary knows, e.g. "range of motion".
 * Each key term contributes its synonyms and abbreviation forms; a discipline adds specialty
 * terms, context entities and the document type add their own related terms.
 * <p>
 * Candidates are deduplicated case-insensitively keeping the highest weight, terms already in the
 * query are dropped, and the rest is sorted by weight (stable, so vocabulary order breaks ties)
 * and cut to the configured maximum.
 */
public class QueryExpander {

    private static final Logger logger = LoggerFactory.getLogger(QueryExpander.class);

    private static final int MAX_PHRASE_WORDS = 3;
    private static final int CONTEXT_SYNONYMS_PER_ENTITY = 2;

    private final VocabularyStore vocabulary;
    private final Map<SourceKind, Double> weights;
    private final int maxTerms;
    private final int specialtyLimit;
    private final int contextEntityLimit;

    // Keeps every token; stop words are filtered separately so that phrases like "plan of care" survive
    private final Analyzer phraseAnalyzer = new RuleTextAnalyzer(CharArraySet.EMPTY_SET);
    private final CharArraySet stopWords = EnglishAnalyzer.ENGLISH_STOP_WORDS_SET;

    public QueryExpander(final VocabularyStore vocabulary, final ApplicationConfig config) {
        this(vocabulary, weightsFrom(config), config.getMaxExpansionTerms(),
                config.getSpecialtyLimit(), config.getContextEntityLimit());
    }

    public QueryExpander(final VocabularyStore vocabulary,
                         final Map<SourceKind, Double> weights,
                         final int maxTerms,
                         final int specialtyLimit,
                         final int contextEntityLimit) {
        if (maxTerms < 0) {
            throw new ConfigurationException("Maximum expansion terms must not be negative, was " + maxTerms);
        }
        if (specialtyLimit < 0 || contextEntityLimit < 0) {
            throw new ConfigurationException("Expansion limits must not be negative");
        }
        final Map<SourceKind, Double> checked = new EnumMap<>(SourceKind.class);
        for (final SourceKind kind : SourceKind.values()) {
            final Double weight = weights.get(kind);
            if (weight == null || !(weight > 0.0 && weight <= 1.0)) {
                throw new ConfigurationException("Weight for " + kind + " must be in (0, 1], was " + weight);
            }
            checked.put(kind, weight);
        }
        this.vocabulary = vocabulary;
        this.weights = checked;
        this.maxTerms = maxTerms;
        this.specialtyLimit = specialtyLimit;
        this.contextEntityLimit = contextEntityLimit;
    }

    private static Map<SourceKind, Double> weightsFrom(final ApplicationConfig config) {
        final Map<SourceKind, Double> weights = new EnumMap<>(SourceKind.class);
        weights.put(SourceKind.SYNONYM, config.getSynonymWeight());
        weights.put(SourceKind.ABBREVIATION, config.getAbbreviationWeight());
        weights.put(SourceKind.SPECIALTY, config.getSpecialtyWeight());
        weights.put(SourceKind.CONTEXT, config.getContextWeight());
        weights.put(SourceKind.DOCUMENT_TYPE, config.getDocumentTypeWeight());
        return weights;
    }

    public ExpansionResult expand(final String query) {
        return expand(query, null, null, null);
    }

    /**
     * Expand a query.
     *
     * @param query           raw query; blank input is returned unchanged
     * @param discipline      discipline code or alias (pt, "physical therapy", ...), optional
     * @param documentType    document type (progress_note, "Progress Note", ...), optional
     * @param contextEntities entities extracted from the analysed document, optional
     */
    public ExpansionResult expand(final @Nullable String query,
                                  final @Nullable String discipline,
                                  final @Nullable String documentType,
                                  final @Nullable Collection<String> contextEntities) {
        if (query == null || query.isBlank()) {
            return ExpansionResult.unchanged(query == null ? "" : query);
        }

        final List<String> words = Tokens.analyze(phraseAnalyzer, "content", query);
        final Set<String> keyTerms = extractKeyTerms(words);

        final List<ExpansionTerm> candidates = new ArrayList<>();
        for (final String keyTerm : keyTerms) {
            addAll(candidates, vocabulary.lookupSynonyms(keyTerm), SourceKind.SYNONYM);
            addAll(candidates, vocabulary.lookupAbbreviation(keyTerm), SourceKind.ABBREVIATION);
        }
        if (discipline != null && !discipline.isBlank()) {
            addAll(candidates, specialtyTerms(discipline, new HashSet<>(words)), SourceKind.SPECIALTY);
        }
        if (contextEntities != null) {
            addAll(candidates, contextTerms(contextEntities), SourceKind.CONTEXT);
        }
        if (documentType != null && !documentType.isBlank()) {
            addAll(candidates, vocabulary.lookupDocumentTypeTerms(documentType), SourceKind.DOCUMENT_TYPE);
        }

        final Set<String> excluded = new HashSet<>(keyTerms);
        excluded.add(normalize(query));
        final List<ExpansionTerm> selected = deduplicate(candidates, excluded);
        selected.sort(Comparator.comparingDouble(ExpansionTerm::weight).reversed());
        final List<ExpansionTerm> capped = selected.size() > maxTerms
                ? new ArrayList<>(selected.subList(0, maxTerms))
                : selected;

        final StringBuilder expanded = new StringBuilder(query);
        for (final ExpansionTerm term : capped) {
            expanded.append(' ').append(term.term());
        }

        logger.debug("Expanded query '{}' with {} of {} candidate terms", query, capped.size(), candidates.size());
        return new ExpansionResult(query, capped, expanded.toString());
    }

    private Set<String> extractKeyTerms(final List<String> words) {
        final Set<String> keyTerms = new LinkedHashSet<>();
        for (final String word : words) {
            if (word.length() >= 2 && !stopWords.contains(word)) {
                keyTerms.add(word);
            }
        }
        for (int length = 2; length <= MAX_PHRASE_WORDS; length++) {
            for (int start = 0; start + length <= words.size(); start++) {
                final String phrase = String.join(" ", words.subList(start, start + length));
                if (vocabulary.isKnownPhrase(phrase)) {
                    keyTerms.add(phrase);
                }
            }
        }
        return keyTerms;
    }

    private List<String> specialtyTerms(final String discipline, final Set<String> queryWords) {
        final List<String> all = vocabulary.lookupSpecialtyTerms(discipline);
        final List<String> overlapping = new ArrayList<>();
        for (final String term : all) {
            for (final String token : Tokens.analyze(phraseAnalyzer, "content", term)) {
                if (queryWords.contains(token)) {
                    overlapping.add(term);
                    break;
                }
            }
        }
        final List<String> chosen = overlapping.isEmpty() ? all : overlapping;
        return chosen.subList(0, Math.min(specialtyLimit, chosen.size()));
    }

    private List<String> contextTerms(final Collection<String> contextEntities) {
        final List<String> terms = new ArrayList<>();
        int used = 0;
        for (final String entity : contextEntities) {
            if (used >= contextEntityLimit) {
                break;
            }
            if (entity == null || entity.isBlank()) {
                continue;
            }
            used++;
            terms.add(entity.trim());
            vocabulary.lookupSynonyms(entity).stream()
                    .limit(CONTEXT_SYNONYMS_PER_ENTITY)
                    .forEach(terms::add);
        }
        return terms;
    }

    private void addAll(final List<ExpansionTerm> candidates, final Collection<String> terms, final SourceKind kind) {
        final double weight = weights.get(kind);
        for (final String term : terms) {
            candidates.add(new ExpansionTerm(term, kind, weight));
        }
    }

    private List<ExpansionTerm> deduplicate(final List<ExpansionTerm> candidates, final Set<String> excluded) {
        final Map<String, ExpansionTerm> unique = new LinkedHashMap<>();
        for (final ExpansionTerm candidate : candidates) {
            final String key = normalize(candidate.term());
            if (key.isEmpty() || excluded.contains(key)) {
                continue;
            }
            unique.merge(key, candidate, (existing, next) -> next.weight() > existing.weight() ? next : existing);
        }
        return new ArrayList<>(unique.values());
    }

    private String normalize(final String text) {
        return String.join(" ", Tokens.analyze(phraseAnalyzer, "content", text));
    }

    public int getMaxTerms() {
        return maxTerms;
    }

    public Map<SourceKind, Double> getWeights() {
        return Map.copyOf(weights);
    }
}
