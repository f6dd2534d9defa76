package de.mirkosertic.mcp.ruleengine.vocabulary;

import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clinical vocabulary used for query expansion: synonyms, abbreviations, discipline specialty terms
 * and document-type terms.
 * <p>
 * The tables live in one immutable snapshot that is swapped atomically on load. Lookups never block,
 * never fail and return an empty collection for unknown input, so any number of readers may run
 * concurrently with a reload.
 * <p>
 * File format (YAML):
 * <pre>
 * terms:
 *   - term: physical therapy
 *     synonyms: [physiotherapy, rehab]
 *   - term: PT
 *     expansions: [physical therapy]
 *   - term: gait training
 *     specialty: pt
 * discipline-aliases:
 *   physical therapy: pt
 * document-types:
 *   progress_note: [progress, status]
 * </pre>
 */
public class VocabularyStore {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyStore.class);

    public static final String DEFAULT_VOCABULARY = "default-vocabulary.yaml";

    private final AtomicReference<VocabularySnapshot> snapshot = new AtomicReference<>(VocabularySnapshot.EMPTY);

    /**
     * Load and swap in a vocabulary file.
     *
     * @throws ConfigurationException if the file is missing or malformed; the previous table stays active
     */
    public void load(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Vocabulary file not found: " + path);
        }
        try (final InputStream is = Files.newInputStream(path)) {
            load(is, path.toString());
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read vocabulary file: " + path, e);
        }
    }

    /**
     * Load and swap in a vocabulary document read from a stream.
     *
     * @param sourceName used in log and error messages only
     */
    public void load(final InputStream inputStream, final String sourceName) {
        final VocabularySnapshot loaded;
        try {
            final Map<String, Object> document = new Yaml().load(inputStream);
            loaded = parse(document);
        } catch (final YAMLException | IllegalArgumentException | ClassCastException e) {
            throw new ConfigurationException("Malformed vocabulary " + sourceName + ": " + e.getMessage(), e);
        }
        snapshot.set(loaded);
        logger.info("Loaded vocabulary from {}: {} terms, {} discipline aliases, {} document types",
                sourceName, loaded.entries().size(), loaded.disciplineAliases().size(), loaded.documentTypes().size());
    }

    /**
     * Load the vocabulary bundled on the classpath.
     */
    public void loadDefaults() {
        try (final InputStream is = VocabularyStore.class.getClassLoader().getResourceAsStream(DEFAULT_VOCABULARY)) {
            if (is == null) {
                throw new ConfigurationException("Default vocabulary " + DEFAULT_VOCABULARY + " missing from classpath");
            }
            load(is, "classpath:" + DEFAULT_VOCABULARY);
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read default vocabulary", e);
        }
    }

    /**
     * Replace the table with programmatically built entries.
     */
    public void replace(final List<TermEntry> entries,
                        final Map<String, String> disciplineAliases,
                        final Map<String, List<String>> documentTypeTerms) {
        final VocabularySnapshot next;
        try {
            next = new VocabularySnapshot(entries, disciplineAliases, documentTypeTerms);
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException("Invalid vocabulary: " + e.getMessage(), e);
        }
        snapshot.set(next);
    }

    @SuppressWarnings("unchecked")
    private static VocabularySnapshot parse(final Map<String, Object> document) {
        if (document == null) {
            throw new IllegalArgumentException("document is empty");
        }
        final List<TermEntry> entries = new ArrayList<>();
        final Object terms = document.get("terms");
        if (terms != null) {
            for (final Object item : (Collection<Object>) terms) {
                entries.add(TermEntry.fromMap((Map<String, Object>) item));
            }
        }

        final Map<String, String> aliases = new LinkedHashMap<>();
        final Object aliasSection = document.get("discipline-aliases");
        if (aliasSection != null) {
            ((Map<Object, Object>) aliasSection).forEach((alias, code) -> aliases.put(alias.toString(), code.toString()));
        }

        final Map<String, List<String>> documentTypes = new LinkedHashMap<>();
        final Object documentTypeSection = document.get("document-types");
        if (documentTypeSection != null) {
            ((Map<Object, Object>) documentTypeSection).forEach((type, related) -> {
                final List<String> relatedTerms = new ArrayList<>();
                for (final Object term : (Collection<Object>) related) {
                    relatedTerms.add(term.toString());
                }
                documentTypes.put(type.toString(), relatedTerms);
            });
        }

        return new VocabularySnapshot(entries, aliases, documentTypes);
    }

    /**
     * Write the current table in the same YAML layout {@link #load(Path)} reads.
     */
    public void save(final Path path) throws IOException {
        final VocabularySnapshot current = snapshot.get();

        final List<Map<String, Object>> terms = new ArrayList<>();
        for (final TermEntry entry : current.entries()) {
            terms.add(entry.toMap());
        }
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put("terms", terms);
        document.put("discipline-aliases", new LinkedHashMap<>(current.disciplineAliases()));
        final Map<String, Object> documentTypes = new LinkedHashMap<>();
        current.documentTypes().forEach((type, related) -> documentTypes.put(type, new ArrayList<>(related)));
        document.put("document-types", documentTypes);

        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);

        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (final Writer writer = Files.newBufferedWriter(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            new Yaml(options).dump(document, writer);
        }
        logger.info("Saved vocabulary with {} terms to {}", terms.size(), path);
    }

    /**
     * Synonyms of {@code term}. When {@code term} is itself listed as a synonym, the canonical term and
     * its other synonyms are returned as well.
     */
    public Set<String> lookupSynonyms(final String term) {
        if (term == null || term.isBlank()) {
            return Set.of();
        }
        final VocabularySnapshot current = snapshot.get();
        final String key = VocabularySnapshot.normalize(term);
        final Set<String> result = new LinkedHashSet<>();

        final TermEntry direct = current.entry(term);
        if (direct != null) {
            result.addAll(direct.synonyms());
        }
        for (final TermEntry entry : current.entriesWithSynonym(term)) {
            result.add(entry.term());
            for (final String synonym : entry.synonyms()) {
                if (!VocabularySnapshot.normalize(synonym).equals(key)) {
                    result.add(synonym);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Long forms of abbreviation {@code term}. When {@code term} is itself a long form, the abbreviations
     * that expand to it are returned.
     */
    public Set<String> lookupAbbreviation(final String term) {
        if (term == null || term.isBlank()) {
            return Set.of();
        }
        final VocabularySnapshot current = snapshot.get();
        final Set<String> result = new LinkedHashSet<>();

        final TermEntry direct = current.entry(term);
        if (direct != null) {
            result.addAll(direct.expansions());
        }
        for (final TermEntry entry : current.entriesWithExpansion(term)) {
            result.add(entry.term());
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Specialty terms of a discipline in vocabulary order. Aliases such as "physical therapy" or
     * "physical_therapy" resolve to their discipline code.
     */
    public List<String> lookupSpecialtyTerms(final String discipline) {
        if (discipline == null || discipline.isBlank()) {
            return List.of();
        }
        return snapshot.get().specialtyTerms(discipline);
    }

    /**
     * Terms related to a document type; "Progress Note" and "progress_note" are the same type.
     */
    public List<String> lookupDocumentTypeTerms(final String documentType) {
        if (documentType == null || documentType.isBlank()) {
            return List.of();
        }
        return snapshot.get().documentTypeTerms(documentType);
    }

    /**
     * Discipline code for a discipline name or alias.
     */
    public String resolveDiscipline(final String discipline) {
        return snapshot.get().resolveDiscipline(discipline);
    }

    /**
     * True when {@code phrase} is a canonical term, a synonym or an abbreviation long form.
     */
    public boolean isKnownPhrase(final String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return false;
        }
        return snapshot.get().containsKey(phrase);
    }

    public int size() {
        return snapshot.get().entries().size();
    }
}
