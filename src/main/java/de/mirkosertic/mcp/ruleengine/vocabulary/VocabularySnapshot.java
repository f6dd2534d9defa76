package de.mirkosertic.mcp.ruleengine.vocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup tables precomputed from one set of term entries. A snapshot is never modified
 * after construction; the store replaces it as a whole.
 */
final class VocabularySnapshot {

    static final VocabularySnapshot EMPTY = new VocabularySnapshot(List.of(), Map.of(), Map.of());

    private final List<TermEntry> entries;
    private final Map<String, TermEntry> byTerm;
    private final Map<String, Set<TermEntry>> bySynonym;
    private final Map<String, Set<TermEntry>> byExpansion;
    private final Map<String, List<String>> specialtyTerms;
    private final Map<String, String> disciplineAliases;
    private final Map<String, List<String>> documentTypeTerms;

    VocabularySnapshot(final List<TermEntry> entries,
                       final Map<String, String> disciplineAliases,
                       final Map<String, List<String>> documentTypeTerms) {
        this.entries = List.copyOf(entries);

        final Map<String, TermEntry> terms = new LinkedHashMap<>();
        final Map<String, Set<TermEntry>> synonyms = new LinkedHashMap<>();
        final Map<String, Set<TermEntry>> expansions = new LinkedHashMap<>();
        final Map<String, List<String>> specialties = new LinkedHashMap<>();

        for (final TermEntry entry : this.entries) {
            final String key = normalize(entry.term());
            if (terms.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate vocabulary term: " + entry.term());
            }
            terms.put(key, entry);
            for (final String synonym : entry.synonyms()) {
                synonyms.computeIfAbsent(normalize(synonym), k -> new LinkedHashSet<>()).add(entry);
            }
            for (final String expansion : entry.expansions()) {
                expansions.computeIfAbsent(normalize(expansion), k -> new LinkedHashSet<>()).add(entry);
            }
            if (entry.specialty() != null) {
                specialties.computeIfAbsent(entry.specialty(), k -> new ArrayList<>()).add(entry.term());
            }
        }

        final Map<String, String> aliases = new LinkedHashMap<>();
        disciplineAliases.forEach((alias, code) -> aliases.put(normalize(alias), normalize(code)));

        final Map<String, List<String>> documentTypes = new LinkedHashMap<>();
        documentTypeTerms.forEach((type, related) -> documentTypes.put(normalizeDocumentType(type), List.copyOf(related)));

        this.byTerm = Collections.unmodifiableMap(terms);
        this.bySynonym = freeze(synonyms);
        this.byExpansion = freeze(expansions);
        this.specialtyTerms = freezeLists(specialties);
        this.disciplineAliases = Collections.unmodifiableMap(aliases);
        this.documentTypeTerms = Collections.unmodifiableMap(documentTypes);
    }

    static String normalize(final String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static String normalizeDocumentType(final String value) {
        return normalize(value).replace(' ', '_');
    }

    String resolveDiscipline(final String discipline) {
        final String key = normalize(discipline);
        String code = disciplineAliases.get(key);
        if (code == null) {
            code = disciplineAliases.get(key.replace('_', ' '));
        }
        return code != null ? code : key;
    }

    List<TermEntry> entries() {
        return entries;
    }

    TermEntry entry(final String term) {
        return byTerm.get(normalize(term));
    }

    boolean containsKey(final String term) {
        final String key = normalize(term);
        return byTerm.containsKey(key) || bySynonym.containsKey(key) || byExpansion.containsKey(key);
    }

    Set<TermEntry> entriesWithSynonym(final String term) {
        return bySynonym.getOrDefault(normalize(term), Set.of());
    }

    Set<TermEntry> entriesWithExpansion(final String term) {
        return byExpansion.getOrDefault(normalize(term), Set.of());
    }

    List<String> specialtyTerms(final String discipline) {
        return specialtyTerms.getOrDefault(resolveDiscipline(discipline), List.of());
    }

    List<String> documentTypeTerms(final String documentType) {
        return documentTypeTerms.getOrDefault(normalizeDocumentType(documentType), List.of());
    }

    Map<String, String> disciplineAliases() {
        return disciplineAliases;
    }

    Map<String, List<String>> documentTypes() {
        return documentTypeTerms;
    }

    private static Map<String, Set<TermEntry>> freeze(final Map<String, Set<TermEntry>> source) {
        final Map<String, Set<TermEntry>> frozen = new LinkedHashMap<>();
        source.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, List<String>> freezeLists(final Map<String, List<String>> source) {
        final Map<String, List<String>> frozen = new LinkedHashMap<>();
        source.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }
}
