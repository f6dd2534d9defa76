package de.mirkosertic.mcp.ruleengine.vocabulary;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One vocabulary entry: a canonical term with its synonyms, the long forms it abbreviates
 * and the discipline it is a specialty term of.
 *
 * @param term        canonical term as written in the vocabulary file
 * @param synonyms    alternative wordings of the term
 * @param expansions  long forms, when {@code term} is an abbreviation
 * @param specialty   discipline code the term belongs to, or null
 */
public record TermEntry(
        String term,
        Set<String> synonyms,
        Set<String> expansions,
        @Nullable String specialty
) {

    public TermEntry {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Vocabulary term must not be blank");
        }
        term = term.trim();
        // insertion order is kept: the first synonyms of an entry are its preferred ones
        synonyms = Collections.unmodifiableSet(new LinkedHashSet<>(synonyms));
        expansions = Collections.unmodifiableSet(new LinkedHashSet<>(expansions));
        specialty = specialty == null || specialty.isBlank() ? null : specialty.trim().toLowerCase(Locale.ROOT);
    }

    public static TermEntry synonymsOf(final String term, final String... synonyms) {
        return new TermEntry(term, orderedSet(List.of(synonyms)), Set.of(), null);
    }

    public static TermEntry abbreviation(final String abbreviation, final String... expansions) {
        return new TermEntry(abbreviation, Set.of(), orderedSet(List.of(expansions)), null);
    }

    public static TermEntry specialty(final String term, final String discipline) {
        return new TermEntry(term, Set.of(), Set.of(), discipline);
    }

    /**
     * Parse one element of the {@code terms} list of a vocabulary file.
     */
    @SuppressWarnings("unchecked")
    static TermEntry fromMap(final Map<String, Object> map) {
        final Object term = map.get("term");
        if (term == null) {
            throw new IllegalArgumentException("Vocabulary entry without 'term': " + map);
        }
        final Object specialty = map.get("specialty");
        return new TermEntry(
                term.toString(),
                orderedSet(stringList(map.get("synonyms"))),
                orderedSet(stringList(map.get("expansions"))),
                specialty != null ? specialty.toString() : null
        );
    }

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("term", term);
        if (!synonyms.isEmpty()) {
            map.put("synonyms", new ArrayList<>(synonyms));
        }
        if (!expansions.isEmpty()) {
            map.put("expansions", new ArrayList<>(expansions));
        }
        if (specialty != null) {
            map.put("specialty", specialty);
        }
        return map;
    }

    private static List<String> stringList(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new IllegalArgumentException("Expected a list but got: " + value);
        }
        final List<String> result = new ArrayList<>();
        for (final Object item : collection) {
            if (item != null && !item.toString().isBlank()) {
                result.add(item.toString().trim());
            }
        }
        return result;
    }

    private static Set<String> orderedSet(final List<String> values) {
        return new LinkedHashSet<>(values);
    }
}
