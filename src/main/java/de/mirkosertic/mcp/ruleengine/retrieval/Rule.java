package de.mirkosertic.mcp.ruleengine.retrieval;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A reference compliance rule.
 *
 * @param id            unique rule id
 * @param title         short title
 * @param text          full rule text
 * @param discipline    discipline code (pt, ot, slp), or null when the rule applies to every discipline
 * @param documentTypes document types the rule applies to; empty means all types
 * @param metadata      free-form attributes (source regulation, severity, ...)
 */
public record Rule(
        String id,
        String title,
        String text,
        @Nullable String discipline,
        Set<String> documentTypes,
        Map<String, Object> metadata
) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        title = title == null ? "" : title;
        text = text == null ? "" : text;
        discipline = discipline == null || discipline.isBlank() ? null : discipline.trim().toLowerCase(Locale.ROOT);
        final Set<String> normalizedTypes = new LinkedHashSet<>();
        if (documentTypes != null) {
            for (final String type : documentTypes) {
                normalizedTypes.add(normalizeDocumentType(type));
            }
        }
        documentTypes = Set.copyOf(normalizedTypes);
        final Map<String, Object> presentMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            // YAML keys without a value arrive as nulls
            metadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    presentMetadata.put(key, value);
                }
            });
        }
        metadata = Map.copyOf(presentMetadata);
    }

    public static Rule of(final String id, final String title, final String text, final @Nullable String discipline) {
        return new Rule(id, title, text, discipline, Set.of(), Map.of());
    }

    public static Rule of(final String id, final String title, final String text, final @Nullable String discipline,
                          final Collection<String> documentTypes) {
        return new Rule(id, title, text, discipline, new LinkedHashSet<>(documentTypes), Map.of());
    }

    /**
     * Text indexed for lexical and dense search.
     */
    public String searchableText() {
        return title.isEmpty() ? text : title + ". " + text;
    }

    public static String normalizeDocumentType(final String documentType) {
        return documentType.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
