package de.mirkosertic.mcp.ruleengine.retrieval;

import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered collection of reference rules.
 * <p>
 * YAML layout:
 * <pre>
 * rules:
 *   - id: PT-FREQ-001
 *     title: Visit frequency
 *     text: ...
 *     discipline: pt
 *     document-types: [progress_note]
 *     metadata:
 *       source: Medicare Benefit Policy Manual
 * </pre>
 */
public final class RuleCatalog implements Iterable<Rule> {

    private static final Logger logger = LoggerFactory.getLogger(RuleCatalog.class);

    public static final String DEFAULT_CATALOG = "default-rule-catalog.yaml";

    private final List<Rule> rules;
    private final Map<String, Rule> byId;

    private RuleCatalog(final List<Rule> rules) {
        final Map<String, Rule> index = new LinkedHashMap<>();
        for (final Rule rule : rules) {
            if (index.putIfAbsent(rule.id(), rule) != null) {
                throw new ConfigurationException("Duplicate rule id in catalog: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
        this.byId = Map.copyOf(index);
    }

    public static RuleCatalog of(final List<Rule> rules) {
        return new RuleCatalog(rules);
    }

    public static RuleCatalog load(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Rule catalog not found: " + path);
        }
        try (final InputStream is = Files.newInputStream(path)) {
            return load(is, path.toString());
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read rule catalog: " + path, e);
        }
    }

    public static RuleCatalog loadDefault() {
        try (final InputStream is = RuleCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_CATALOG)) {
            if (is == null) {
                throw new ConfigurationException("Default rule catalog " + DEFAULT_CATALOG + " missing from classpath");
            }
            return load(is, "classpath:" + DEFAULT_CATALOG);
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read default rule catalog", e);
        }
    }

    @SuppressWarnings("unchecked")
    public static RuleCatalog load(final InputStream inputStream, final String sourceName) {
        final List<Rule> rules = new ArrayList<>();
        try {
            final Map<String, Object> document = new Yaml().load(inputStream);
            if (document == null || document.get("rules") == null) {
                throw new ConfigurationException("Rule catalog " + sourceName + " has no 'rules' section");
            }
            for (final Object item : (Collection<Object>) document.get("rules")) {
                if (item == null) {
                    throw new ConfigurationException("Rule catalog " + sourceName + " has an empty rule entry");
                }
                rules.add(parseRule((Map<String, Object>) item));
            }
        } catch (final YAMLException | IllegalArgumentException | ClassCastException e) {
            throw new ConfigurationException("Malformed rule catalog " + sourceName + ": " + e.getMessage(), e);
        }
        final RuleCatalog catalog = new RuleCatalog(rules);
        logger.info("Loaded {} rules from {}", catalog.size(), sourceName);
        return catalog;
    }

    @SuppressWarnings("unchecked")
    private static Rule parseRule(final Map<String, Object> map) {
        final Set<String> documentTypes = new LinkedHashSet<>();
        final Object types = map.get("document-types");
        if (types != null) {
            for (final Object type : (Collection<Object>) types) {
                if (type != null) {
                    documentTypes.add(type.toString());
                }
            }
        }
        final Object id = map.get("id");
        if (id == null) {
            throw new ConfigurationException("Rule without id in catalog: " + map.get("title"));
        }
        final Object discipline = map.get("discipline");
        final Object metadata = map.get("metadata");
        return new Rule(
                id.toString(),
                stringOrEmpty(map.get("title")),
                stringOrEmpty(map.get("text")),
                discipline != null ? discipline.toString() : null,
                documentTypes,
                metadata != null ? (Map<String, Object>) metadata : Map.of()
        );
    }

    private static String stringOrEmpty(final Object value) {
        return value == null ? "" : value.toString().trim();
    }

    public List<Rule> rules() {
        return rules;
    }

    public Optional<Rule> get(final String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }
}
