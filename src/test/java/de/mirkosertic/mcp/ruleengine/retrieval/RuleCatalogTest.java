package de.mirkosertic.mcp.ruleengine.retrieval;

import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleCatalog Tests")
class RuleCatalogTest {

    @Test
    @DisplayName("Should load the bundled catalog")
    void shouldLoadDefaultCatalog() {
        final RuleCatalog catalog = RuleCatalog.loadDefault();

        assertThat(catalog.size()).isEqualTo(20);
        final Rule gait = catalog.get("PT-GAIT-001").orElseThrow();
        assertThat(gait.discipline()).isEqualTo("pt");
        assertThat(gait.documentTypes()).containsExactly("progress_note");
        assertThat(gait.metadata()).containsEntry("severity", "low");
        assertThat(catalog.get("GEN-SIGN-001").orElseThrow().discipline()).isNull();
        assertThat(catalog.get("GEN-SIGN-001").orElseThrow().documentTypes()).isEmpty();
    }

    @Test
    @DisplayName("Should load a catalog file and normalize discipline and document types")
    void shouldLoadFromFile(@TempDir final Path tempDir) throws Exception {
        final Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, """
                rules:
                  - id: X-1
                    title: Home program
                    text: Document the home program.
                    discipline: PT
                    document-types: [Progress Note]
                """);

        final RuleCatalog catalog = RuleCatalog.load(file);

        final Rule rule = catalog.get("X-1").orElseThrow();
        assertThat(rule.discipline()).isEqualTo("pt");
        assertThat(rule.documentTypes()).containsExactly("progress_note");
        assertThat(rule.searchableText()).isEqualTo("Home program. Document the home program.");
    }

    @Test
    @DisplayName("Should reject duplicate rule ids")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> RuleCatalog.of(List.of(
                Rule.of("A", "one", "text", null),
                Rule.of("A", "two", "text", null))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("A");
    }

    @Test
    @DisplayName("Should reject documents without a rules section")
    void shouldRejectMissingRulesSection() {
        final ByteArrayInputStream input = new ByteArrayInputStream("other: 1".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> RuleCatalog.load(input, "test.yaml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("test.yaml");
    }

    @Test
    @DisplayName("Should reject a catalog entry without an id")
    void shouldRejectMissingId() {
        final ByteArrayInputStream input = new ByteArrayInputStream("""
                rules:
                  - title: No id
                    text: some text
                """.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> RuleCatalog.load(input, "test.yaml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("without id");
    }

    @Test
    @DisplayName("Should reject an empty rule entry")
    void shouldRejectEmptyEntry() {
        final ByteArrayInputStream input = new ByteArrayInputStream("""
                rules:
                  -
                """.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> RuleCatalog.load(input, "test.yaml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("test.yaml");
    }

    @Test
    @DisplayName("Metadata keys without a value should be dropped")
    void shouldDropEmptyMetadataValues() {
        final ByteArrayInputStream input = new ByteArrayInputStream("""
                rules:
                  - id: X-2
                    title: Signature
                    text: Notes are signed.
                    document-types: [progress_note, ~]
                    metadata:
                      source:
                      severity: high
                """.getBytes(StandardCharsets.UTF_8));

        final Rule rule = RuleCatalog.load(input, "test.yaml").get("X-2").orElseThrow();

        assertThat(rule.metadata()).containsOnlyKeys("severity");
        assertThat(rule.metadata()).containsEntry("severity", "high");
        assertThat(rule.documentTypes()).containsExactly("progress_note");
    }

    @Test
    @DisplayName("Should reject rules without an id")
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> Rule.of(" ", "title", "text", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
