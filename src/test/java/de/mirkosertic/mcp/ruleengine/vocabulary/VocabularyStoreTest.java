package de.mirkosertic.mcp.ruleengine.vocabulary;

import de.mirkosertic.mcp.ruleengine.config.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VocabularyStore Tests")
class VocabularyStoreTest {

    private VocabularyStore store;

    @BeforeEach
    void setUp() {
        store = new VocabularyStore();
        store.loadDefaults();
    }

    @Nested
    @DisplayName("Lookups on the bundled vocabulary")
    class Lookups {

        @Test
        @DisplayName("Should return synonyms of a canonical term")
        void shouldReturnSynonyms() {
            assertThat(store.lookupSynonyms("balance"))
                    .containsExactly("stability", "equilibrium", "postural control");
        }

        @Test
        @DisplayName("Should resolve a synonym back to its canonical term and siblings")
        void shouldReverseLookupSynonyms() {
            assertThat(store.lookupSynonyms("physiotherapy"))
                    .contains("physical therapy", "rehabilitation")
                    .doesNotContain("physiotherapy");
        }

        @Test
        @DisplayName("Lookups should ignore case and surrounding whitespace")
        void shouldIgnoreCase() {
            assertThat(store.lookupSynonyms("  BALANCE ")).isEqualTo(store.lookupSynonyms("balance"));
            assertThat(store.lookupAbbreviation("rom")).containsExactly("range of motion");
        }

        @Test
        @DisplayName("Should expand abbreviations and find abbreviations of long forms")
        void shouldHandleAbbreviations() {
            assertThat(store.lookupAbbreviation("PT")).containsExactly("physical therapy", "physiotherapy");
            assertThat(store.lookupAbbreviation("range of motion")).contains("ROM");
        }

        @Test
        @DisplayName("Should resolve discipline aliases for specialty terms")
        void shouldResolveDisciplineAliases() {
            assertThat(store.resolveDiscipline("Physical Therapy")).isEqualTo("pt");
            assertThat(store.resolveDiscipline("speech_therapy")).isEqualTo("slp");
            assertThat(store.lookupSpecialtyTerms("physical therapy"))
                    .startsWith("gait training", "therapeutic exercise")
                    .isEqualTo(store.lookupSpecialtyTerms("pt"));
        }

        @Test
        @DisplayName("Should normalize document types")
        void shouldNormalizeDocumentTypes() {
            assertThat(store.lookupDocumentTypeTerms("Progress Note"))
                    .containsExactly("progress", "status", "improvement", "response", "continuation");
        }

        @Test
        @DisplayName("Unknown or blank input should return empty results")
        void shouldReturnEmptyForUnknown() {
            assertThat(store.lookupSynonyms("xylophone")).isEmpty();
            assertThat(store.lookupAbbreviation("")).isEmpty();
            assertThat(store.lookupSpecialtyTerms("astrology")).isEmpty();
            assertThat(store.lookupDocumentTypeTerms("invoice")).isEmpty();
        }

        @Test
        @DisplayName("Should recognize multi-word phrases")
        void shouldRecognizePhrases() {
            assertThat(store.isKnownPhrase("plan of care")).isTrue();
            assertThat(store.isKnownPhrase("activities of daily living")).isTrue();
            assertThat(store.isKnownPhrase("plan of")).isFalse();
        }
    }

    @Nested
    @DisplayName("Loading and saving")
    class Loading {

        @Test
        @DisplayName("A malformed document should keep the previous table")
        void shouldKeepPreviousTableOnError() {
            final int before = store.size();
            final ByteArrayInputStream broken = new ByteArrayInputStream(
                    "terms: [ {term: x".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> store.load(broken, "broken.yaml"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("broken.yaml");
            assertThat(store.size()).isEqualTo(before);
            assertThat(store.lookupSynonyms("balance")).isNotEmpty();
        }

        @Test
        @DisplayName("A missing file should fail with ConfigurationException")
        void shouldRejectMissingFile(@TempDir final Path tempDir) {
            assertThatThrownBy(() -> store.load(tempDir.resolve("missing.yaml")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Saved vocabulary should load back with the same lookups")
        void shouldSaveAndReload(@TempDir final Path tempDir) throws Exception {
            final Path file = tempDir.resolve("vocabulary.yaml");
            store.save(file);

            final VocabularyStore reloaded = new VocabularyStore();
            reloaded.load(file);

            assertThat(reloaded.size()).isEqualTo(store.size());
            assertThat(reloaded.lookupSynonyms("physiotherapy")).isEqualTo(store.lookupSynonyms("physiotherapy"));
            assertThat(reloaded.lookupSpecialtyTerms("slp")).isEqualTo(store.lookupSpecialtyTerms("slp"));
            assertThat(reloaded.lookupDocumentTypeTerms("evaluation")).isEqualTo(store.lookupDocumentTypeTerms("evaluation"));
        }

        @Test
        @DisplayName("Duplicate terms should be rejected")
        void shouldRejectDuplicateTerms() {
            assertThatThrownBy(() -> store.replace(
                    List.of(TermEntry.synonymsOf("gait", "walking"), TermEntry.synonymsOf("Gait", "ambulation")),
                    Map.of(), Map.of()))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Readers should always see a complete table while it is replaced")
        void shouldSwapAtomically() throws Exception {
            final List<TermEntry> small = List.of(TermEntry.abbreviation("PT", "physical therapy"));
            final ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                final List<Future<Boolean>> readers = new ArrayList<>();
                for (int i = 0; i < 3; i++) {
                    readers.add(executor.submit(() -> {
                        for (int n = 0; n < 2_000; n++) {
                            // both tables expand PT to physical therapy
                            if (!store.lookupAbbreviation("PT").contains("physical therapy")) {
                                return false;
                            }
                        }
                        return true;
                    }));
                }
                for (int n = 0; n < 200; n++) {
                    if (n % 2 == 0) {
                        store.replace(small, Map.of(), Map.of());
                    } else {
                        store.loadDefaults();
                    }
                }
                for (final Future<Boolean> reader : readers) {
                    assertThat(reader.get(30, TimeUnit.SECONDS)).isTrue();
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
