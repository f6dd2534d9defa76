package de.mirkosertic.mcp.ruleengine.feedback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FeedbackStore Tests")
class FeedbackStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private FeedbackStore store;

    @BeforeEach
    void setUp() {
        store = new FeedbackStore(new InMemoryFeedbackLog(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("Should record a valid sample with metadata and timestamp")
        void shouldRecordSample() {
            final FeedbackSample sample = store.record(" F-1 ", 0.8, true,
                    new FeedbackSample.FeedbackMetadata("pt", "progress_note", "PT-GAIT-001"));

            assertThat(sample.findingId()).isEqualTo("F-1");
            assertThat(sample.recordedAt()).isEqualTo(NOW);
            assertThat(sample.metadata().ruleId()).isEqualTo("PT-GAIT-001");
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.toPairs()).containsExactly(new CalibrationPair(0.8, true));
        }

        @ParameterizedTest(name = "confidence {0}")
        @ValueSource(doubles = {-0.01, 1.01, Double.NaN, Double.POSITIVE_INFINITY})
        @DisplayName("Should reject confidences outside [0, 1]")
        void shouldRejectInvalidConfidence(final double confidence) {
            assertThatThrownBy(() -> store.record("F-1", confidence, true))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("Should accept the bounds of the confidence range")
        void shouldAcceptBounds() {
            store.record("F-1", 0.0, false);
            store.record("F-2", 1.0, true);

            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject a blank finding id")
        void shouldRejectBlankFindingId() {
            assertThatThrownBy(() -> store.record("  ", 0.5, true)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.record(null, 0.5, true)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("A failed write should not record the sample")
        void shouldNotRecordWhenLogFails() throws Exception {
            // Given
            final FeedbackLog failing = mock(FeedbackLog.class);
            when(failing.readAll()).thenReturn(List.of());
            doThrow(new IOException("disk full")).when(failing).append(any());
            final FeedbackStore failingStore = new FeedbackStore(failing);

            // When / Then
            assertThatThrownBy(() -> failingStore.record("F-1", 0.5, true))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasRootCauseMessage("disk full");
            assertThat(failingStore.size()).isZero();
        }

        @Test
        @DisplayName("Concurrent writers should not lose samples")
        void shouldKeepAllSamplesFromConcurrentWriters() throws Exception {
            final int threads = 8;
            final int perThread = 250;
            final ExecutorService executor = Executors.newFixedThreadPool(threads);
            final CountDownLatch start = new CountDownLatch(1);
            try {
                final List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    final int thread = t;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            store.record("F-" + thread + "-" + i, 0.5, i % 2 == 0);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (final Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(store.size()).isEqualTo(threads * perThread);
            assertThat(store.snapshot()).extracting(FeedbackSample::findingId).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("sample should return nothing below the minimum count")
        void shouldRespectMinimumCount() {
            store.record("F-1", 0.9, true);
            store.record("F-2", 0.4, false);

            assertThat(store.sample(3)).isEmpty();
            assertThat(store.sample(2)).hasSize(2);
        }

        @Test
        @DisplayName("Snapshots should not change when more samples arrive")
        void shouldReturnStableSnapshots() {
            store.record("F-1", 0.9, true);
            final List<FeedbackSample> snapshot = store.snapshot();

            store.record("F-2", 0.4, false);

            assertThat(snapshot).hasSize(1);
            assertThatThrownBy(() -> snapshot.add(snapshot.get(0))).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Stats should aggregate counts and mean confidences")
        void shouldComputeStats() {
            store.record("F-1", 0.9, true, new FeedbackSample.FeedbackMetadata("pt", null, null));
            store.record("F-2", 0.7, true, new FeedbackSample.FeedbackMetadata("pt", null, null));
            store.record("F-3", 0.6, false, new FeedbackSample.FeedbackMetadata("slp", null, null));
            store.record("F-4", 0.2, false);

            final FeedbackStats stats = store.stats();

            assertThat(stats.total()).isEqualTo(4);
            assertThat(stats.correct()).isEqualTo(2);
            assertThat(stats.incorrect()).isEqualTo(2);
            assertThat(stats.accuracy()).isEqualTo(0.5);
            assertThat(stats.meanConfidenceCorrect()).isCloseTo(0.8, within(1e-12));
            assertThat(stats.meanConfidenceIncorrect()).isCloseTo(0.4, within(1e-12));
            assertThat(stats.byDiscipline()).containsEntry("pt", 2).containsEntry("slp", 1).containsEntry("unknown", 1);
        }

        @Test
        @DisplayName("Stats of an empty store should have undefined means")
        void shouldHandleEmptyStats() {
            final FeedbackStats stats = store.stats();

            assertThat(stats.total()).isZero();
            assertThat(stats.accuracy()).isNaN();
            assertThat(stats.meanConfidenceCorrect()).isNaN();
        }
    }

    @Test
    @DisplayName("Export should write every sample as a JSON array")
    void shouldExportSamples(@TempDir final Path tempDir) throws Exception {
        store.record("F-1", 0.9, true, new FeedbackSample.FeedbackMetadata("ot", "evaluation", "OT-ADL-001"));
        store.record("F-2", 0.3, false);
        final Path target = tempDir.resolve("export/feedback.json");

        store.exportTo(target);

        final JsonNode exported = new ObjectMapper().readTree(target.toFile());
        assertThat(exported.isArray()).isTrue();
        assertThat(exported).hasSize(2);
        assertThat(exported.get(0).get("ruleId").asText()).isEqualTo("OT-ADL-001");
        assertThat(exported.get(1).get("discipline").isNull()).isTrue();
        assertThat(exported.get(1).get("recordedAt").asText()).isEqualTo(NOW.toString());
    }
}
