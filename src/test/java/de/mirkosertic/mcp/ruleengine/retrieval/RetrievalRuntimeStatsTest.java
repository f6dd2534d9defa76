package de.mirkosertic.mcp.ruleengine.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetrievalRuntimeStats Tests")
class RetrievalRuntimeStatsTest {

    @Test
    @DisplayName("Should aggregate counters and percentiles")
    void shouldAggregate() {
        final RetrievalRuntimeStats stats = new RetrievalRuntimeStats();
        for (int i = 1; i <= 100; i++) {
            stats.record(i, 4, 2, i % 10 == 0 ? 0 : 3, i % 2 == 0);
        }

        assertThat(stats.getRetrievals()).isEqualTo(100);
        assertThat(stats.getEmptyResults()).isEqualTo(10);
        assertThat(stats.getRerankedRetrievals()).isEqualTo(50);
        assertThat(stats.getMaxMicros()).isEqualTo(100);
        assertThat(stats.getAverageMicros()).isEqualTo(50.5);
        assertThat(stats.getAverageLexicalHits()).isEqualTo(4.0);
        assertThat(stats.getAverageReturned()).isEqualTo(2.7);
        assertThat(stats.getPercentiles()).isEqualTo(new RetrievalRuntimeStats.Percentiles(50, 90, 99));
    }

    @Test
    @DisplayName("Reset should clear everything")
    void shouldReset() {
        final RetrievalRuntimeStats stats = new RetrievalRuntimeStats();
        stats.record(10, 1, 1, 1, false);

        stats.reset();

        assertThat(stats.getRetrievals()).isZero();
        assertThat(stats.getAverageMicros()).isZero();
        assertThat(stats.getPercentiles()).isNull();
    }
}
