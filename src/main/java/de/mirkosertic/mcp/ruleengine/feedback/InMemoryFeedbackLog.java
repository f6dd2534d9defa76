package de.mirkosertic.mcp.ruleengine.feedback;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Non-durable log, used when no data directory is available and in tests.
 */
public class InMemoryFeedbackLog implements FeedbackLog {

    private final List<FeedbackSample> samples = new CopyOnWriteArrayList<>();

    @Override
    public void append(final FeedbackSample sample) {
        samples.add(sample);
    }

    @Override
    public List<FeedbackSample> readAll() {
        return List.copyOf(samples);
    }
}
