package de.mirkosertic.mcp.ruleengine.feedback;

import java.io.IOException;
import java.util.List;

/**
 * Durable append-only storage behind the {@link FeedbackStore}.
 */
public interface FeedbackLog {

    void append(FeedbackSample sample) throws IOException;

    /**
     * @return all samples in append order
     */
    List<FeedbackSample> readAll() throws IOException;
}
