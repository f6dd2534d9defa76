package de.mirkosertic.mcp.ruleengine.retrieval;

/**
 * No usable rule index: the catalog was empty, the index could not be built, or retrieval ran
 * before any index was built. Retrieval fails closed in this state.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(final String message) {
        super(message);
    }

    public IndexUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
