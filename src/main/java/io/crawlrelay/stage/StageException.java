package io.crawlrelay.stage;

/**
 * Raised when an already staged file cannot be rewritten, removed or renamed.
 */
public class StageException extends RuntimeException {
    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
