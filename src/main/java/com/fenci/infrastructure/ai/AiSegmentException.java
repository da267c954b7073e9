package com.fenci.infrastructure.ai;

/**
 * Any failure of the AI tokenization path. Never reaches the caller; the dispatcher falls back
 * to smart mode.
 */
public class AiSegmentException extends RuntimeException {

    public AiSegmentException(String message) {
        super(message);
    }

    public AiSegmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
