package com.example.hazardrisk.infrastructure.search;

/**
 * The lexical index has not been created yet. The relational corpus is still
 * reachable, so callers can answer from a substring search instead.
 */
public class LexicalIndexMissingException extends RuntimeException {

    public LexicalIndexMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
