package com.example.hazardrisk.infrastructure.search;

/**
 * The lexical engine rejected the query text. Distinct from an empty result so
 * callers can fall back to a simpler search.
 */
public class MalformedQueryException extends RuntimeException {

    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
