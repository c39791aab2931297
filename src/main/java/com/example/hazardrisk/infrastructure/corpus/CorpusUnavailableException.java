package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.controller.exception.BusinessException;
import org.springframework.http.HttpStatus;

/**
 * The incident store (relational table or lexical index) is missing or cannot be
 * reached. Always surfaced to the caller.
 */
public class CorpusUnavailableException extends BusinessException {

    public CorpusUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
