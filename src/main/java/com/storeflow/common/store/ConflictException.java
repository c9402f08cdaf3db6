package com.storeflow.common.store;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a transaction's snapshot was invalidated by a concurrent writer, or when the caller
 * worked from state that is no longer current. Nothing was written; the caller must re-read and
 * retry with fresh data.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
