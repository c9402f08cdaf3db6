package com.storeflow.common.store;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the backing store cannot be reached or fails mid-operation. Transactions are
 * all-or-nothing, so no partial state is left behind.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
