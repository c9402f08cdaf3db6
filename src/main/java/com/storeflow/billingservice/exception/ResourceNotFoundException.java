package com.storeflow.billingservice.exception;


import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Custom exception thrown when a requested resource cannot be found in the system.
 * <p>
 * Typically used when an operation fetches an invoice, product or customer by its
 * identifier and no such document exists. It is mapped to a 404 Not Found HTTP status.
 *
 * By extending RuntimeException, it is an "unchecked" exception.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResourceNotFoundException extends RuntimeException {

    /**
     * @param message the detail message (e.g., "Invoice with ID inv_123 not found.").
     */
    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
