package com.mike.contactcardfinder.exception;

/**
 * Base type for every failure the lookup pipeline knows how to classify.
 */
public abstract class ContactLookupException extends RuntimeException {

    protected ContactLookupException(String message) {
        super(message);
    }

    protected ContactLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
