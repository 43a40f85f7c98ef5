package com.mike.contactcardfinder.exception;

/** Contact card did not become visible in time. */
public class CardTimeoutException extends ContactLookupException {

    public CardTimeoutException(String message) {
        super(message);
    }

    public CardTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
