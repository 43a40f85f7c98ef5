package com.mike.contactcardfinder.exception;

/** Stored browser session is missing, unreadable or expired. Fatal, checked before any batch. */
public class SessionInvalidException extends ContactLookupException {

    public SessionInvalidException(String message) {
        super(message);
    }

    public SessionInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
