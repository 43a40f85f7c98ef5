package com.mike.contactcardfinder.exception;

public class ExtractionFailureException extends ContactLookupException {

    public ExtractionFailureException(String message) {
        super(message);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
