package com.mike.contactcardfinder.exception;

public class TokenNotFoundException extends ContactLookupException {

    public TokenNotFoundException(String message) {
        super(message);
    }

    public TokenNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
