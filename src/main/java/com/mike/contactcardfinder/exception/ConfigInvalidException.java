package com.mike.contactcardfinder.exception;

/** Configuration rejected at startup or before a run. Fatal. */
public class ConfigInvalidException extends ContactLookupException {

    public ConfigInvalidException(String message) {
        super(message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
