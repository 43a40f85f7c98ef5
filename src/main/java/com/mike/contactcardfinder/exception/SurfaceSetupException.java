package com.mike.contactcardfinder.exception;

/** Opening, filling or discarding the compose surface failed; affects a whole batch. */
public class SurfaceSetupException extends ContactLookupException {

    public SurfaceSetupException(String message) {
        super(message);
    }

    public SurfaceSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
