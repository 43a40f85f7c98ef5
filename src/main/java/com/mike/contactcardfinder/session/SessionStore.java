package com.mike.contactcardfinder.session;

import java.nio.file.Path;

/**
 * Authenticated browser state saved by an earlier interactive login.
 */
public interface SessionStore {

    boolean isValid();

    /**
     * @throws com.mike.contactcardfinder.exception.SessionInvalidException when the state is missing or unusable
     */
    Path requireStorageState();
}
