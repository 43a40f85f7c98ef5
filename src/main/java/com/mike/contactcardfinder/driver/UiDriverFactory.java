package com.mike.contactcardfinder.driver;

import java.nio.file.Path;

@FunctionalInterface
public interface UiDriverFactory {

    /** Opens a fresh browser page authenticated with the given storage state. */
    UiDriver open(Path storageState);
}
