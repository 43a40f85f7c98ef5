package com.mike.contactcardfinder.driver;

/**
 * I/O failure talking to the browser (navigation, selector, keyboard or pointer call).
 */
public class UiDriverException extends RuntimeException {

    public UiDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
