package com.mike.contactcardfinder.driver;

import java.util.Optional;

/**
 * A single element on the page: a recipient token, an input box or a contact card.
 */
public interface UiElement {

    /** Empty when the element is not rendered or has no layout box. */
    Optional<BoundingBox> boundingBox();

    void click();

    void fill(String text);

    /** Sends the given characters as key presses, without delay between them. */
    void type(String text);

    void press(String key);

    String innerText();

    /** Attribute of the first descendant matching the selector, if any. */
    Optional<String> attribute(String childSelector, String name);
}
