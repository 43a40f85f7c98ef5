package com.mike.contactcardfinder.driver;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Exclusive, single-threaded handle on one browser page. Every call may throw {@link UiDriverException}.
 */
public interface UiDriver extends AutoCloseable {

    String currentUrl();

    void navigate(String url);

    Optional<UiElement> locate(String selector);

    Optional<UiElement> locateByRole(String role, String accessibleName);

    /** First span whose whole text equals {@code text}, ignoring case. */
    Optional<UiElement> locateByText(String text);

    /** @return false on timeout, never throws for it */
    boolean waitVisible(String selector, int timeoutMs);

    String innerText(String selector);

    void pressKey(String key);

    void movePointer(double x, double y);

    void clickPointer(double x, double y);

    /** Last position the pointer was moved to, or the viewport center before the first move. */
    ScreenPoint pointerPosition();

    void blurActiveElement();

    void screenshot(Path path);

    @Override
    void close();
}
