package com.mike.contactcardfinder.driver;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;

import java.util.Optional;

class PlaywrightUiElement implements UiElement {

    private final Locator locator;
    private final int clickTimeoutMs;

    PlaywrightUiElement(Locator locator, int clickTimeoutMs) {
        this.locator = locator;
        this.clickTimeoutMs = clickTimeoutMs;
    }

    @Override
    public Optional<BoundingBox> boundingBox() {
        try {
            com.microsoft.playwright.options.BoundingBox box = locator.boundingBox();
            if (box == null) return Optional.empty();
            return Optional.of(new BoundingBox(box.x, box.y, box.width, box.height));
        } catch (PlaywrightException e) {
            throw new UiDriverException("boundingBox failed", e);
        }
    }

    @Override
    public void click() {
        try {
            locator.click(new Locator.ClickOptions().setTimeout(clickTimeoutMs));
        } catch (PlaywrightException e) {
            throw new UiDriverException("click failed", e);
        }
    }

    @Override
    public void fill(String text) {
        try {
            locator.fill(text);
        } catch (PlaywrightException e) {
            throw new UiDriverException("fill failed", e);
        }
    }

    @Override
    public void type(String text) {
        try {
            locator.pressSequentially(text);
        } catch (PlaywrightException e) {
            throw new UiDriverException("type failed", e);
        }
    }

    @Override
    public void press(String key) {
        try {
            locator.press(key);
        } catch (PlaywrightException e) {
            throw new UiDriverException("press " + key + " failed", e);
        }
    }

    @Override
    public String innerText() {
        try {
            return locator.innerText();
        } catch (PlaywrightException e) {
            throw new UiDriverException("innerText failed", e);
        }
    }

    @Override
    public Optional<String> attribute(String childSelector, String name) {
        try {
            Locator child = locator.locator(childSelector);
            if (child.count() == 0) return Optional.empty();
            return Optional.ofNullable(child.first().getAttribute(name));
        } catch (PlaywrightException e) {
            throw new UiDriverException("attribute " + name + " of " + childSelector + " failed", e);
        }
    }
}
