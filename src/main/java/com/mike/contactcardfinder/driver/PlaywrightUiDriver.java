package com.mike.contactcardfinder.driver;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.microsoft.playwright.options.LoadState.NETWORKIDLE;

/**
 * {@link UiDriver} over one Playwright page. Owns the whole Playwright stack and closes it.
 */
@Slf4j
public class PlaywrightUiDriver implements UiDriver {

    private static final int NETWORK_IDLE_TIMEOUT_MS = 7000;

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final int clickTimeoutMs;

    private ScreenPoint pointer;

    PlaywrightUiDriver(Playwright playwright, Browser browser, BrowserContext context, Page page,
                       int clickTimeoutMs, ScreenPoint initialPointer) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.clickTimeoutMs = clickTimeoutMs;
        this.pointer = initialPointer;
    }

    @Override
    public String currentUrl() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            throw new UiDriverException("url failed", e);
        }
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw new UiDriverException("navigate " + url + " failed", e);
        }

        try {
            page.waitForLoadState(NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(NETWORK_IDLE_TIMEOUT_MS));
        } catch (PlaywrightException e) {
            log.debug("Lookup: network not idle after {}ms on {}", NETWORK_IDLE_TIMEOUT_MS, url);
        }
    }

    @Override
    public Optional<UiElement> locate(String selector) {
        return present(() -> page.locator(selector), "locate " + selector);
    }

    @Override
    public Optional<UiElement> locateByRole(String role, String accessibleName) {
        AriaRole ariaRole = AriaRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        return present(() -> page.getByRole(ariaRole, new Page.GetByRoleOptions().setName(accessibleName)),
                "locate role " + role + " '" + accessibleName + "'");
    }

    @Override
    public Optional<UiElement> locateByText(String text) {
        Pattern exact = Pattern.compile("^\\s*" + Pattern.quote(text.trim()) + "\\s*$", Pattern.CASE_INSENSITIVE);
        return present(() -> page.locator("span", new Page.LocatorOptions().setHasText(exact)),
                "locate text '" + text + "'");
    }

    @Override
    public boolean waitVisible(String selector, int timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(timeoutMs));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throw new UiDriverException("wait for " + selector + " failed", e);
        }
    }

    @Override
    public String innerText(String selector) {
        try {
            return page.innerText(selector);
        } catch (PlaywrightException e) {
            throw new UiDriverException("innerText " + selector + " failed", e);
        }
    }

    @Override
    public void pressKey(String key) {
        try {
            page.keyboard().press(key);
        } catch (PlaywrightException e) {
            throw new UiDriverException("press " + key + " failed", e);
        }
    }

    @Override
    public void movePointer(double x, double y) {
        try {
            page.mouse().move(x, y);
            pointer = new ScreenPoint(x, y);
        } catch (PlaywrightException e) {
            throw new UiDriverException("mouse move failed", e);
        }
    }

    @Override
    public void clickPointer(double x, double y) {
        try {
            page.mouse().click(x, y);
            pointer = new ScreenPoint(x, y);
        } catch (PlaywrightException e) {
            throw new UiDriverException("mouse click failed", e);
        }
    }

    @Override
    public ScreenPoint pointerPosition() {
        return pointer;
    }

    @Override
    public void blurActiveElement() {
        try {
            page.evaluate("() => { if (document.activeElement) document.activeElement.blur(); }");
        } catch (PlaywrightException e) {
            throw new UiDriverException("blur failed", e);
        }
    }

    @Override
    public void screenshot(Path path) {
        try {
            page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true));
        } catch (PlaywrightException e) {
            throw new UiDriverException("screenshot " + path + " failed", e);
        }
    }

    @Override
    public void close() {
        try { context.close(); } catch (PlaywrightException e) { log.debug("Lookup: context close: {}", e.getMessage()); }
        try { browser.close(); } catch (PlaywrightException e) { log.debug("Lookup: browser close: {}", e.getMessage()); }
        playwright.close();
    }

    private Optional<UiElement> present(java.util.function.Supplier<Locator> query, String what) {
        try {
            Locator locator = query.get();
            if (locator.count() == 0) return Optional.empty();
            return Optional.of(new PlaywrightUiElement(locator.first(), clickTimeoutMs));
        } catch (PlaywrightException e) {
            throw new UiDriverException(what + " failed", e);
        }
    }
}
