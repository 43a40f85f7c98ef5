package com.mike.contactcardfinder.driver;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.service.behavior.IdentityRotator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightUiDriverFactory implements UiDriverFactory {

    private final ContactFinderProperties props;
    private final IdentityRotator identityRotator;

    @Override
    public UiDriver open(Path storageState) {
        var browserProps = props.getBrowser();
        Playwright pw = Playwright.create();
        try {
            Browser browser = pw.chromium().launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(browserProps.isHeadless())
                            .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage"))
            );

            String userAgent = identityRotator.identity();
            BrowserContext ctx = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(userAgent)
                    .setLocale(browserProps.getLocale())
                    .setTimezoneId(browserProps.getTimezoneId())
                    .setViewportSize(browserProps.getViewportWidth(), browserProps.getViewportHeight())
                    .setStorageStatePath(storageState));

            Page page = ctx.newPage();
            page.setDefaultTimeout(browserProps.getPageTimeoutMs());
            page.setDefaultNavigationTimeout(browserProps.getPageTimeoutMs());

            log.info("Lookup: browser ready headless={} ua={}", browserProps.isHeadless(), userAgent);

            ScreenPoint center = new ScreenPoint(browserProps.getViewportWidth() / 2.0,
                    browserProps.getViewportHeight() / 2.0);
            return new PlaywrightUiDriver(pw, browser, ctx, page, browserProps.getClickTimeoutMs(), center);
        } catch (PlaywrightException e) {
            pw.close();
            throw new UiDriverException("browser launch failed", e);
        }
    }
}
