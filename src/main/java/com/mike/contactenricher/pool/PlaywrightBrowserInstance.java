package com.mike.contactenricher.pool;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.mike.contactenricher.config.EnricherProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * One Playwright driver, one browser process and one browsing context.
 * Playwright objects are not thread-safe; the pool hands an instance to one caller at a time.
 */
@Slf4j
public class PlaywrightBrowserInstance implements BrowserInstance {

    private static final String MEMORY_SCRIPT =
            "() => (performance && performance.memory) ? performance.memory.usedJSHeapSize : 0";

    private static final int NETWORK_IDLE_TIMEOUT_MS = 5_000;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final String id;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;

    PlaywrightBrowserInstance(String id, EnricherProperties.Pool props) {
        this.id = id;
        this.playwright = Playwright.create();
        try {
            this.browser = browserType(playwright, props.getBrowserType()).launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(props.isHeadless())
                            // Render / Docker
                            .setArgs(List.of(
                                    "--no-sandbox",
                                    "--disable-dev-shm-usage",
                                    "--disable-gpu",
                                    "--disable-extensions")));

            this.context = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(props.getUserAgent())
                    .setViewportSize(1920, 1080)
                    .setJavaScriptEnabled(true)
                    .setIgnoreHTTPSErrors(true));
            context.setDefaultNavigationTimeout(props.getNavigationTimeoutMillis());
            context.newPage();
        } catch (PlaywrightException e) {
            playwright.close();
            throw e;
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public double sampleMemoryMb() {
        double bytes = 0;
        for (Page page : context.pages()) {
            Object value = page.evaluate(MEMORY_SCRIPT);
            if (value instanceof Number number) {
                bytes += number.doubleValue();
            }
        }
        return bytes / BYTES_PER_MB;
    }

    @Override
    public int openPageCount() {
        return context.pages().size();
    }

    @Override
    public void resetState() {
        context.clearCookies();
        context.clearPermissions();

        List<Page> pages = context.pages();
        for (int i = 1; i < pages.size(); i++) {
            pages.get(i).close();
        }

        Page first = pages.isEmpty() ? context.newPage() : pages.get(0);
        first.navigate("about:blank");
    }

    @Override
    public PageSnapshot load(String url, int timeoutMillis) {
        Page page = context.newPage();
        try {
            Response response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeoutMillis)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));

            try {
                page.waitForLoadState(LoadState.NETWORKIDLE,
                        new Page.WaitForLoadStateOptions().setTimeout(NETWORK_IDLE_TIMEOUT_MS));
            } catch (PlaywrightException e) {
                log.debug("POOL: {} did not reach network idle, using DOM as is", url);
            }

            return new PageSnapshot(
                    response == null ? 0 : response.status(),
                    page.url(),
                    page.title(),
                    page.content());
        } finally {
            page.close();
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }

    private static BrowserType browserType(Playwright playwright, String name) {
        return switch (name == null ? "chromium" : name.toLowerCase(Locale.ROOT)) {
            case "firefox" -> playwright.firefox();
            case "webkit" -> playwright.webkit();
            default -> playwright.chromium();
        };
    }
}
