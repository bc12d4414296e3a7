package com.roundgrader.checks;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.BoundingBox;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Interactive backend: a headless Chromium page driven by Playwright.
 * Owns the Playwright driver, the browser and the page; {@link #close()} releases all three.
 */
public class PlaywrightBackend implements CheckBackend {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBackend.class);

    static final String MODAL_SELECTOR = ".modal, .lightbox, [data-lightbox], [role=\"dialog\"]";
    static final String DISPLAY_SELECTOR = "input[type=\"text\"], .display, #display, [class*=\"display\"]";
    private static final int VIEWPORT_HEIGHT = 800;

    private final Playwright playwright;
    private final Browser browser;
    private final Page page;
    private final Duration pageLoadTimeout;
    private final Duration settleDelay;

    PlaywrightBackend(Playwright playwright, Browser browser, Page page,
                      Duration pageLoadTimeout, Duration settleDelay) {
        this.playwright = playwright;
        this.browser = browser;
        this.page = page;
        this.pageLoadTimeout = pageLoadTimeout;
        this.settleDelay = settleDelay;
    }

    /**
     * Start the driver and a headless browser. Partially created resources are released when any
     * step fails.
     */
    public static PlaywrightBackend launch(Duration pageLoadTimeout, Duration settleDelay) {
        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            br = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
            Page page = br.newPage();
            page.setDefaultTimeout(pageLoadTimeout.toMillis());
            logger.debug("Playwright browser launched");
            return new PlaywrightBackend(pw, br, page, pageLoadTimeout, settleDelay);
        } catch (RuntimeException e) {
            closeQuietly(br, "browser");
            closeQuietly(pw, "playwright");
            throw new BackendUnavailableException("Playwright not usable: " + e.getMessage(), e);
        }
    }

    /**
     * Factory for the engine; each call launches a fresh browser.
     */
    public static BackendFactory factory(Duration pageLoadTimeout, Duration settleDelay) {
        return () -> launch(pageLoadTimeout, settleDelay);
    }

    @Override
    public String name() {
        return "playwright";
    }

    @Override
    public boolean supportsInteraction() {
        return true;
    }

    @Override
    public void load(String url) throws IOException {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(pageLoadTimeout.toMillis()));
        } catch (TimeoutError e) {
            throw new IOException("Page failed to load: timeout", e);
        } catch (PlaywrightException e) {
            throw new IOException("Page failed to load: " + e.getMessage(), e);
        }
    }

    @Override
    public int countElements(String selector) {
        return page.querySelectorAll(selector).size();
    }

    @Override
    public Optional<String> findButton(List<String> texts) {
        for (String text : texts) {
            String quoted = quote(text);
            ElementHandle button = page.querySelector(
                    "button:has-text(" + quoted + "), [type=\"button\"]:has-text(" + quoted + ")");
            if (button != null) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    @Override
    public ClickEffect click(String selector, boolean expectModal) {
        ElementHandle element = page.querySelector(selector);
        if (element == null) {
            return ClickEffect.ELEMENT_MISSING;
        }
        element.click();
        settle();

        if (expectModal) {
            ElementHandle modal = page.querySelector(MODAL_SELECTOR);
            if (modal != null && modal.isVisible()) {
                return ClickEffect.EFFECT_CONFIRMED;
            }
        }
        return ClickEffect.CLICK_REGISTERED;
    }

    @Override
    public boolean laidOutAt(int width) {
        page.setViewportSize(width, VIEWPORT_HEIGHT);
        settle();
        ElementHandle body = page.querySelector("body");
        if (body == null) {
            return false;
        }
        BoundingBox box = body.boundingBox();
        return box != null && box.width > 0;
    }

    @Override
    public boolean pressKey(String key) {
        String before = page.content();
        page.keyboard().press(key);
        settle();
        return !before.equals(page.content());
    }

    @Override
    public boolean clickButton(String text) {
        String quoted = quote(text);
        ElementHandle button = page.querySelector(
                "button:text-is(" + quoted + "), input[type=\"button\"][value=" + quoted + "]");
        if (button == null) {
            return false;
        }
        button.click();
        page.waitForTimeout(100);
        return true;
    }

    @Override
    public Optional<String> readDisplay() {
        ElementHandle display = page.querySelector(DISPLAY_SELECTOR);
        if (display == null) {
            return Optional.empty();
        }
        String tag = String.valueOf(display.evaluate("el => el.tagName")).toLowerCase();
        String text = "input".equals(tag) ? display.inputValue() : display.innerText();
        return Optional.ofNullable(text).map(String::trim);
    }

    @Override
    public void close() {
        closeQuietly(page, "page");
        closeQuietly(browser, "browser");
        closeQuietly(playwright, "playwright");
    }

    private void settle() {
        page.waitForTimeout(settleDelay.toMillis());
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void closeQuietly(AutoCloseable resource, String what) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Error closing Playwright {}: {}", what, e.getMessage());
        }
    }
}
