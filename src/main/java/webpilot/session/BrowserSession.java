package webpilot.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.dom.SeleniumLiveDom;
import webpilot.model.ElementDetail;
import webpilot.model.ElementNode;
import webpilot.model.InteractiveElement;
import webpilot.model.Snapshot;
import webpilot.resolver.ElementNotIndexedException;
import webpilot.resolver.ElementResolver;
import webpilot.resolver.ResolvedLocator;
import webpilot.snapshot.SnapshotBuilder;
import webpilot.snapshot.SnapshotOptions;
import webpilot.snapshot.TextAggregator;
import webpilot.vision.VisionService;
import webpilot.vision.VisionServiceFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One browser, one page, one current snapshot: the operations an external
 * decision process can invoke.
 *
 * <p>Every action takes a string payload and returns a string. Precondition,
 * parse and resolution problems come back as descriptive strings the caller
 * can act on; only a failed browser launch is thrown. Actions are strictly
 * serial; a session is not thread-safe.
 *
 * <pre>{@code
 * try (BrowserSession session = new BrowserSession(new SessionConfig())) {
 *     session.init();
 *     session.navigate("example.com");
 *     String listing = session.listInteractive();
 *     session.click("3");
 * }
 * }</pre>
 */
public class BrowserSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static final String NO_SESSION = "No active session. Call init() to start a new browser session.";
    public static final String NO_SNAPSHOT = "No DOM snapshot available. Use visitUrl first.";
    public static final String DEFAULT_VISION_PROMPT = "What is shown in this screenshot? if there is text, "
            + "always extract it. be as comprehensive as possible.";

    /** Sets a form field's value the way a user edit would, firing input and change. */
    static final String FILL_JS = """
            var el = arguments[0], value = arguments[1];
            var tag = el.tagName.toLowerCase();
            if (!el.isContentEditable && tag !== 'input' && tag !== 'textarea' && tag !== 'select') {
                throw new Error('Element is not an <input>, <textarea>, <select> or [contenteditable] element');
            }
            el.focus();
            if (el.isContentEditable) {
                el.textContent = value;
            } else {
                var proto = tag === 'textarea' ? HTMLTextAreaElement.prototype
                        : tag === 'select' ? HTMLSelectElement.prototype : HTMLInputElement.prototype;
                var descriptor = Object.getOwnPropertyDescriptor(proto, 'value');
                if (descriptor && descriptor.set) descriptor.set.call(el, value); else el.value = value;
            }
            el.dispatchEvent(new Event('input', { bubbles: true }));
            el.dispatchEvent(new Event('change', { bubbles: true }));
            """;

    static final String FORCE_CLICK_JS = "arguments[0].click();";

    private final SessionConfig config;
    private final DriverFactory driverFactory;
    private final VisionService vision;
    private final Function<WebDriver, SnapshotBuilder> builderFactory;
    private final ElementResolver resolver = new ElementResolver();
    private final ScreenshotCapture screenshots = new ScreenshotCapture();
    private final NetworkIdleWait idleWait;

    private SessionState state = SessionState.UNINITIALIZED;
    private WebDriver driver;
    private SnapshotBuilder builder;
    private Snapshot snapshot;

    public BrowserSession(SessionConfig config) {
        this(config, new LocalDriverFactory(), VisionServiceFactory.create(config), BrowserSession::seleniumBuilder);
    }

    /**
     * Package-private constructor for tests; injects the driver, vision and
     * snapshot-builder sources.
     */
    BrowserSession(SessionConfig config, DriverFactory driverFactory, VisionService vision,
                   Function<WebDriver, SnapshotBuilder> builderFactory) {
        this.config = config;
        this.driverFactory = driverFactory;
        this.vision = vision;
        this.builderFactory = builderFactory;
        this.idleWait = new NetworkIdleWait(config.getIdleQuietMs());
    }

    private static SnapshotBuilder seleniumBuilder(WebDriver driver) {
        SeleniumLiveDom dom = new SeleniumLiveDom(driver);
        return new SnapshotBuilder(dom, dom);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────────

    /**
     * Launches the browser. Calling it on a live session is a no-op; after
     * {@link #closeBrowser()} it starts a fresh browser.
     *
     * @throws WebPilotException if the browser cannot be started
     */
    public void init() {
        if (state == SessionState.READY) {
            log.warn("init() called on an active session, keeping the current browser");
            return;
        }
        log.info("Launching {} (headless={})", config.getBrowser(), config.isHeadless());
        try {
            driver = driverFactory.create(config);
        } catch (WebDriverException e) {
            throw new WebPilotException("Failed to launch browser '" + config.getBrowser() + "': "
                    + e.getMessage(), e);
        }
        builder = builderFactory.apply(driver);
        snapshot = null;
        state = SessionState.READY;
    }

    /** Quits the browser and discards the snapshot; without a live browser it reports no session. */
    public String closeBrowser() {
        if (!isActive()) return NO_SESSION;
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Error while quitting browser: {}", e.getMessage());
        }
        driver = null;
        builder = null;
        snapshot = null;
        state = SessionState.CLOSED;
        log.info("Browser session closed");
        return "Browser closed successfully.";
    }

    @Override
    public void close() {
        if (isActive()) closeBrowser();
    }

    public SessionState getState() {
        return state;
    }

    /** The current snapshot, if any action has produced one. */
    public Optional<Snapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * @throws WebPilotException when no browser is running
     */
    public String currentUrl() {
        requireDriver();
        return driver.getCurrentUrl();
    }

    // ── Actions ─────────────────────────────────────────────────────────────

    public String navigate(String url) {
        if (!isActive()) return NO_SESSION;
        String target = UrlNormalizer.normalize(url);
        if (target.isEmpty()) return "Error: No URL provided.";

        log.info("Navigating to {}", target);
        try {
            driver.get(target);
        } catch (TimeoutException e) {
            log.warn("Page load timed out for {}, continuing with partial page", target);
        } catch (WebDriverException e) {
            return "Error: Failed to navigate to " + target + ": " + firstLine(e);
        }
        idleWait.await(driver, config.getNavigationIdleTimeoutMs());

        Optional<String> failure = refresh(baseOptions());
        return failure.orElse("Visited URL: " + target + " and updated DOM snapshot.");
    }

    public String listInteractive() {
        if (!isActive()) return NO_SESSION;
        if (snapshot == null) return NO_SNAPSHOT;

        idleWait.await(driver, config.getListIdleTimeoutMs());
        Optional<String> failure = refresh(baseOptions());
        if (failure.isPresent()) return failure.get();
        return renderListing();
    }

    public String inspect(String payload) {
        if (!isActive()) return NO_SESSION;
        if (snapshot == null) return NO_SNAPSHOT;

        int index;
        try {
            index = ActionPayloads.parseIndex(payload);
        } catch (PayloadParseException e) {
            return e.getMessage();
        }
        Optional<ElementNode> found = snapshot.findByHighlightIndex(index);
        if (found.isEmpty()) {
            return "Error: No element found with highlightIndex = " + index;
        }
        ElementNode el = found.get();
        ElementDetail detail = new ElementDetail(
                el.getTagName(),
                el.getAttributes(),
                el.isVisible(),
                el.isTopElement(),
                TextAggregator.aggregate(el, TextAggregator.DISPLAY_LIMIT));

        Optional<String> failure = refresh(baseOptions().withFocus(index));
        if (failure.isPresent()) return failure.get();

        ObjectNode result = MAPPER.createObjectNode();
        result.set("element", MAPPER.valueToTree(detail));
        String message = "Element details for highlightIndex " + index;
        try {
            result.put("base64Image", base64(screenshots.viewport(driver)));
        } catch (WebDriverException e) {
            log.warn("Screenshot for element details failed: {}", firstLine(e));
            result.put("base64Image", "");
            message += " (screenshot unavailable: " + firstLine(e) + ")";
        }
        result.put("message", message);
        return write(result);
    }

    public String click(String payload) {
        if (!isActive()) return NO_SESSION;
        int index;
        ResolvedLocator locator;
        try {
            index = ActionPayloads.parseIndex(payload);
            locator = resolver.resolve(snapshot, index);
        } catch (PayloadParseException e) {
            return e.getMessage();
        } catch (ElementNotIndexedException e) {
            return "Error: " + e.getMessage();
        }

        log.info("Clicking index {} via {}", index, locator);
        performClick(locator);
        idleWait.await(driver, config.getActionIdleTimeoutMs());

        Optional<String> failure = refresh(baseOptions());
        if (failure.isPresent()) return failure.get();
        return "Clicked element with highlightIndex = " + index + ".\nnew state: " + renderListing();
    }

    public String fill(String payload) {
        if (!isActive()) return NO_SESSION;
        ActionPayloads.Fill fill;
        ResolvedLocator locator;
        try {
            fill = ActionPayloads.parseFill(payload);
            locator = resolver.resolve(snapshot, fill.highlightIndex());
        } catch (PayloadParseException e) {
            return e.getMessage();
        } catch (ElementNotIndexedException e) {
            return "Error: No element found for highlightIndex " + e.getHighlightIndex();
        }

        log.info("Filling index {} via {}", fill.highlightIndex(), locator);
        try {
            WebElement el = locator.locate(driver);
            ((JavascriptExecutor) driver).executeScript(FILL_JS, el, fill.text());
        } catch (WebDriverException e) {
            return "Error: Could not fill element with highlightIndex " + fill.highlightIndex()
                    + ": " + firstLine(e);
        }

        Optional<String> failure = refresh(baseOptions());
        return failure.orElse("Filled element at highlightIndex " + fill.highlightIndex()
                + " with \"" + fill.text() + "\"");
    }

    public String openDropdown(String payload) {
        if (!isActive()) return NO_SESSION;
        int index;
        ResolvedLocator locator;
        try {
            index = ActionPayloads.parseIndex(payload);
            locator = resolver.resolve(snapshot, index);
        } catch (PayloadParseException e) {
            return e.getMessage();
        } catch (ElementNotIndexedException e) {
            return "Error: " + e.getMessage();
        }

        log.info("Opening dropdown at index {} via {}", index, locator);
        try {
            locator.locate(driver).click();
        } catch (WebDriverException e) {
            return "Error: Could not open dropdown with highlightIndex " + index + ": " + firstLine(e);
        }
        idleWait.await(driver, config.getActionIdleTimeoutMs());

        Optional<String> failure = refresh(baseOptions());
        return failure.orElse("Opened dropdown/autocomplete for element with highlightIndex = " + index
                + " and updated the DOM snapshot.");
    }

    public String screenshot() {
        if (!isActive()) return NO_SESSION;
        ObjectNode result = MAPPER.createObjectNode();
        try {
            result.put("base64Image", base64(screenshots.viewport(driver)));
        } catch (WebDriverException e) {
            return "Error: Could not take screenshot: " + firstLine(e);
        }
        result.put("message", "Screenshot taken successfully.");
        return write(result);
    }

    public String analyzeScreenshot(String prompt) {
        if (!isActive()) return NO_SESSION;
        String question = prompt == null || prompt.isBlank() ? DEFAULT_VISION_PROMPT : prompt.trim();
        try {
            byte[] png = screenshots.viewport(driver);
            return vision.describe(png, question);
        } catch (IOException | WebDriverException e) {
            log.warn("Screenshot analysis failed: {}", e.getMessage());
            return "Error: Screenshot analysis failed: " + e.getMessage();
        }
    }

    public String saveScreenshot(String filename) {
        if (!isActive()) return NO_SESSION;
        String name = filename == null || filename.isBlank()
                ? "screenshot-" + System.currentTimeMillis() + ".png"
                : filename.trim();
        try {
            Path target = Path.of(name);
            if (target.getParent() != null) Files.createDirectories(target.getParent());
            Files.write(target, screenshots.viewport(driver));
            log.info("Screenshot saved to {}", target.toAbsolutePath());
            return "Screenshot saved to " + name;
        } catch (IOException | WebDriverException e) {
            return "Error: Could not save screenshot to " + name + ": " + e.getMessage();
        }
    }

    // ── Internals ───────────────────────────────────────────────────────────

    private boolean isActive() {
        return state == SessionState.READY && driver != null;
    }

    private void requireDriver() {
        if (!isActive()) throw new WebPilotException(NO_SESSION);
    }

    SnapshotOptions baseOptions() {
        return new SnapshotOptions(config.isHighlightEnabled(), SnapshotOptions.NO_FOCUS,
                config.getViewportExpansion());
    }

    /** Rebuilds the snapshot; returns an error string if the page could not be captured. */
    private Optional<String> refresh(SnapshotOptions options) {
        try {
            snapshot = builder.build(options);
            return Optional.empty();
        } catch (WebDriverException | WebPilotException e) {
            log.warn("Snapshot capture failed: {}", e.getMessage());
            return Optional.of("Error: Could not capture the page: " + firstLine(e));
        }
    }

    private void performClick(ResolvedLocator locator) {
        WebElement target = null;
        try {
            target = new WebDriverWait(driver, Duration.ofMillis(config.getClickTimeoutMs()))
                    .until(d -> {
                        WebElement el = locator.locate(d);
                        return el.isDisplayed() && el.isEnabled() ? el : null;
                    });
            target.click();
        } catch (WebDriverException e) {
            // Covered or detached targets are common after animations; the refreshed listing shows the outcome
            log.warn("Click via {} failed: {}", locator, firstLine(e));
            if (config.isForceClickFallback() && target != null) {
                forceClick(target);
            }
        }
    }

    private void forceClick(WebElement target) {
        try {
            ((JavascriptExecutor) driver).executeScript(FORCE_CLICK_JS, target);
            log.info("Forced script click succeeded");
        } catch (WebDriverException e) {
            log.warn("Forced script click failed: {}", firstLine(e));
        }
    }

    private String renderListing() {
        List<InteractiveElement> elements = snapshot.indexedElements().stream()
                .map(el -> new InteractiveElement(el.getHighlightIndex(), TextAggregator.aggregate(el),
                        el.getTagName()))
                .toList();
        ObjectNode result = MAPPER.createObjectNode();
        result.set("elements", MAPPER.valueToTree(elements));
        String message = "Clickable elements with page screenshot";
        try {
            byte[] png = config.isFullPageScreenshot()
                    ? screenshots.fullPage(driver)
                    : screenshots.viewport(driver);
            result.put("base64Image", base64(png));
        } catch (WebDriverException e) {
            // The element list is still usable without the image
            log.warn("Screenshot for listing failed: {}", firstLine(e));
            result.put("base64Image", "");
            message = "Clickable elements (screenshot unavailable: " + firstLine(e) + ")";
        }
        result.put("message", message);
        return write(result);
    }

    private static String base64(byte[] png) {
        return png == null ? "" : Base64.getEncoder().encodeToString(png);
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Cannot serialise action result", e);
        }
    }

    /** Selenium messages carry build and driver info after the first line. */
    private static String firstLine(RuntimeException e) {
        String msg = e.getMessage();
        if (msg == null) return e.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }
}
