package webpilot.session;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Waits until the page is loaded and the network has been quiet for a while.
 *
 * <p>XHR and fetch calls are counted by an interceptor installed into the page.
 * Requests that started before the interceptor was installed are covered by
 * the resource timing entries. A timeout is not an error: the caller proceeds
 * with whatever state the page is in.
 */
public class NetworkIdleWait {

    private static final Logger log = LoggerFactory.getLogger(NetworkIdleWait.class);

    /** Polling interval (milliseconds). */
    public static final int POLL_MS = 100;

    static final String INSTALL_JS = """
            if (!window.__webpilotNet) {
                var net = window.__webpilotNet = { pending: 0, lastActivity: Date.now() };
                var origOpen = XMLHttpRequest.prototype.open;
                XMLHttpRequest.prototype.open = function() {
                    net.pending++;
                    net.lastActivity = Date.now();
                    this.addEventListener('loadend', function() {
                        net.pending = Math.max(0, net.pending - 1);
                        net.lastActivity = Date.now();
                    });
                    return origOpen.apply(this, arguments);
                };
                var origFetch = window.fetch;
                if (origFetch) {
                    window.fetch = function() {
                        net.pending++;
                        net.lastActivity = Date.now();
                        return origFetch.apply(this, arguments).finally(function() {
                            net.pending = Math.max(0, net.pending - 1);
                            net.lastActivity = Date.now();
                        });
                    };
                }
            }
            """;

    /** Returns [readyState, pendingRequests, millisecondsSinceLastActivity]. */
    static final String STATE_JS = """
            var net = window.__webpilotNet || { pending: 0, lastActivity: 0 };
            var lastResource = 0;
            var entries = performance.getEntriesByType('resource');
            for (var i = 0; i < entries.length; i++) {
                lastResource = Math.max(lastResource, entries[i].responseEnd);
            }
            var last = Math.max(net.lastActivity, performance.timeOrigin + lastResource);
            return [document.readyState, net.pending, Date.now() - last];
            """;

    private final long quietMs;

    public NetworkIdleWait(long quietMs) {
        this.quietMs = quietMs;
    }

    /**
     * Blocks until idle or until {@code timeoutMs} has passed.
     *
     * @return true if the page went idle, false on timeout
     */
    public boolean await(WebDriver driver, long timeoutMs) {
        JavascriptExecutor js = (JavascriptExecutor) driver;
        try {
            js.executeScript(INSTALL_JS);
        } catch (WebDriverException e) {
            log.debug("Could not install network counters: {}", e.getMessage());
        }
        try {
            new WebDriverWait(driver, Duration.ofMillis(timeoutMs), Duration.ofMillis(POLL_MS))
                    .until(d -> isIdle(js));
            log.debug("Network idle confirmed");
            return true;
        } catch (TimeoutException e) {
            log.info("Network not idle after {}ms, continuing", timeoutMs);
            return false;
        }
    }

    boolean isIdle(JavascriptExecutor js) {
        try {
            Object state = js.executeScript(STATE_JS);
            if (!(state instanceof List<?> values) || values.size() < 3) return true;
            boolean loaded = "complete".equals(values.get(0));
            long pending = values.get(1) instanceof Number n ? n.longValue() : 0;
            long idle = values.get(2) instanceof Number n ? n.longValue() : Long.MAX_VALUE;
            return loaded && pending == 0 && idle >= quietMs;
        } catch (WebDriverException e) {
            // Page is navigating; the next poll sees the new document
            return false;
        }
    }
}
