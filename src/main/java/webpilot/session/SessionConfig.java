package webpilot.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed session
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_BROWSER               = "browser.name";
    static final String KEY_HEADLESS              = "browser.headless";
    static final String KEY_INSECURE_CERTS        = "browser.accept.insecure.certs";
    static final String KEY_HIGHLIGHT             = "snapshot.highlight.enabled";
    static final String KEY_VIEWPORT_EXPANSION    = "snapshot.viewport.expansion";
    static final String KEY_FULL_PAGE_SCREENSHOT  = "snapshot.screenshot.full.page";
    static final String KEY_CLICK_TIMEOUT         = "action.click.timeout.ms";
    static final String KEY_FORCE_CLICK           = "action.click.force.fallback";
    static final String KEY_ACTION_IDLE_TIMEOUT   = "action.network.idle.timeout.ms";
    static final String KEY_LIST_IDLE_TIMEOUT     = "action.list.network.idle.timeout.ms";
    static final String KEY_NAV_IDLE_TIMEOUT      = "navigation.network.idle.timeout.ms";
    static final String KEY_IDLE_QUIET            = "network.idle.quiet.ms";
    static final String KEY_VISION_ENABLED        = "vision.enabled";
    static final String KEY_VISION_ENDPOINT       = "vision.endpoint";
    static final String KEY_VISION_MODEL          = "vision.model";
    static final String KEY_VISION_KEY_ENV        = "vision.api.key.env";
    static final String KEY_VISION_TIMEOUT        = "vision.timeout.sec";

    // Defaults
    private static final String  DEFAULT_BROWSER              = "chrome";
    private static final boolean DEFAULT_HEADLESS             = false;
    private static final boolean DEFAULT_INSECURE_CERTS       = true;
    private static final boolean DEFAULT_HIGHLIGHT            = true;
    private static final int     DEFAULT_VIEWPORT_EXPANSION   = 0;
    private static final boolean DEFAULT_FULL_PAGE_SCREENSHOT = true;
    private static final long    DEFAULT_CLICK_TIMEOUT        = 5_000L;
    private static final boolean DEFAULT_FORCE_CLICK          = false;
    private static final long    DEFAULT_ACTION_IDLE_TIMEOUT  = 6_000L;
    private static final long    DEFAULT_LIST_IDLE_TIMEOUT    = 2_000L;
    private static final long    DEFAULT_NAV_IDLE_TIMEOUT     = 30_000L;
    private static final long    DEFAULT_IDLE_QUIET           = 500L;
    private static final boolean DEFAULT_VISION_ENABLED       = false;
    private static final String  DEFAULT_VISION_ENDPOINT      = "https://api.openai.com/v1/chat/completions";
    private static final String  DEFAULT_VISION_MODEL         = "gpt-4o";
    private static final String  DEFAULT_VISION_KEY_ENV       = "OPENAI_API_KEY";
    private static final int     DEFAULT_VISION_TIMEOUT       = 60;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws WebPilotException if the base config.properties cannot be loaded
     */
    public SessionConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new WebPilotException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests; accepts an already-populated
     * {@link Properties} instance.
     */
    SessionConfig(Properties props) {
        this.props = props;
    }

    /** Copy of this configuration with one value replaced; used by the console for CLI flags. */
    public SessionConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, value);
        return new SessionConfig(copy);
    }

    // ── Browser ────────────────────────────────────────────────────────────

    /** Browser to launch: chrome, firefox or edge (default: chrome). */
    public String getBrowser() {
        return props.getProperty(KEY_BROWSER, DEFAULT_BROWSER).trim();
    }

    public boolean isHeadless() {
        return getBool(KEY_HEADLESS, DEFAULT_HEADLESS);
    }

    public boolean isAcceptInsecureCerts() {
        return getBool(KEY_INSECURE_CERTS, DEFAULT_INSECURE_CERTS);
    }

    // ── Snapshot ───────────────────────────────────────────────────────────

    public boolean isHighlightEnabled() {
        return getBool(KEY_HIGHLIGHT, DEFAULT_HIGHLIGHT);
    }

    /** Extra pixels around the viewport still counted as on-screen; -1 disables the check (default: 0). */
    public int getViewportExpansion() {
        int value = getInt(KEY_VIEWPORT_EXPANSION, DEFAULT_VIEWPORT_EXPANSION);
        if (value < -1) {
            log.warn("Invalid value for '{}': {}, using default {}", KEY_VIEWPORT_EXPANSION, value,
                    DEFAULT_VIEWPORT_EXPANSION);
            return DEFAULT_VIEWPORT_EXPANSION;
        }
        return value;
    }

    public boolean isFullPageScreenshot() {
        return getBool(KEY_FULL_PAGE_SCREENSHOT, DEFAULT_FULL_PAGE_SCREENSHOT);
    }

    // ── Actions ────────────────────────────────────────────────────────────

    /** Upper bound for a click, including waiting for the element to become clickable (default: 5000). */
    public long getClickTimeoutMs() {
        return getLong(KEY_CLICK_TIMEOUT, DEFAULT_CLICK_TIMEOUT);
    }

    /** Whether a failed click is retried as a script click (default: false). */
    public boolean isForceClickFallback() {
        return getBool(KEY_FORCE_CLICK, DEFAULT_FORCE_CLICK);
    }

    public long getActionIdleTimeoutMs() {
        return getLong(KEY_ACTION_IDLE_TIMEOUT, DEFAULT_ACTION_IDLE_TIMEOUT);
    }

    public long getListIdleTimeoutMs() {
        return getLong(KEY_LIST_IDLE_TIMEOUT, DEFAULT_LIST_IDLE_TIMEOUT);
    }

    public long getNavigationIdleTimeoutMs() {
        return getLong(KEY_NAV_IDLE_TIMEOUT, DEFAULT_NAV_IDLE_TIMEOUT);
    }

    /** Network silence required before the page counts as idle (default: 500). */
    public long getIdleQuietMs() {
        return getLong(KEY_IDLE_QUIET, DEFAULT_IDLE_QUIET);
    }

    // ── Vision ─────────────────────────────────────────────────────────────

    public boolean isVisionEnabled() {
        return getBool(KEY_VISION_ENABLED, DEFAULT_VISION_ENABLED);
    }

    public String getVisionEndpoint() {
        return props.getProperty(KEY_VISION_ENDPOINT, DEFAULT_VISION_ENDPOINT).trim();
    }

    public String getVisionModel() {
        return props.getProperty(KEY_VISION_MODEL, DEFAULT_VISION_MODEL).trim();
    }

    /** Name of the environment variable holding the vision API key. */
    public String getVisionApiKeyEnv() {
        return props.getProperty(KEY_VISION_KEY_ENV, DEFAULT_VISION_KEY_ENV).trim();
    }

    public int getVisionTimeoutSec() {
        return getInt(KEY_VISION_TIMEOUT, DEFAULT_VISION_TIMEOUT);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
