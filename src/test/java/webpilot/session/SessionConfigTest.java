package webpilot.session;

import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SessionConfig}.
 *
 * <p>Most tests use the package-private {@code SessionConfig(Properties)}
 * constructor to avoid classpath file I/O.
 */
public class SessionConfigTest {

    // ── Default value tests ───────────────────────────────────────────────

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        SessionConfig cfg = new SessionConfig(new Properties());

        assertThat(cfg.getBrowser()).as("browser default").isEqualTo("chrome");
        assertThat(cfg.isHeadless()).as("headless default").isFalse();
        assertThat(cfg.isHighlightEnabled()).as("highlight default").isTrue();
        assertThat(cfg.getViewportExpansion()).as("viewport expansion default").isZero();
        assertThat(cfg.getClickTimeoutMs()).as("click timeout default").isEqualTo(5_000L);
        assertThat(cfg.isForceClickFallback()).as("force click default").isFalse();
        assertThat(cfg.getActionIdleTimeoutMs()).isEqualTo(6_000L);
        assertThat(cfg.getListIdleTimeoutMs()).isEqualTo(2_000L);
        assertThat(cfg.getNavigationIdleTimeoutMs()).isEqualTo(30_000L);
        assertThat(cfg.getIdleQuietMs()).isEqualTo(500L);
        assertThat(cfg.isVisionEnabled()).as("vision default").isFalse();
        assertThat(cfg.getVisionApiKeyEnv()).isEqualTo("OPENAI_API_KEY");
    }

    @Test(description = "The bundled config.properties loads and matches the defaults")
    public void testClasspathConfig() {
        SessionConfig cfg = new SessionConfig();

        assertThat(cfg.getBrowser()).isEqualTo("chrome");
        assertThat(cfg.getNavigationIdleTimeoutMs()).isEqualTo(30_000L);
        assertThat(cfg.getVisionModel()).isEqualTo("gpt-4o");
    }

    // ── Override tests ────────────────────────────────────────────────────

    @Test(description = "Values are read and trimmed from properties")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty(SessionConfig.KEY_BROWSER, " firefox ");
        p.setProperty(SessionConfig.KEY_HEADLESS, "true");
        p.setProperty(SessionConfig.KEY_VIEWPORT_EXPANSION, "-1");
        p.setProperty(SessionConfig.KEY_CLICK_TIMEOUT, "750");

        SessionConfig cfg = new SessionConfig(p);

        assertThat(cfg.getBrowser()).isEqualTo("firefox");
        assertThat(cfg.isHeadless()).isTrue();
        assertThat(cfg.getViewportExpansion()).isEqualTo(-1);
        assertThat(cfg.getClickTimeoutMs()).isEqualTo(750L);
    }

    @Test(description = "Invalid numbers and expansions below -1 fall back to defaults")
    public void testInvalidValues() {
        Properties p = new Properties();
        p.setProperty(SessionConfig.KEY_CLICK_TIMEOUT, "soon");
        p.setProperty(SessionConfig.KEY_VISION_TIMEOUT, "1m");
        p.setProperty(SessionConfig.KEY_VIEWPORT_EXPANSION, "-5");

        SessionConfig cfg = new SessionConfig(p);

        assertThat(cfg.getClickTimeoutMs()).isEqualTo(5_000L);
        assertThat(cfg.getVisionTimeoutSec()).isEqualTo(60);
        assertThat(cfg.getViewportExpansion()).isZero();
    }

    @Test(description = "with() returns a modified copy and leaves the original untouched")
    public void testWith() {
        SessionConfig base = new SessionConfig(new Properties());

        SessionConfig headless = base.with(SessionConfig.KEY_HEADLESS, "true");

        assertThat(headless.isHeadless()).isTrue();
        assertThat(base.isHeadless()).isFalse();
    }
}
