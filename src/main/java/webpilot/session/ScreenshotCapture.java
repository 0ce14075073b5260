package webpilot.session;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.firefox.HasFullPageScreenshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Map;

/**
 * PNG screenshots of the viewport or of the whole scrollable page.
 *
 * <p>Full-page capture uses Firefox's native support or the Chromium DevTools
 * protocol; any other driver, or a failed attempt, falls back to the viewport.
 */
public class ScreenshotCapture {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotCapture.class);

    public byte[] viewport(WebDriver driver) {
        return ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
    }

    public byte[] fullPage(WebDriver driver) {
        try {
            if (driver instanceof HasFullPageScreenshot firefox) {
                return firefox.getFullPageScreenshotAs(OutputType.BYTES);
            }
            if (driver instanceof HasCdp cdp) {
                return viaCdp(cdp);
            }
        } catch (WebDriverException e) {
            log.warn("Full-page screenshot failed, using viewport: {}", e.getMessage());
        }
        return viewport(driver);
    }

    private byte[] viaCdp(HasCdp cdp) {
        Map<String, Object> metrics = cdp.executeCdpCommand("Page.getLayoutMetrics", Map.of());
        Object size = metrics.getOrDefault("cssContentSize", metrics.get("contentSize"));
        if (!(size instanceof Map<?, ?> content)) {
            throw new WebDriverException("Page.getLayoutMetrics returned no content size");
        }
        Map<String, Object> clip = Map.of(
                "x", 0,
                "y", 0,
                "width", toDouble(content.get("width")),
                "height", toDouble(content.get("height")),
                "scale", 1);
        Map<String, Object> shot = cdp.executeCdpCommand("Page.captureScreenshot", Map.of(
                "format", "png",
                "captureBeyondViewport", true,
                "clip", clip));
        Object data = shot.get("data");
        if (!(data instanceof String base64)) {
            throw new WebDriverException("Page.captureScreenshot returned no data");
        }
        return Base64.getDecoder().decode(base64);
    }

    private static double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0;
    }
}
