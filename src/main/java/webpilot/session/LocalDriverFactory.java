package webpilot.session;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;

/**
 * Starts a local browser. Selenium Manager downloads the matching driver
 * binary, so no chromedriver/geckodriver setup is needed.
 */
public class LocalDriverFactory implements DriverFactory {

    @Override
    public WebDriver create(SessionConfig config) {
        boolean headless = config.isHeadless();
        boolean insecure = config.isAcceptInsecureCerts();
        return switch (config.getBrowser().toLowerCase().trim()) {
            case "firefox" -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (headless) opts.addArguments("-headless");
                opts.setAcceptInsecureCerts(insecure);
                yield new FirefoxDriver(opts);
            }
            case "edge" -> {
                EdgeOptions opts = new EdgeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--window-size=1280,900");
                opts.setAcceptInsecureCerts(insecure);
                yield new EdgeDriver(opts);
            }
            default -> {
                ChromeOptions opts = new ChromeOptions();
                if (headless) opts.addArguments("--headless=new");
                opts.addArguments("--window-size=1280,900");
                opts.setAcceptInsecureCerts(insecure);
                yield new ChromeDriver(opts);
            }
        };
    }
}
