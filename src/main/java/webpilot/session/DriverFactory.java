package webpilot.session;

import org.openqa.selenium.WebDriver;

/** Launches the browser a session drives. */
@FunctionalInterface
public interface DriverFactory {

    WebDriver create(SessionConfig config);
}
