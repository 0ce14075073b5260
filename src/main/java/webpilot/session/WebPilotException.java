package webpilot.session;

/**
 * Unchecked exception thrown by WebPilot components when an operation cannot
 * be completed: the browser failed to launch, the page could not be captured,
 * an index did not resolve.
 */
public class WebPilotException extends RuntimeException {

    public WebPilotException(String msg) {
        super(msg);
    }

    public WebPilotException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
