package webpilot.session;

/** An action payload did not have the expected shape; the message says what was expected. */
public class PayloadParseException extends WebPilotException {

    public PayloadParseException(String msg) {
        super(msg);
    }
}
