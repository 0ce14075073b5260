package webpilot.session;

/** Lifecycle of a {@link BrowserSession}. */
public enum SessionState {
    UNINITIALIZED,
    READY,
    CLOSED
}
