package webpilot.resolver;

/** Which resolution tier produced a locator, in priority order. */
public enum LocatorStrategy {
    HIGHLIGHT_ATTRIBUTE,
    ROLE,
    TEXT,
    ID,
    CLASS,
    COMPOSITE
}
