package webpilot.resolver;

import webpilot.session.WebPilotException;

/** Thrown when a highlight index does not exist in the current snapshot. */
public class ElementNotIndexedException extends WebPilotException {

    private final int highlightIndex;

    public ElementNotIndexedException(int highlightIndex) {
        super("No element found with highlightIndex = " + highlightIndex);
        this.highlightIndex = highlightIndex;
    }

    public int getHighlightIndex() {
        return highlightIndex;
    }
}
