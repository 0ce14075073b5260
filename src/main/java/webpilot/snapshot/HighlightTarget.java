package webpilot.snapshot;

import webpilot.dom.ClientRect;

/**
 * An indexed element selected for an overlay, with the rect of the iframe
 * that encloses it (null in the main document).
 */
record HighlightTarget(int nodeId, int highlightIndex, ClientRect rect, ClientRect frameRect) {
}
