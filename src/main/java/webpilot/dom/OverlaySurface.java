package webpilot.dom;

import java.util.List;

/**
 * Where highlight overlays are drawn.
 */
public interface OverlaySurface {

    /** Attribute written onto every highlighted element; its value is {@code webpilot-highlight-<index>}. */
    String MARKER_ATTRIBUTE = "webpilot-highlight-id";

    String MARKER_PREFIX = "webpilot-highlight-";

    /** Removes the previous overlay container and every marker attribute. */
    void clearOverlays();

    void paintOverlays(List<OverlayBox> boxes);
}
