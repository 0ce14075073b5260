package webpilot.snapshot;

import webpilot.dom.ClientRect;
import webpilot.dom.OverlayBox;
import webpilot.dom.OverlaySurface;
import webpilot.model.Viewport;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns highlight targets into numbered, color-coded overlay boxes in page
 * coordinates and hands them to the {@link OverlaySurface}.
 */
public class OverlayRenderer {

    static final List<String> PALETTE = List.of(
            "#FF0000", "#00FF00", "#0000FF", "#FFA500", "#800080", "#008080",
            "#FF69B4", "#4B0082", "#FF4500", "#2E8B57", "#DC143C", "#4682B4");

    /** 10% alpha suffix for the box fill. */
    static final String BACKGROUND_ALPHA = "1A";

    static final double LABEL_WIDTH = 20;
    static final double LABEL_HEIGHT = 16;

    private final OverlaySurface surface;

    public OverlayRenderer(OverlaySurface surface) {
        this.surface = surface;
    }

    void render(List<HighlightTarget> targets, Viewport viewport) {
        if (targets.isEmpty()) return;
        List<OverlayBox> boxes = new ArrayList<>(targets.size());
        for (HighlightTarget t : targets) {
            boxes.add(box(t, viewport));
        }
        surface.paintOverlays(boxes);
    }

    static OverlayBox box(HighlightTarget target, Viewport viewport) {
        ClientRect rect = target.rect();
        double top = rect.getTop() + viewport.getScrollY();
        double left = rect.getLeft() + viewport.getScrollX();
        if (target.frameRect() != null) {
            top += target.frameRect().getTop();
            left += target.frameRect().getLeft();
        }
        double width = rect.getWidth();
        double height = rect.getHeight();

        double labelTop = top + 2;
        double labelLeft = left + width - LABEL_WIDTH - 2;
        if (width < LABEL_WIDTH + 4 || height < LABEL_HEIGHT + 4) {
            labelTop = top - LABEL_HEIGHT - 2;
            labelLeft = left + width - LABEL_WIDTH;
        }

        int index = target.highlightIndex();
        String color = colorFor(index);
        return new OverlayBox(
                target.nodeId(),
                OverlaySurface.MARKER_PREFIX + index,
                String.valueOf(index),
                color,
                color + BACKGROUND_ALPHA,
                top, left, width, height,
                labelTop, labelLeft,
                fontSize(height));
    }

    static String colorFor(int index) {
        return PALETTE.get(index % PALETTE.size());
    }

    static double fontSize(double boxHeight) {
        return Math.min(12, Math.max(8, boxHeight / 2));
    }
}
