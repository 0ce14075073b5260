package webpilot.snapshot;

/**
 * Per-build options.
 *
 * @param highlight         paint numbered overlays for indexed elements
 * @param focusIndex        when {@code >= 0}, paint only the element with this index
 * @param viewportExpansion pixels beyond the visible viewport that still count as
 *                          on-screen; {@link #UNBOUNDED} disables the viewport check
 */
public record SnapshotOptions(boolean highlight, int focusIndex, int viewportExpansion) {

    public static final int NO_FOCUS = -1;
    public static final int UNBOUNDED = -1;

    public SnapshotOptions {
        if (viewportExpansion < UNBOUNDED) {
            throw new IllegalArgumentException("viewportExpansion must be >= 0 or -1, got " + viewportExpansion);
        }
    }

    public static SnapshotOptions defaults() {
        return new SnapshotOptions(true, NO_FOCUS, 0);
    }

    public SnapshotOptions withFocus(int index) {
        return new SnapshotOptions(highlight, index, viewportExpansion);
    }

    public SnapshotOptions withHighlight(boolean enabled) {
        return new SnapshotOptions(enabled, focusIndex, viewportExpansion);
    }

    public SnapshotOptions withViewportExpansion(int expansion) {
        return new SnapshotOptions(highlight, focusIndex, expansion);
    }

    public boolean isUnbounded() {
        return viewportExpansion == UNBOUNDED;
    }

    /** True if the element with {@code index} should get an overlay. */
    boolean paints(int index) {
        return highlight && (focusIndex < 0 || focusIndex == index);
    }
}
