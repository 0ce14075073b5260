package webpilot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One complete structural capture of the page, rooted at {@code body}.
 *
 * <p>Highlight indices are only meaningful against the snapshot that assigned
 * them; every mutating action replaces the session's snapshot wholesale.
 */
public class Snapshot {

    private final ElementNode root;
    private final Viewport viewport;
    private final Instant capturedAt;
    private final int highlightCount;

    public Snapshot(ElementNode root, Viewport viewport, Instant capturedAt, int highlightCount) {
        this.root = Objects.requireNonNull(root, "root");
        this.viewport = viewport;
        this.capturedAt = capturedAt;
        this.highlightCount = highlightCount;
    }

    public ElementNode getRoot()     { return root; }
    public Viewport getViewport()    { return viewport; }
    public Instant getCapturedAt()   { return capturedAt; }
    public int getHighlightCount()   { return highlightCount; }

    /** Depth-first, pre-order lookup of the element carrying {@code highlightIndex}. */
    public Optional<ElementNode> findByHighlightIndex(int highlightIndex) {
        if (highlightIndex < 0) return Optional.empty();
        Deque<SnapshotNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SnapshotNode node = stack.pop();
            if (node instanceof ElementNode el) {
                if (el.getHighlightIndex() == highlightIndex) return Optional.of(el);
                List<SnapshotNode> children = el.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /** All indexed elements in pre-order, which is also ascending index order. */
    public List<ElementNode> indexedElements() {
        List<ElementNode> out = new ArrayList<>();
        collectIndexed(root, out);
        return out;
    }

    private static void collectIndexed(SnapshotNode node, List<ElementNode> out) {
        if (!(node instanceof ElementNode el)) return;
        if (el.isIndexed()) out.add(el);
        for (SnapshotNode child : el.getChildren()) {
            collectIndexed(child, out);
        }
    }

    @Override
    public String toString() {
        return "Snapshot{indexed=" + highlightCount + ", capturedAt=" + capturedAt + "}";
    }
}
