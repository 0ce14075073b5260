package webpilot.dom;

import java.util.List;

/**
 * The topmost node at a point and its ancestor chain, innermost first.
 * Nodes the capture never registered appear as {@code -1}.
 *
 * <p>For the main document the chain stops below the document element; for a
 * shadow root it ends at the root's top-level element.
 */
public record HitTarget(List<Integer> chain) {

    public HitTarget {
        chain = List.copyOf(chain);
    }

    public int nodeId() {
        return chain.isEmpty() ? -1 : chain.get(0);
    }

    /** True if the node with {@code id} is the hit node or one of its ancestors. */
    public boolean reaches(int id) {
        return chain.contains(id);
    }
}
