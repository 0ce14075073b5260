package webpilot.dom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the live rendered page the snapshot builder classifies.
 *
 * <p>Implementations talk to a real browser; tests substitute an in-memory tree.
 */
public interface LiveDom {

    /** Captures the raw node tree from {@code body} down, including iframes and shadow roots. */
    LiveTree queryLiveTree();

    ComputedStyle computeStyle(LiveNode node);

    /**
     * Returns the topmost element at the given viewport point within {@code scope},
     * or empty when nothing is there.
     *
     * @throws RuntimeException when the browser cannot answer; callers decide how to degrade
     */
    Optional<HitTarget> hitTest(HitScope scope, double x, double y);

    /**
     * Hit-tests many points at once. A point the browser could not answer is
     * left out of the result.
     *
     * <p>The default runs {@link #hitTest} per point; browser-backed
     * implementations answer the whole batch in one round trip.
     *
     * @throws RuntimeException when the batch as a whole cannot be answered
     */
    default Map<HitPoint, Optional<HitTarget>> hitTestAll(Collection<HitPoint> points) {
        Logger log = LoggerFactory.getLogger(LiveDom.class);
        Map<HitPoint, Optional<HitTarget>> results = new LinkedHashMap<>();
        for (HitPoint point : points) {
            try {
                results.put(point, hitTest(point.scope(), point.x(), point.y()));
            } catch (RuntimeException e) {
                log.debug("Hit test at ({}, {}) in {} failed: {}",
                        point.x(), point.y(), point.scope(), e.getMessage());
            }
        }
        return results;
    }

    /** Listener introspection, when the backing browser exposes it. */
    default Optional<ListenerIntrospection> listenerIntrospection() {
        return Optional.empty();
    }
}
