package webpilot.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.dom.ClientRect;
import webpilot.dom.HitPoint;
import webpilot.dom.HitScope;
import webpilot.dom.HitTarget;
import webpilot.dom.LiveNode;
import webpilot.dom.RootKind;
import webpilot.model.Viewport;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether an element is the hit target at its own center, that is,
 * not covered by another element.
 *
 * <p>Geometry settles most elements; the rest need a hit test at their center.
 * The builder gathers those points first and answers them in one batch.
 * A point without an answer counts as "on top": a browser that cannot answer
 * should not hide elements from the listing.
 */
class TopElementClassifier {

    private static final Logger log = LoggerFactory.getLogger(TopElementClassifier.class);

    /** Outcome of the geometric checks: a verdict, or the point still to hit-test. */
    private record Check(boolean top, HitPoint point) {
        static Check decided(boolean top) { return new Check(top, null); }
        static Check hitTest(HitScope scope, double x, double y) { return new Check(false, new HitPoint(scope, x, y)); }
    }

    /** The hit test this element needs, or empty when geometry alone decides. */
    Optional<HitPoint> hitPointFor(LiveNode node, SnapshotOptions options, Viewport viewport) {
        return Optional.ofNullable(check(node, options, viewport).point());
    }

    boolean isTopElement(LiveNode node, SnapshotOptions options, Viewport viewport,
                         Map<HitPoint, Optional<HitTarget>> hits) {
        Check check = check(node, options, viewport);
        if (check.point() == null) return check.top();

        Optional<HitTarget> target = hits.get(check.point());
        if (target == null) {
            log.debug("No hit-test answer for {} in {}, treating as top element",
                    node, check.point().scope().kind() == RootKind.DOCUMENT ? "document" : "shadow root");
            return true;
        }
        return target.map(t -> t.reaches(node.getId())).orElse(false);
    }

    private Check check(LiveNode node, SnapshotOptions options, Viewport viewport) {
        if (!node.isMainDocument()) return Check.decided(true);
        if (options.isUnbounded()) return Check.decided(true);

        ClientRect rect = node.getRect() != null ? node.getRect() : new ClientRect();
        if (node.getRootKind() == RootKind.SHADOW_ROOT) {
            return Check.hitTest(HitScope.shadowRootOf(node.getShadowHostId()), rect.centerX(), rect.centerY());
        }

        int exp = options.viewportExpansion();
        double viewTop = viewport.getScrollY() - exp;
        double viewLeft = viewport.getScrollX() - exp;
        double viewBottom = viewport.getScrollY() + viewport.getHeight() + exp;
        double viewRight = viewport.getScrollX() + viewport.getWidth() + exp;

        double absTop = rect.getTop() + viewport.getScrollY();
        double absLeft = rect.getLeft() + viewport.getScrollX();
        double absBottom = rect.bottom() + viewport.getScrollY();
        double absRight = rect.right() + viewport.getScrollX();

        if (absBottom < viewTop || absTop > viewBottom || absRight < viewLeft || absLeft > viewRight) {
            return Check.decided(false);
        }

        double cx = rect.centerX();
        double cy = rect.centerY();
        // Inside the expanded area but outside the visual viewport: nothing to hit-test against
        if (cx < 0 || cx >= viewport.getWidth() || cy < 0 || cy >= viewport.getHeight()) {
            return Check.decided(true);
        }
        return Check.hitTest(HitScope.MAIN_DOCUMENT, cx, cy);
    }
}
