package webpilot.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.dom.ClientRect;
import webpilot.dom.ComputedStyle;
import webpilot.dom.DomTags;
import webpilot.dom.HitPoint;
import webpilot.dom.HitTarget;
import webpilot.dom.LiveDom;
import webpilot.dom.LiveNode;
import webpilot.dom.LiveTree;
import webpilot.dom.OverlaySurface;
import webpilot.model.ElementNode;
import webpilot.model.RectCoordinates;
import webpilot.model.Snapshot;
import webpilot.model.SnapshotNode;
import webpilot.model.TextNode;
import webpilot.model.Viewport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link Snapshot} from the live page.
 *
 * <p>The walk is pre-order from {@code body}. Shadow-root children come before
 * light children; a same-origin iframe contributes its body's children. Only
 * elements that are interactive, visible and on top receive a highlight index,
 * numbered in traversal order from zero.
 *
 * <p>Not reentrant: one build per page at a time.
 */
public class SnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

    private static final String FRAME_ROOT_PATH = "html/body";

    private final LiveDom dom;
    private final OverlaySurface overlays;
    private final OverlayRenderer renderer;
    private final InteractivityClassifier interactivity = new InteractivityClassifier();
    private final TopElementClassifier topElement = new TopElementClassifier();

    public SnapshotBuilder(LiveDom dom, OverlaySurface overlays) {
        this.dom = dom;
        this.overlays = overlays;
        this.renderer = new OverlayRenderer(overlays);
    }

    // ── Public API ──────────────────────────────────────────────────────────

    /**
     * Clears previous overlays, captures the page and classifies it.
     *
     * @throws webpilot.session.WebPilotException if the page cannot be captured
     */
    public Snapshot build(SnapshotOptions options) {
        overlays.clearOverlays();
        LiveTree tree = dom.queryLiveTree();
        BuildContext ctx = new BuildContext(dom, options, tree.getViewport());
        ctx.hits = hitTestAll(tree.getBody(), ctx);

        ElementNode root = buildElement(tree.getBody(), null, FRAME_ROOT_PATH, List.of(), ctx);
        if (root == null) {
            root = new ElementNode("body");
        }
        if (options.highlight()) {
            renderer.render(ctx.highlights, ctx.viewport);
        }
        log.debug("Snapshot built: {} indexed element(s), {} overlay(s)",
                ctx.indexCount(), ctx.highlights.size());
        return new Snapshot(root, ctx.viewport, Instant.now(), ctx.indexCount());
    }

    // ── Traversal ───────────────────────────────────────────────────────────

    private SnapshotNode buildNode(LiveNode node, ClientRect frameRect, String parentPath,
                                   List<String> shadowHosts, BuildContext ctx) {
        if (node.isText()) return buildText(node, ctx);
        if (node.isElement()) return buildElement(node, frameRect, parentPath, shadowHosts, ctx);
        return null;
    }

    private TextNode buildText(LiveNode node, BuildContext ctx) {
        String text = node.getText() == null ? "" : node.getText().trim();
        if (text.isEmpty()) return null;
        if (!isTextVisible(node, ctx)) return null;
        return new TextNode(text, true);
    }

    private ElementNode buildElement(LiveNode node, ClientRect frameRect, String path,
                                     List<String> shadowHosts, BuildContext ctx) {
        String tag = node.getTagName();
        if (tag == null || DomTags.NON_CONTENT.contains(tag)) return null;

        Viewport vp = ctx.viewport;
        ClientRect rect = node.getRect() != null ? node.getRect() : new ClientRect();

        ElementNode el = new ElementNode(tag);
        el.setAttributes(new LinkedHashMap<>(node.getAttributes()));
        el.setXpath(path);
        el.setViewportCoordinates(RectCoordinates.of(rect, 0, 0));
        el.setPageCoordinates(RectCoordinates.of(rect, vp.getScrollX(), vp.getScrollY()));
        el.setViewport(vp);
        el.setShadowRoot(node.isShadowHost());
        el.setShadowHosts(shadowHosts);

        boolean interactive = interactivity.isInteractive(node, ctx.listeners);
        boolean visible = isElementVisible(node, ctx);
        boolean top = topElement.isTopElement(node, ctx.options, vp, ctx.hits);
        el.setInteractive(interactive);
        el.setVisible(visible);
        el.setTopElement(top);

        if (interactive && visible && top) {
            int index = ctx.assignIndex();
            el.setHighlightIndex(index);
            if (ctx.options.paints(index)) {
                ctx.highlights.add(new HighlightTarget(node.getId(), index, rect, frameRect));
            }
        }

        ClientRect childFrame = frameRect;
        if (node.isIframe()) {
            if (!Boolean.TRUE.equals(node.getFrameAccessible())) {
                log.warn("Unable to access iframe content (src={}); skipping its subtree", node.attribute("src"));
                return el;
            }
            childFrame = rect;
        }

        List<String> lightHosts = node.isIframe() ? List.of() : shadowHosts;
        List<String> innerHosts = lightHosts;
        if (node.isShadowHost()) {
            List<String> chain = new ArrayList<>(shadowHosts);
            chain.add(cssPath(path));
            innerHosts = List.copyOf(chain);
        }
        for (LiveNode child : node.getChildren()) {
            List<String> hosts = child.isShadowRootChild() ? innerHosts : lightHosts;
            SnapshotNode built = buildNode(child, childFrame, childPath(node, child, path), hosts, ctx);
            if (built != null) el.addChild(built);
        }
        return el;
    }

    // ── Hit testing ─────────────────────────────────────────────────────────

    /** Answers every element's top-element point in one batch before the walk. */
    private Map<HitPoint, Optional<HitTarget>> hitTestAll(LiveNode body, BuildContext ctx) {
        Set<HitPoint> points = new LinkedHashSet<>();
        collectPoints(body, ctx, points);
        if (points.isEmpty()) return Map.of();
        try {
            return dom.hitTestAll(points);
        } catch (RuntimeException e) {
            log.debug("Batch hit test of {} point(s) failed, treating all as top elements: {}",
                    points.size(), e.getMessage());
            return Map.of();
        }
    }

    private void collectPoints(LiveNode node, BuildContext ctx, Set<HitPoint> points) {
        if (node == null || !node.isElement()) return;
        if (node.getTagName() == null || DomTags.NON_CONTENT.contains(node.getTagName())) return;
        topElement.hitPointFor(node, ctx.options, ctx.viewport).ifPresent(points::add);
        if (node.isIframe() && !Boolean.TRUE.equals(node.getFrameAccessible())) return;
        for (LiveNode child : node.getChildren()) {
            collectPoints(child, ctx, points);
        }
    }

    // ── Classification helpers ──────────────────────────────────────────────

    private boolean isElementVisible(LiveNode node, BuildContext ctx) {
        ComputedStyle style = ctx.dom.computeStyle(node);
        return node.getOffsetWidth() > 0
                && node.getOffsetHeight() > 0
                && !style.isVisibilityHidden()
                && !style.isDisplayNone();
    }

    private boolean isTextVisible(LiveNode node, BuildContext ctx) {
        ClientRect rect = node.getRect();
        if (rect == null) return false;
        return rect.getWidth() != 0
                && rect.getHeight() != 0
                && rect.getTop() >= 0
                && rect.getTop() <= ctx.viewport.getHeight()
                && ctx.dom.computeStyle(node).rendered();
    }

    /**
     * The CSS equivalent of a snapshot xpath, relative to the same root:
     * {@code html/body/div[2]/my-card} becomes
     * {@code html:nth-of-type(1) > body:nth-of-type(1) > div:nth-of-type(2) > my-card:nth-of-type(1)}.
     */
    static String cssPath(String xpath) {
        List<String> steps = new ArrayList<>();
        for (String segment : xpath.split("/")) {
            int bracket = segment.indexOf('[');
            String tag = bracket < 0 ? segment : segment.substring(0, bracket);
            String position = bracket < 0 ? "1" : segment.substring(bracket + 1, segment.length() - 1);
            steps.add(tag + ":nth-of-type(" + position + ")");
        }
        return String.join(" > ", steps);
    }

    /** Diagnostic xpath: restarts below shadow roots and inside iframe documents. */
    static String childPath(LiveNode parent, LiveNode child, String parentPath) {
        if (!child.isElement()) return parentPath;
        String segment = child.getSiblingIndex() == 0
                ? child.getTagName()
                : child.getTagName() + "[" + (child.getSiblingIndex() + 1) + "]";
        if (child.isShadowRootChild()) return segment;
        if (parent.isIframe()) return FRAME_ROOT_PATH + "/" + segment;
        return parentPath + "/" + segment;
    }
}
