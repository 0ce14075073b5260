package webpilot.snapshot;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import webpilot.dom.FakeLiveDom;
import webpilot.dom.LiveNode;
import webpilot.dom.LiveNodes;
import webpilot.dom.OverlayBox;
import webpilot.model.ElementNode;
import webpilot.model.Snapshot;
import webpilot.model.SnapshotNode;
import webpilot.model.TextNode;
import webpilot.model.Viewport;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static webpilot.dom.LiveNodes.attrs;
import static webpilot.dom.LiveNodes.hidden;
import static webpilot.dom.LiveNodes.rect;
import static webpilot.dom.LiveNodes.tree;
import static webpilot.dom.LiveNodes.withFrame;
import static webpilot.dom.LiveNodes.withShadow;

/**
 * Unit tests for {@link SnapshotBuilder} against an in-memory page with
 * geometric hit testing.
 */
public class SnapshotBuilderTest {

    private LiveNodes n;

    @BeforeMethod
    public void setUp() {
        n = new LiveNodes();
    }

    private LiveNode body(LiveNode... children) {
        return n.el("body", rect(0, 0, 1280, 3000), children);
    }

    private static Snapshot build(FakeLiveDom dom, SnapshotOptions options) {
        return new SnapshotBuilder(dom, dom).build(options);
    }

    private static List<String> indexedTags(Snapshot snapshot) {
        List<String> tags = new ArrayList<>();
        for (ElementNode el : snapshot.indexedElements()) {
            tags.add(el.getHighlightIndex() + ":" + el.getTagName());
        }
        return tags;
    }

    // ── Index assignment ──────────────────────────────────────────────────

    @Test(description = "Indices go to interactive, visible, top elements in pre-order from zero")
    public void testIndicesInPreOrder() {
        LiveNode page = body(
                n.el("div", rect(0, 0, 600, 100),
                        n.text("Welcome", rect(10, 10, 80, 20)),
                        n.el("button", rect(100, 10, 80, 30))),
                n.el("a", rect(0, 200, 100, 20)),
                hidden(n.el("input", rect(0, 300, 100, 20))),
                n.el("textarea", rect(0, 400, 200, 80)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button", "1:a", "2:textarea");
        assertThat(snapshot.getHighlightCount()).isEqualTo(3);
    }

    @Test(description = "Every indexed element is interactive, visible and on top; indices are unique")
    public void testIndexInvariant() {
        LiveNode page = body(
                n.el("nav", rect(0, 0, 1280, 60),
                        n.el("a", rect(0, 0, 100, 60)),
                        n.el("a", rect(100, 0, 100, 60)),
                        attrs(n.el("span", rect(200, 0, 100, 60)), "role", "button"),
                        attrs(n.el("div", rect(300, 0, 100, 60)), "tabindex", "0")),
                n.el("select", rect(0, 100, 200, 30)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        List<ElementNode> indexed = snapshot.indexedElements();
        assertThat(indexed).hasSize(5);
        assertThat(indexed).allSatisfy(el -> {
            assertThat(el.isInteractive()).isTrue();
            assertThat(el.isVisible()).isTrue();
            assertThat(el.isTopElement()).isTrue();
        });
        assertThat(indexed).extracting(ElementNode::getHighlightIndex).containsExactly(0, 1, 2, 3, 4);
    }

    @Test(description = "An interactive element nested inside another still gets its own index after its parent")
    public void testNestedInteractive() {
        LiveNode page = body(
                n.el("label", rect(0, 0, 300, 40),
                        n.el("input", rect(10, 5, 20, 20))));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:label", "1:input");
    }

    @Test(description = "A covered element is classified but not indexed")
    public void testCoveredElementNotIndexed() {
        LiveNode page = body(
                n.el("button", rect(0, 0, 100, 40)),
                n.el("div", rect(0, 0, 500, 500)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        ElementNode button = (ElementNode) snapshot.getRoot().getChildren().get(0);
        assertThat(button.isInteractive()).isTrue();
        assertThat(button.isVisible()).isTrue();
        assertThat(button.isTopElement()).isFalse();
        assertThat(button.isIndexed()).isFalse();
        assertThat(snapshot.getHighlightCount()).isZero();
    }

    @Test(description = "Rebuilding an unchanged page yields the same indices")
    public void testRebuildIsStable() {
        LiveNode page = body(
                n.el("a", rect(0, 0, 100, 20)),
                n.el("button", rect(0, 50, 100, 20)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        Snapshot first = build(dom, SnapshotOptions.defaults());
        Snapshot second = build(dom, SnapshotOptions.defaults());

        assertThat(indexedTags(second)).isEqualTo(indexedTags(first));
    }

    // ── Viewport expansion ────────────────────────────────────────────────

    @Test(description = "Elements below the fold are not indexed with zero expansion")
    public void testBelowFoldExcluded() {
        LiveNode page = body(
                n.el("button", rect(0, 10, 100, 30)),
                n.el("button", rect(0, 2000, 100, 30)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button");
    }

    @Test(description = "Unbounded expansion indexes every interactive visible element without hit testing")
    public void testUnboundedExpansion() {
        LiveNode page = body(
                n.el("button", rect(0, 10, 100, 30)),
                n.el("button", rect(0, 2000, 100, 30)),
                n.el("div", rect(0, 0, 1280, 3000)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults().withViewportExpansion(SnapshotOptions.UNBOUNDED));

        assertThat(indexedTags(snapshot)).containsExactly("0:button", "1:button");
        assertThat(dom.hitTests).isZero();
    }

    @Test(description = "Inside the expanded area but outside the visual viewport counts as on top")
    public void testExpandedAreaCountsAsTop() {
        LiveNode page = body(n.el("button", rect(0, 1000, 100, 30)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults().withViewportExpansion(500));

        assertThat(indexedTags(snapshot)).containsExactly("0:button");
    }

    @Test(description = "Viewport expansion below -1 is rejected")
    public void testInvalidExpansion() {
        assertThatThrownBy(() -> new SnapshotOptions(true, SnapshotOptions.NO_FOCUS, -2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-2");
    }

    // ── Failure handling ──────────────────────────────────────────────────

    @Test(description = "A hit test that throws does not hide the element")
    public void testHitTestFailureFailsOpen() {
        LiveNode page = body(n.el("button", rect(0, 0, 100, 30)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));
        dom.failHitTestsWith(new IllegalStateException("detached"));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button");
    }

    @Test(description = "A batch hit test that throws does not hide any element")
    public void testBatchFailureFailsOpen() {
        LiveNode page = body(
                n.el("button", rect(0, 0, 100, 30)),
                n.el("div", rect(0, 0, 1280, 800)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));
        dom.failBatchesWith(new IllegalStateException("registry is stale"));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button");
        assertThat(dom.hitTests).isZero();
    }

    @Test(description = "Every element's hit test goes to the browser in a single batch per build")
    public void testHitTestsAreBatched() {
        LiveNode page = body(
                n.el("button", rect(0, 0, 100, 30)),
                n.el("button", rect(200, 0, 100, 30)),
                n.el("nav", rect(0, 100, 600, 60),
                        n.el("a", rect(0, 100, 100, 60)),
                        n.el("a", rect(200, 100, 100, 60))),
                n.el("div", rect(400, 0, 100, 30)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button", "1:button", "2:a", "3:a");
        assertThat(dom.hitTestBatches).isEqualTo(1);

        build(dom, SnapshotOptions.defaults());
        assertThat(dom.hitTestBatches).isEqualTo(2);
    }

    @Test(description = "An inaccessible iframe contributes no children and does not fail the build")
    public void testInaccessibleIframe() {
        LiveNode frame = attrs(n.el("iframe", rect(0, 0, 400, 300)), "src", "https://other.example");
        frame.setFrameAccessible(false);
        LiveNode page = body(frame, n.el("button", rect(500, 0, 100, 30)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        ElementNode iframe = (ElementNode) snapshot.getRoot().getChildren().get(0);
        assertThat(iframe.getTagName()).isEqualTo("iframe");
        assertThat(iframe.getChildren()).isEmpty();
        assertThat(indexedTags(snapshot)).containsExactly("0:button");
    }

    // ── Frames and shadow roots ───────────────────────────────────────────

    @Test(description = "Same-origin iframe content is indexed and its overlay is offset by the frame position")
    public void testAccessibleIframe() {
        LiveNode inner = n.el("button", rect(10, 20, 80, 30));
        LiveNode frame = withFrame(n.el("iframe", rect(100, 200, 400, 300)), inner);
        FakeLiveDom dom = new FakeLiveDom(tree(body(frame)));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults());

        assertThat(indexedTags(snapshot)).containsExactly("0:button");
        ElementNode button = snapshot.findByHighlightIndex(0).orElseThrow();
        assertThat(button.getXpath()).isEqualTo("html/body/button");
        OverlayBox box = dom.lastPaint().get(0);
        assertThat(box.left()).isEqualTo(110);
        assertThat(box.top()).isEqualTo(220);
    }

    @Test(description = "Shadow-root children come first, are hit-tested in their root and restart the xpath")
    public void testShadowRoot() {
        LiveNode host = n.el("my-widget", rect(0, 0, 300, 100),
                n.el("span", rect(0, 60, 100, 20)));
        withShadow(host, n.el("button", rect(0, 0, 100, 40)));
        FakeLiveDom dom = new FakeLiveDom(tree(body(host)));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults());

        ElementNode widget = (ElementNode) snapshot.getRoot().getChildren().get(0);
        assertThat(widget.isShadowRoot()).isTrue();
        ElementNode first = (ElementNode) widget.getChildren().get(0);
        assertThat(first.getTagName()).isEqualTo("button");
        assertThat(first.getXpath()).isEqualTo("button");
        assertThat(first.isIndexed()).isTrue();
        assertThat(((ElementNode) widget.getChildren().get(1)).getXpath()).isEqualTo("html/body/my-widget/span");
    }

    @Test(description = "Elements under a shadow root record their host chain as CSS paths, outermost first")
    public void testShadowHostChain() {
        LiveNode inner = n.el("inner-field", rect(0, 0, 200, 40));
        withShadow(inner, n.el("input", rect(0, 0, 200, 40)));
        LiveNode outer = n.el("my-form", rect(0, 100, 300, 100),
                n.el("span", rect(0, 160, 100, 20)));
        withShadow(outer, n.el("div", rect(0, 100, 300, 50)), attrs(n.el("div", rect(0, 150, 300, 50), inner), "class", "row"));
        FakeLiveDom dom = new FakeLiveDom(tree(body(n.el("header", rect(0, 0, 1280, 90)), outer)));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults().withViewportExpansion(SnapshotOptions.UNBOUNDED));

        ElementNode form = (ElementNode) snapshot.getRoot().getChildren().get(1);
        assertThat(form.getShadowHosts()).isEmpty();
        ElementNode row = (ElementNode) form.getChildren().get(1);
        assertThat(row.getShadowHosts())
                .containsExactly("html:nth-of-type(1) > body:nth-of-type(1) > my-form:nth-of-type(1)");
        ElementNode field = (ElementNode) row.getChildren().get(0);
        ElementNode input = (ElementNode) field.getChildren().get(0);
        assertThat(input.getTagName()).isEqualTo("input");
        assertThat(input.getShadowHosts()).containsExactly(
                "html:nth-of-type(1) > body:nth-of-type(1) > my-form:nth-of-type(1)",
                "div:nth-of-type(2) > inner-field:nth-of-type(1)");
        assertThat(((ElementNode) form.getChildren().get(2)).getShadowHosts()).isEmpty();
    }

    @Test(description = "Snapshot xpaths convert to equivalent CSS paths")
    public void testCssPath() {
        assertThat(SnapshotBuilder.cssPath("html/body/div[2]/my-card"))
                .isEqualTo("html:nth-of-type(1) > body:nth-of-type(1) > div:nth-of-type(2) > my-card:nth-of-type(1)");
        assertThat(SnapshotBuilder.cssPath("ul/li[3]")).isEqualTo("ul:nth-of-type(1) > li:nth-of-type(3)");
    }

    // ── Filtering ─────────────────────────────────────────────────────────

    @Test(description = "Non-content tags, blank text and off-screen text are left out")
    public void testFiltering() {
        LiveNode page = body(
                n.el("script", rect(0, 0, 0, 0)),
                n.el("style", rect(0, 0, 0, 0)),
                n.text("   ", rect(0, 0, 10, 10)),
                n.text("Below", rect(0, 2000, 50, 20)),
                n.text("Hello", rect(0, 10, 50, 20)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        List<SnapshotNode> children = snapshot.getRoot().getChildren();
        assertThat(children).hasSize(1);
        assertThat(((TextNode) children.get(0)).getText()).isEqualTo("Hello");
    }

    @Test(description = "Click-affinity signals are ignored on direct children of body")
    public void testBodyChildrenClickAffinity() {
        LiveNode page = body(
                attrs(n.el("div", rect(0, 0, 600, 400),
                        attrs(n.el("div", rect(0, 0, 100, 30)), "onclick", "go()")), "onclick", "track()"));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        ElementNode outer = (ElementNode) snapshot.getRoot().getChildren().get(0);
        assertThat(outer.isInteractive()).isFalse();
        assertThat(indexedTags(snapshot)).containsExactly("0:div");
        assertThat(snapshot.findByHighlightIndex(0).orElseThrow().getXpath()).isEqualTo("html/body/div/div");
    }

    @Test(description = "Repeated sibling tags get positional xpath segments")
    public void testXpathSiblingPositions() {
        LiveNode page = body(
                n.el("a", rect(0, 0, 50, 20)),
                n.el("a", rect(60, 0, 50, 20)));

        Snapshot snapshot = build(new FakeLiveDom(tree(page)), SnapshotOptions.defaults());

        assertThat(snapshot.indexedElements())
                .extracting(ElementNode::getXpath)
                .containsExactly("html/body/a", "html/body/a[2]");
    }

    @Test(description = "Page coordinates add the scroll offset to viewport coordinates")
    public void testCoordinates() {
        LiveNode page = body(n.el("button", rect(10.4, 20.6, 100, 30)));
        Viewport scrolled = new Viewport(0, 500, 1280, 800);

        Snapshot snapshot = build(new FakeLiveDom(tree(page, scrolled)), SnapshotOptions.defaults());

        ElementNode button = snapshot.findByHighlightIndex(0).orElseThrow();
        assertThat(button.getViewportCoordinates().getTopLeft().getY()).isEqualTo(21);
        assertThat(button.getPageCoordinates().getTopLeft().getY()).isEqualTo(521);
        assertThat(button.getPageCoordinates().getTopLeft().getX()).isEqualTo(10);
    }

    // ── Overlays ──────────────────────────────────────────────────────────

    @Test(description = "Every build clears overlays first and paints one box per indexed element")
    public void testOverlaysClearedAndPainted() {
        LiveNode page = body(
                n.el("a", rect(0, 0, 100, 20)),
                n.el("button", rect(0, 50, 100, 20)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        build(dom, SnapshotOptions.defaults());
        build(dom, SnapshotOptions.defaults());

        assertThat(dom.clearCount).isEqualTo(2);
        assertThat(dom.lastPaint()).extracting(OverlayBox::marker)
                .containsExactly("webpilot-highlight-0", "webpilot-highlight-1");
    }

    @Test(description = "With highlighting off, overlays are still cleared but nothing is painted")
    public void testHighlightDisabled() {
        FakeLiveDom dom = new FakeLiveDom(tree(body(n.el("a", rect(0, 0, 100, 20)))));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults().withHighlight(false));

        assertThat(snapshot.getHighlightCount()).isEqualTo(1);
        assertThat(dom.clearCount).isEqualTo(1);
        assertThat(dom.painted).isEmpty();
    }

    @Test(description = "A focus index paints only that element but indexes all of them")
    public void testFocusIndex() {
        LiveNode page = body(
                n.el("a", rect(0, 0, 100, 20)),
                n.el("button", rect(0, 50, 100, 20)),
                n.el("input", rect(0, 100, 100, 20)));
        FakeLiveDom dom = new FakeLiveDom(tree(page));

        Snapshot snapshot = build(dom, SnapshotOptions.defaults().withFocus(1));

        assertThat(snapshot.getHighlightCount()).isEqualTo(3);
        assertThat(dom.lastPaint()).extracting(OverlayBox::label).containsExactly("1");
    }
}
