package webpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An element of the page snapshot with its classification and, when it is
 * interactive, visible and unobstructed, its highlight index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementNode extends SnapshotNode {

    /** Highlight index value of elements that did not qualify for one. */
    public static final int NO_INDEX = -1;

    @JsonProperty("tagName")
    private String tagName;

    @JsonProperty("attributes")
    private Map<String, String> attributes = new LinkedHashMap<>();

    @JsonProperty("xpath")
    private String xpath;

    @JsonProperty("children")
    private List<SnapshotNode> children = new ArrayList<>();

    @JsonProperty("viewportCoordinates")
    private RectCoordinates viewportCoordinates;

    @JsonProperty("pageCoordinates")
    private RectCoordinates pageCoordinates;

    @JsonProperty("viewport")
    private Viewport viewport;

    @JsonProperty("isInteractive")
    private boolean interactive;

    @JsonProperty("isTopElement")
    private boolean topElement;

    @JsonProperty("highlightIndex")
    private int highlightIndex = NO_INDEX;

    @JsonProperty("shadowRoot")
    private boolean shadowRoot;

    /** CSS selectors of the shadow hosts enclosing this element, outermost first, each relative to its own root. */
    @JsonProperty("shadowHosts")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> shadowHosts = new ArrayList<>();

    public ElementNode() {}

    public ElementNode(String tagName) {
        this.tagName = tagName;
    }

    /** True when this element received a highlight index in its snapshot. */
    @JsonIgnore
    public boolean isIndexed() {
        return highlightIndex != NO_INDEX;
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public void addChild(SnapshotNode child) {
        children.add(child);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getTagName()                       { return tagName; }
    public Map<String, String> getAttributes()       { return attributes; }
    public String getXpath()                         { return xpath; }
    public List<SnapshotNode> getChildren()          { return children; }
    public RectCoordinates getViewportCoordinates()  { return viewportCoordinates; }
    public RectCoordinates getPageCoordinates()      { return pageCoordinates; }
    public Viewport getViewport()                    { return viewport; }
    public boolean isInteractive()                   { return interactive; }
    public boolean isTopElement()                    { return topElement; }
    public int getHighlightIndex()                   { return highlightIndex; }
    public boolean isShadowRoot()                    { return shadowRoot; }
    public List<String> getShadowHosts()             { return shadowHosts; }

    public void setTagName(String tagName)                             { this.tagName = tagName; }
    public void setAttributes(Map<String, String> attributes)          { this.attributes = attributes; }
    public void setXpath(String xpath)                                 { this.xpath = xpath; }
    public void setChildren(List<SnapshotNode> children)               { this.children = children; }
    public void setViewportCoordinates(RectCoordinates coordinates)    { this.viewportCoordinates = coordinates; }
    public void setPageCoordinates(RectCoordinates coordinates)        { this.pageCoordinates = coordinates; }
    public void setViewport(Viewport viewport)                         { this.viewport = viewport; }
    public void setInteractive(boolean interactive)                    { this.interactive = interactive; }
    public void setTopElement(boolean topElement)                      { this.topElement = topElement; }
    public void setHighlightIndex(int highlightIndex)                  { this.highlightIndex = highlightIndex; }
    public void setShadowRoot(boolean shadowRoot)                      { this.shadowRoot = shadowRoot; }
    public void setShadowHosts(List<String> shadowHosts)               { this.shadowHosts = shadowHosts; }

    @Override
    public String toString() {
        return "ElementNode{<" + tagName + "> index=" + highlightIndex + ", xpath=" + xpath + "}";
    }
}
