package webpilot.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw facts about one live DOM node, captured without any classification.
 *
 * <p>{@code children} are already in snapshot order: shadow-root children
 * first, then either the body children of a same-origin iframe or the node's
 * own light children.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiveNode {

    @JsonProperty("id")
    private int id;

    @JsonProperty("kind")
    private NodeKind kind;

    @JsonProperty("tagName")
    private String tagName;

    @JsonProperty("attributes")
    private Map<String, String> attributes = new LinkedHashMap<>();

    @JsonProperty("text")
    private String text;

    @JsonProperty("rect")
    private ClientRect rect;

    @JsonProperty("offsetWidth")
    private double offsetWidth;

    @JsonProperty("offsetHeight")
    private double offsetHeight;

    @JsonProperty("style")
    private ComputedStyle style;

    @JsonProperty("clickHandler")
    private boolean clickHandler;

    @JsonProperty("draggable")
    private boolean draggable;

    @JsonProperty("listenerTypes")
    private List<String> listenerTypes;

    @JsonProperty("shadowHost")
    private boolean shadowHost;

    @JsonProperty("shadowRootChild")
    private boolean shadowRootChild;

    @JsonProperty("frameAccessible")
    private Boolean frameAccessible;

    @JsonProperty("mainDocument")
    private boolean mainDocument = true;

    @JsonProperty("rootKind")
    private RootKind rootKind = RootKind.DOCUMENT;

    @JsonProperty("shadowHostId")
    private int shadowHostId = -1;

    @JsonProperty("parentTagName")
    private String parentTagName;

    @JsonProperty("siblingIndex")
    private int siblingIndex;

    @JsonProperty("children")
    private List<LiveNode> children = new ArrayList<>();

    public LiveNode() {}

    public boolean isElement() {
        return kind == NodeKind.ELEMENT;
    }

    public boolean isText() {
        return kind == NodeKind.TEXT;
    }

    public boolean isIframe() {
        return "iframe".equals(tagName);
    }

    public String attribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes != null && attributes.containsKey(name);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public int getId()                       { return id; }
    public NodeKind getKind()                { return kind; }
    public String getTagName()               { return tagName; }
    public Map<String, String> getAttributes() { return attributes; }
    public String getText()                  { return text; }
    public ClientRect getRect()              { return rect; }
    public double getOffsetWidth()           { return offsetWidth; }
    public double getOffsetHeight()          { return offsetHeight; }
    public ComputedStyle getStyle()          { return style; }
    public boolean hasClickHandler()         { return clickHandler; }
    public boolean isDraggable()             { return draggable; }
    public List<String> getListenerTypes()   { return listenerTypes; }
    public boolean isShadowHost()            { return shadowHost; }
    public boolean isShadowRootChild()       { return shadowRootChild; }
    public Boolean getFrameAccessible()      { return frameAccessible; }
    public boolean isMainDocument()          { return mainDocument; }
    public RootKind getRootKind()            { return rootKind; }
    public int getShadowHostId()             { return shadowHostId; }
    public String getParentTagName()         { return parentTagName; }
    public int getSiblingIndex()             { return siblingIndex; }
    public List<LiveNode> getChildren()      { return children; }

    public void setId(int id)                                 { this.id = id; }
    public void setKind(NodeKind kind)                        { this.kind = kind; }
    public void setTagName(String tagName)                    { this.tagName = tagName; }
    public void setAttributes(Map<String, String> attributes) { this.attributes = attributes; }
    public void setText(String text)                          { this.text = text; }
    public void setRect(ClientRect rect)                      { this.rect = rect; }
    public void setOffsetWidth(double offsetWidth)            { this.offsetWidth = offsetWidth; }
    public void setOffsetHeight(double offsetHeight)          { this.offsetHeight = offsetHeight; }
    public void setStyle(ComputedStyle style)                 { this.style = style; }
    public void setClickHandler(boolean clickHandler)         { this.clickHandler = clickHandler; }
    public void setDraggable(boolean draggable)               { this.draggable = draggable; }
    public void setListenerTypes(List<String> listenerTypes)  { this.listenerTypes = listenerTypes; }
    public void setShadowHost(boolean shadowHost)             { this.shadowHost = shadowHost; }
    public void setShadowRootChild(boolean shadowRootChild)   { this.shadowRootChild = shadowRootChild; }
    public void setFrameAccessible(Boolean frameAccessible)   { this.frameAccessible = frameAccessible; }
    public void setMainDocument(boolean mainDocument)         { this.mainDocument = mainDocument; }
    public void setRootKind(RootKind rootKind)                { this.rootKind = rootKind; }
    public void setShadowHostId(int shadowHostId)             { this.shadowHostId = shadowHostId; }
    public void setParentTagName(String parentTagName)        { this.parentTagName = parentTagName; }
    public void setSiblingIndex(int siblingIndex)             { this.siblingIndex = siblingIndex; }
    public void setChildren(List<LiveNode> children)          { this.children = children; }

    @Override
    public String toString() {
        return isText() ? "LiveNode{#" + id + " text}" : "LiveNode{#" + id + " <" + tagName + ">}";
    }
}
