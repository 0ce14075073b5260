package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One node of a page snapshot: either an {@link ElementNode} or a {@link TextNode}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ElementNode.class, name = "ELEMENT_NODE"),
        @JsonSubTypes.Type(value = TextNode.class, name = "TEXT_NODE")
})
public abstract class SnapshotNode {

    @JsonProperty("isVisible")
    private boolean visible;

    protected SnapshotNode() {}

    protected SnapshotNode(boolean visible) {
        this.visible = visible;
    }

    public boolean isVisible() { return visible; }

    public void setVisible(boolean visible) { this.visible = visible; }
}
