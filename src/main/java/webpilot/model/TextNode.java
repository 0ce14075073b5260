package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Visible, non-blank text inside the page. Text nodes never carry a highlight index.
 */
public class TextNode extends SnapshotNode {

    @JsonProperty("text")
    private String text;

    public TextNode() {}

    public TextNode(String text, boolean visible) {
        super(visible);
        this.text = text;
    }

    public String getText() { return text; }

    public void setText(String text) { this.text = text; }

    @Override
    public String toString() {
        return "TextNode{\"" + text + "\"}";
    }
}
