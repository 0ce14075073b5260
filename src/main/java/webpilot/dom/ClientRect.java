package webpilot.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fractional bounding rectangle as reported by {@code getBoundingClientRect()},
 * relative to the viewport of the document that owns the node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientRect {

    @JsonProperty("left")
    private double left;

    @JsonProperty("top")
    private double top;

    @JsonProperty("width")
    private double width;

    @JsonProperty("height")
    private double height;

    public ClientRect() {}

    public ClientRect(double left, double top, double width, double height) {
        this.left = left;
        this.top = top;
        this.width = width;
        this.height = height;
    }

    public double getLeft()   { return left; }
    public double getTop()    { return top; }
    public double getWidth()  { return width; }
    public double getHeight() { return height; }

    public double right()   { return left + width; }
    public double bottom()  { return top + height; }
    public double centerX() { return left + width / 2; }
    public double centerY() { return top + height / 2; }

    @Override
    public String toString() {
        return String.format("ClientRect{left=%.1f, top=%.1f, w=%.1f, h=%.1f}", left, top, width, height);
    }
}
