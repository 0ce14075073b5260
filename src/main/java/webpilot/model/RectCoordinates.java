package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import webpilot.dom.ClientRect;

/**
 * Four corners, center and size of an element box. Used twice per element:
 * once relative to the viewport and once shifted into page coordinates by
 * the scroll offset.
 */
public class RectCoordinates {

    @JsonProperty("topLeft")
    private Point topLeft;

    @JsonProperty("topRight")
    private Point topRight;

    @JsonProperty("bottomLeft")
    private Point bottomLeft;

    @JsonProperty("bottomRight")
    private Point bottomRight;

    @JsonProperty("center")
    private Point center;

    @JsonProperty("width")
    private int width;

    @JsonProperty("height")
    private int height;

    public RectCoordinates() {}

    /**
     * Builds coordinates from a client rect translated by the given offset.
     * Every value is rounded half-up, matching {@code Math.round} in the browser.
     */
    public static RectCoordinates of(ClientRect rect, double offsetX, double offsetY) {
        double left = rect.getLeft() + offsetX;
        double top = rect.getTop() + offsetY;
        double right = left + rect.getWidth();
        double bottom = top + rect.getHeight();

        RectCoordinates c = new RectCoordinates();
        c.topLeft = new Point(round(left), round(top));
        c.topRight = new Point(round(right), round(top));
        c.bottomLeft = new Point(round(left), round(bottom));
        c.bottomRight = new Point(round(right), round(bottom));
        c.center = new Point(round(left + rect.getWidth() / 2), round(top + rect.getHeight() / 2));
        c.width = round(rect.getWidth());
        c.height = round(rect.getHeight());
        return c;
    }

    private static int round(double v) {
        return (int) Math.round(v);
    }

    public Point getTopLeft()     { return topLeft; }
    public Point getTopRight()    { return topRight; }
    public Point getBottomLeft()  { return bottomLeft; }
    public Point getBottomRight() { return bottomRight; }
    public Point getCenter()      { return center; }
    public int getWidth()         { return width; }
    public int getHeight()        { return height; }

    @Override
    public String toString() {
        return String.format("RectCoordinates{topLeft=%s, %dx%d}", topLeft, width, height);
    }
}
