package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scroll offset and size of the top-level viewport at capture time.
 */
public class Viewport {

    @JsonProperty("scrollX")
    private int scrollX;

    @JsonProperty("scrollY")
    private int scrollY;

    @JsonProperty("width")
    private int width;

    @JsonProperty("height")
    private int height;

    public Viewport() {}

    public Viewport(int scrollX, int scrollY, int width, int height) {
        this.scrollX = scrollX;
        this.scrollY = scrollY;
        this.width = width;
        this.height = height;
    }

    public int getScrollX() { return scrollX; }
    public int getScrollY() { return scrollY; }
    public int getWidth()   { return width; }
    public int getHeight()  { return height; }

    @Override
    public String toString() {
        return String.format("Viewport{scroll=(%d,%d), size=%dx%d}", scrollX, scrollY, width, height);
    }
}
