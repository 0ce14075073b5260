package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integer pixel position, rounded from the browser's fractional layout values.
 */
public class Point {

    @JsonProperty("x")
    private int x;

    @JsonProperty("y")
    private int y;

    public Point() {}

    public Point(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() { return x; }
    public int getY() { return y; }

    public void setX(int x) { this.x = x; }
    public void setY(int y) { this.y = y; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Point p && p.x == x && p.y == y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return String.format("Point{x=%d, y=%d}", x, y);
    }
}
