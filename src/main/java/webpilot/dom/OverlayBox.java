package webpilot.dom;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One numbered highlight rectangle, in page coordinates.
 *
 * @param nodeId       captured node the marker attribute is written to
 * @param marker       value of the marker attribute
 * @param label        text of the label, the highlight index
 */
public record OverlayBox(
        @JsonProperty("nodeId") int nodeId,
        @JsonProperty("marker") String marker,
        @JsonProperty("label") String label,
        @JsonProperty("color") String color,
        @JsonProperty("background") String background,
        @JsonProperty("top") double top,
        @JsonProperty("left") double left,
        @JsonProperty("width") double width,
        @JsonProperty("height") double height,
        @JsonProperty("labelTop") double labelTop,
        @JsonProperty("labelLeft") double labelLeft,
        @JsonProperty("fontSize") double fontSize) {
}
