package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the interactive-element listing handed to the decision process.
 *
 * @param highlightIndex index the element was given in the current snapshot
 * @param text           aggregated text of the element's subtree
 * @param tag            lower-case tag name
 */
public record InteractiveElement(
        @JsonProperty("highlightIndex") int highlightIndex,
        @JsonProperty("snippet") String text,
        @JsonProperty("type") String tag) {
}
