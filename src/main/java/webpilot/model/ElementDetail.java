package webpilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Details of a single indexed element, as returned by the inspect action.
 */
public record ElementDetail(
        @JsonProperty("tagName") String tagName,
        @JsonProperty("attributes") Map<String, String> attributes,
        @JsonProperty("isVisible") boolean visible,
        @JsonProperty("isTopElement") boolean topElement,
        @JsonProperty("textNearby") String textNearby) {
}
