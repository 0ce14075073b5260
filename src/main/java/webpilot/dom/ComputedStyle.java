package webpilot.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The slice of computed CSS the snapshot classifier needs.
 *
 * <p>{@code rendered} is the browser's {@code checkVisibility} verdict with the
 * opacity and visibility-property checks enabled; it also accounts for hidden
 * ancestors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComputedStyle(
        @JsonProperty("display") String display,
        @JsonProperty("visibility") String visibility,
        @JsonProperty("rendered") boolean rendered) {

    public static final ComputedStyle HIDDEN = new ComputedStyle("none", "hidden", false);

    public boolean isDisplayNone() {
        return "none".equals(display);
    }

    public boolean isVisibilityHidden() {
        return "hidden".equals(visibility);
    }
}
