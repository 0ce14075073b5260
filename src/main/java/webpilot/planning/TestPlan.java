package webpilot.planning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A structured plan of test cases grouped by area.
 */
public record TestPlan(
        @JsonProperty("objective") String objective,
        @JsonProperty("testAreas") List<Area> testAreas,
        @JsonProperty("summary") String summary) {

    public record Area(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("testCases") List<Case> testCases) {
    }

    public record Case(
            @JsonProperty("id") String id,
            @JsonProperty("description") String description,
            @JsonProperty("steps") List<String> steps,
            @JsonProperty("expected") String expected) {
    }
}
