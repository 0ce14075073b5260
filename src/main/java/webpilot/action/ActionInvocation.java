package webpilot.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import webpilot.session.WebPilotException;

/**
 * One action request from the decision process:
 * {@code {"tool": ..., "arguments": ..., "message": ..., "bug": ...}}.
 * The {@code bug} value is carried through untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionInvocation(
        @JsonProperty("tool") String tool,
        @JsonProperty("arguments") String arguments,
        @JsonProperty("message") String message,
        @JsonProperty("bug") JsonNode bug) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @throws WebPilotException if the text is not a JSON object naming a tool
     */
    public static ActionInvocation parse(String json) {
        ActionInvocation inv;
        try {
            inv = MAPPER.readValue(json, ActionInvocation.class);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Action request is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (inv == null || inv.tool() == null || inv.tool().isBlank()) {
            throw new WebPilotException("Action request has no 'tool' field");
        }
        return inv;
    }

    public String payload() {
        return arguments == null ? "" : arguments;
    }
}
