package webpilot.action;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one dispatched action, with the requester's bug value passed back as-is.
 */
public record ActionOutcome(String action, String result, JsonNode bug) {

    public boolean isError() {
        return result != null && result.startsWith("Error:");
    }
}
