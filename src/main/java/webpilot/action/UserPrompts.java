package webpilot.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Human-in-the-loop actions.
 */
final class UserPrompts {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DEFAULT_QUESTION =
            "What would you like me to test? Please provide details about what to test and how to reach it.";

    private UserPrompts() {}

    static String askUserInput(ActionContext ctx, String payload) {
        if (ctx.human() == null) {
            return "Error: No user is attached to this session.";
        }
        String answer = ctx.human().ask(question(payload));
        return "User provided the following information: " + (answer == null ? "" : answer.trim());
    }

    /** The payload is either {@code {"question": "..."}} or the question itself. */
    static String question(String payload) {
        String raw = payload == null ? "" : payload.trim();
        if (raw.startsWith("{")) {
            try {
                JsonNode q = MAPPER.readTree(raw).path("question");
                if (q.isTextual() && !q.asText().isBlank()) return q.asText();
                return DEFAULT_QUESTION;
            } catch (JsonProcessingException e) {
                // Not JSON after all; treat it as the question text
                return raw;
            }
        }
        return raw.isEmpty() ? DEFAULT_QUESTION : raw;
    }
}
