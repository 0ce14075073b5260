package webpilot.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs action requests against the registry. Unknown names and handler
 * failures come back as {@code "Error: ..."} results, never as exceptions.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ActionContext ctx;

    public ActionDispatcher(ActionContext ctx) {
        this.ctx = ctx;
    }

    public ActionOutcome dispatch(ActionInvocation invocation) {
        return new ActionOutcome(invocation.tool(), run(invocation.tool(), invocation.payload()), invocation.bug());
    }

    public String run(String action, String payload) {
        Optional<ActionDefinition> def = ActionRegistry.find(action);
        if (def.isEmpty()) {
            String known = ActionRegistry.all().stream()
                    .map(ActionDefinition::name)
                    .collect(Collectors.joining(", "));
            return "Error: Unknown action '" + action + "'. Available actions: " + known;
        }
        log.info("Action: {} args='{}'", action, abbreviate(payload));
        try {
            return def.get().handler().handle(ctx, payload == null ? "" : payload);
        } catch (RuntimeException e) {
            log.warn("Action '{}' failed: {}", action, e.getMessage(), e);
            return "Error: " + e.getMessage();
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 80 ? s.substring(0, 77) + "..." : s;
    }
}
