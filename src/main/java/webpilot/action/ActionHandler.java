package webpilot.action;

/** Performs one named action with its string payload. */
@FunctionalInterface
public interface ActionHandler {

    String handle(ActionContext ctx, String payload);
}
