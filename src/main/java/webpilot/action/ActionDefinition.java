package webpilot.action;

/** A registered action: name, description shown to the decision process, and handler. */
public record ActionDefinition(String name, String description, ActionHandler handler) {
}
