package webpilot.action;

/** Asks the person supervising the session a question and returns the answer. */
@FunctionalInterface
public interface HumanInput {

    String ask(String question);
}
