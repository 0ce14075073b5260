package webpilot.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.action.HumanInput;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Answers {@code askUserInput} from the console the session is driven from.
 */
class ConsoleHumanInput implements HumanInput {

    private static final Logger log = LoggerFactory.getLogger(ConsoleHumanInput.class);

    private final BufferedReader in;
    private final PrintStream out;

    ConsoleHumanInput(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String ask(String question) {
        out.println();
        out.println("[Agent Question]: " + question);
        out.print("Your response: ");
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            log.warn("Could not read answer from console: {}", e.getMessage());
            return "";
        }
    }
}
