package webpilot.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import webpilot.action.ActionContext;
import webpilot.action.ActionDispatcher;
import webpilot.action.ActionInvocation;
import webpilot.action.ActionOutcome;
import webpilot.action.ActionRegistry;
import webpilot.session.BrowserSession;
import webpilot.session.SessionConfig;
import webpilot.session.WebPilotException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Interactive console for driving a browser session by hand.
 *
 * <p>Each input line is either {@code <action> <payload>} or a JSON action
 * request {@code {"tool": ..., "arguments": ...}}. {@code quit} or end of
 * input closes the browser.
 *
 * <pre>
 *  webpilot --browser firefox --url example.com
 *  &gt; listClickableElements
 *  &gt; clickElementByHighlightIndex 3
 *  &gt; fillInputByHighlightIndex 5||hello
 * </pre>
 */
@Command(
        name        = "webpilot",
        description = "Drive a browser through indexed page snapshots",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true
)
public class ActionConsoleCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ActionConsoleCLI.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Option(
            names       = {"-b", "--browser"},
            description = "Browser to use: chrome, firefox, edge (default: from config.properties)"
    )
    String browser;

    @Option(
            names       = {"--headless"},
            description = "Run the browser without a window"
    )
    boolean headless;

    @Option(
            names       = {"-u", "--url"},
            description = "Page to open before reading commands"
    )
    String url;

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ActionConsoleCLI()).execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        SessionConfig config = new SessionConfig();
        if (browser != null) config = config.with("browser.name", browser);
        if (headless) config = config.with("browser.headless", "true");

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (BrowserSession session = new BrowserSession(config)) {
            try {
                session.init();
            } catch (WebPilotException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            ActionDispatcher dispatcher = new ActionDispatcher(
                    ActionContext.of(session, new ConsoleHumanInput(in, System.out)));

            if (url != null) {
                System.out.println(dispatcher.run("visitUrl", url));
            }
            System.out.println("Available actions:");
            System.out.println(ActionRegistry.describe());
            return runLoop(in, System.out, dispatcher);
        }
    }

    // ── Loop ────────────────────────────────────────────────────────────────

    static int runLoop(BufferedReader in, PrintStream out, ActionDispatcher dispatcher) {
        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                log.error("Cannot read console input: {}", e.getMessage());
                return 1;
            }
            if (line == null) return 0;
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.equalsIgnoreCase("quit") || line.equalsIgnoreCase("exit")) return 0;

            out.println(elideImages(execute(line, dispatcher)));
        }
    }

    static String execute(String line, ActionDispatcher dispatcher) {
        if (line.startsWith("{")) {
            try {
                ActionOutcome outcome = dispatcher.dispatch(ActionInvocation.parse(line));
                if (outcome.bug() != null && !outcome.bug().isNull()) {
                    log.info("Bug reported with {}: {}", outcome.action(), outcome.bug());
                }
                return outcome.result();
            } catch (WebPilotException e) {
                return "Error: " + e.getMessage();
            }
        }
        int space = line.indexOf(' ');
        String action = space < 0 ? line : line.substring(0, space);
        String payload = space < 0 ? "" : line.substring(space + 1).trim();
        return dispatcher.run(action, payload);
    }

    /** Replaces base64 screenshots in JSON results with their size. */
    static String elideImages(String result) {
        if (result == null || !result.startsWith("{")) return result;
        try {
            JsonNode node = MAPPER.readTree(result);
            if (node instanceof ObjectNode obj && obj.hasNonNull("base64Image")) {
                int length = obj.get("base64Image").asText().length();
                obj.put("base64Image", "<" + length + " chars of base64 PNG>");
                return MAPPER.writeValueAsString(obj);
            }
            return result;
        } catch (JsonProcessingException e) {
            log.debug("Result looked like JSON but did not parse: {}", e.getOriginalMessage());
            return result;
        }
    }
}
