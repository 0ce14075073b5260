package webpilot.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-wide table of the actions a decision process may invoke.
 *
 * <p>Built once when the class loads. Registering a name again replaces the
 * earlier entry without warning; the listing keeps first-registration order.
 *
 * <h3>Built-in actions</h3>
 * <pre>
 *  visitUrl                      - navigate and snapshot (payload: URL)
 *  listClickableElements         - indexed elements + full-page screenshot
 *  getElementDetails             - details of one index (payload: index)
 *  clickElementByHighlightIndex  - click (payload: index)
 *  fillInputByHighlightIndex     - set a field (payload: "index||text")
 *  openDropdown                  - open a dropdown/autocomplete (payload: index)
 *  takeScreenshot                - viewport screenshot
 *  analyzeScreenshot             - ask the vision model (payload: prompt)
 *  saveScreenshot                - write a PNG (payload: filename)
 *  closeBrowser                  - end the session
 *  askUserInput                  - ask the supervising person
 *  createTestPlan / startTest / completeTesting - planning markers
 * </pre>
 */
public final class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private static final Map<String, ActionDefinition> ACTIONS = new LinkedHashMap<>();

    static {
        register("visitUrl",
                "Navigates to a URL and updates the DOM snapshot. Args: the URL, e.g. 'https://example.com'.",
                (ctx, p) -> ctx.session().navigate(p));
        register("listClickableElements",
                "Lists all interactive elements on the current page with their highlight indices, "
                        + "plus a screenshot of the page.",
                (ctx, p) -> ctx.session().listInteractive());
        register("getElementDetails",
                "Returns tag, attributes, visibility and nearby text of the element with the given highlight index.",
                (ctx, p) -> ctx.session().inspect(p));
        register("clickElementByHighlightIndex",
                "Clicks the element with the given highlight index, then lists the new page state.",
                (ctx, p) -> ctx.session().click(p));
        register("fillInputByHighlightIndex",
                "Fills an input with text. Args: '<highlightIndex>||<text>', e.g. '5||Hello world'.",
                (ctx, p) -> ctx.session().fill(p));
        register("openDropdown",
                "Opens a dropdown or autocomplete by clicking the element with the given highlight index.",
                (ctx, p) -> ctx.session().openDropdown(p));
        register("takeScreenshot",
                "Takes a screenshot of the current page and encodes it as base64.",
                (ctx, p) -> ctx.session().screenshot());
        register("analyzeScreenshot",
                "Takes a screenshot and asks a vision model about it. Args: optional question.",
                (ctx, p) -> ctx.session().analyzeScreenshot(p));
        register("saveScreenshot",
                "Saves a screenshot of the current page to a file. Args: optional filename.",
                (ctx, p) -> ctx.session().saveScreenshot(p));
        register("closeBrowser",
                "Closes the current browser session.",
                (ctx, p) -> ctx.session().closeBrowser());
        register("askUserInput",
                "Asks the user what to test and how to reach it. Args: optional question, plain or as {\"question\": ...}.",
                UserPrompts::askUserInput);
        register("createTestPlan",
                "Creates a test plan for a feature. Args: what to test, e.g. 'login form', 'checkout process'.",
                (ctx, p) -> ctx.planner().createTestPlan(p));
        register("startTest",
                "Begins executing a test case from the test plan. Args: the test case ID.",
                (ctx, p) -> ctx.planner().startTest(p));
        register("completeTesting",
                "Completes the current testing session.",
                (ctx, p) -> ctx.planner().completeTesting());
    }

    private ActionRegistry() {}

    /** Adds or replaces an action. */
    public static synchronized void register(String name, String description, ActionHandler handler) {
        ActionDefinition previous = ACTIONS.put(name, new ActionDefinition(name, description, handler));
        if (previous != null) {
            log.debug("Action '{}' re-registered; previous handler replaced", name);
        }
    }

    public static synchronized Optional<ActionDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(ACTIONS.get(name));
    }

    public static synchronized List<ActionDefinition> all() {
        return new ArrayList<>(ACTIONS.values());
    }

    /** One {@code name: description} line per action, for prompts and console help. */
    public static String describe() {
        return all().stream()
                .map(a -> a.name() + ": " + a.description())
                .collect(Collectors.joining("\n"));
    }
}
