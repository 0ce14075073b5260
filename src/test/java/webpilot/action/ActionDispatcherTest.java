package webpilot.action;

import com.fasterxml.jackson.databind.node.TextNode;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import webpilot.planning.TestPlanner;
import webpilot.session.BrowserSession;
import webpilot.session.WebPilotException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ActionDispatcher} with a mocked session and planner.
 */
public class ActionDispatcherTest {

    private BrowserSession session;
    private TestPlanner planner;
    private ActionDispatcher dispatcher;

    @BeforeMethod
    public void setUp() {
        session = mock(BrowserSession.class);
        planner = mock(TestPlanner.class);
        dispatcher = new ActionDispatcher(new ActionContext(session, planner, q -> "the login page"));
    }

    @Test(description = "Actions route to the session with their payload")
    public void testSessionRouting() {
        when(session.navigate("example.com")).thenReturn("Visited URL: https://example.com and updated DOM snapshot.");
        when(session.fill("3||hi")).thenReturn("Filled element at highlightIndex 3 with \"hi\"");

        assertThat(dispatcher.run("visitUrl", "example.com")).startsWith("Visited URL:");
        assertThat(dispatcher.run("fillInputByHighlightIndex", "3||hi")).startsWith("Filled element");
        dispatcher.run("clickElementByHighlightIndex", "4");
        verify(session).click("4");
    }

    @Test(description = "Planning actions route to the planner")
    public void testPlannerRouting() {
        when(planner.createTestPlan("login form")).thenReturn("{plan}");

        assertThat(dispatcher.run("createTestPlan", "login form")).isEqualTo("{plan}");
        dispatcher.run("completeTesting", "");
        verify(planner).completeTesting();
    }

    @Test(description = "A null payload reaches handlers as an empty string")
    public void testNullPayload() {
        dispatcher.run("getElementDetails", null);

        verify(session).inspect("");
    }

    @Test(description = "Unknown actions list what is available")
    public void testUnknownAction() {
        String result = dispatcher.run("scrollDown", "");

        assertThat(result).startsWith("Error: Unknown action 'scrollDown'. Available actions: visitUrl, ");
        assertThat(result).contains("completeTesting");
    }

    @Test(description = "Handler exceptions become error results")
    public void testHandlerException() {
        when(session.listInteractive()).thenThrow(new WebPilotException("driver went away"));

        assertThat(dispatcher.run("listClickableElements", "")).isEqualTo("Error: driver went away");
    }

    @Test(description = "Dispatching an invocation echoes the bug value untouched")
    public void testDispatchCarriesBug() {
        when(session.screenshot()).thenReturn("{\"message\":\"Screenshot taken successfully.\"}");
        ActionInvocation inv = new ActionInvocation("takeScreenshot", null, "checking layout",
                TextNode.valueOf("Logo overlaps menu"));

        ActionOutcome outcome = dispatcher.dispatch(inv);

        assertThat(outcome.action()).isEqualTo("takeScreenshot");
        assertThat(outcome.result()).contains("Screenshot taken successfully.");
        assertThat(outcome.bug().asText()).isEqualTo("Logo overlaps menu");
        assertThat(outcome.isError()).isFalse();
    }

    @Test(description = "askUserInput relays the question and the answer")
    public void testAskUserInput() {
        assertThat(dispatcher.run("askUserInput", "{\"question\": \"Where is the form?\"}"))
                .isEqualTo("User provided the following information: the login page");
    }
}
