package webpilot.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.annotations.Test;
import webpilot.session.BrowserSession;
import webpilot.session.WebPilotException;

import static org.assertj.core.api.Assertions.assertThat;

public class TestPlannerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test(description = "The plan names the feature and page and groups eight cases in three areas")
    public void testCreateTestPlan() throws Exception {
        TestPlanner planner = new TestPlanner(() -> "https://shop.example/cart");

        JsonNode plan = MAPPER.readTree(planner.createTestPlan(" checkout process "));

        assertThat(plan.get("objective").asText()).isEqualTo(
                "Test the checkout process at https://shop.example/cart to ensure functionality, usability, and accessibility");
        JsonNode areas = plan.get("testAreas");
        assertThat(areas).hasSize(3);
        assertThat(areas.get(0).get("name").asText()).isEqualTo("Functionality");
        assertThat(areas.get(1).get("testCases")).hasSize(3);
        JsonNode first = areas.get(0).get("testCases").get(0);
        assertThat(first.get("id").asText()).isEqualTo("FUNC-001");
        assertThat(first.get("steps").get(1).asText()).isEqualTo("Provide valid input data");
        assertThat(areas.get(2).get("testCases").get(0).get("id").asText()).isEqualTo("ACC-001");
    }

    @Test(description = "A plan needs a feature to test")
    public void testCreateTestPlanWithoutTarget() {
        TestPlanner planner = new TestPlanner(() -> "https://example.com");

        assertThat(planner.createTestPlan(" "))
                .isEqualTo("Error: Please specify what to test (e.g., 'login form', 'checkout process').");
    }

    @Test(description = "Without a browser the plan cannot be made")
    public void testCreateTestPlanWithoutSession() {
        TestPlanner planner = new TestPlanner(() -> {
            throw new WebPilotException(BrowserSession.NO_SESSION);
        });

        assertThat(planner.createTestPlan("search")).isEqualTo("Error: " + BrowserSession.NO_SESSION);
    }

    @Test(description = "startTest echoes the case id and requires one")
    public void testStartTest() {
        TestPlanner planner = new TestPlanner(() -> "");

        assertThat(planner.startTest("VAL-002"))
                .isEqualTo("Starting test case VAL-002. Follow each step and report results.");
        assertThat(planner.startTest("")).isEqualTo("Error: Please specify a test case ID to start.");
    }

    @Test(description = "completeTesting asks for the final report")
    public void testCompleteTesting() throws Exception {
        JsonNode done = MAPPER.readTree(new TestPlanner(() -> "").completeTesting());

        assertThat(done.get("message").asText()).startsWith("Testing completed.");
    }
}
