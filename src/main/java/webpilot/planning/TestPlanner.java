package webpilot.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.session.BrowserSession;
import webpilot.session.WebPilotException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Planning actions: a template test plan for a named feature, plus the
 * start and completion markers the decision process uses to pace itself.
 */
public class TestPlanner {

    private static final Logger log = LoggerFactory.getLogger(TestPlanner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final List<String> NAVIGATE_SUBMIT = List.of(
            "Navigate to the feature", "%s", "Submit or activate the feature");

    private final Supplier<String> currentUrl;

    public TestPlanner(BrowserSession session) {
        this(session::currentUrl);
    }

    /** Package-private constructor for tests; supplies the URL directly. */
    TestPlanner(Supplier<String> currentUrl) {
        this.currentUrl = currentUrl;
    }

    public String createTestPlan(String target) {
        String feature = target == null ? "" : target.trim();
        if (feature.isEmpty()) {
            return "Error: Please specify what to test (e.g., 'login form', 'checkout process').";
        }
        String url;
        try {
            url = currentUrl.get();
        } catch (WebPilotException e) {
            return "Error: " + e.getMessage();
        }
        log.info("Creating test plan for '{}' at {}", feature, url);
        return write(plan(feature, url));
    }

    public String startTest(String testCaseId) {
        String id = testCaseId == null ? "" : testCaseId.trim();
        if (id.isEmpty()) {
            return "Error: Please specify a test case ID to start.";
        }
        log.info("Starting test case {}", id);
        return "Starting test case " + id + ". Follow each step and report results.";
    }

    public String completeTesting() {
        return write(Map.of("message",
                "Testing completed. Generate your final report with findings and conclusions."));
    }

    static TestPlan plan(String feature, String url) {
        TestPlan.Area functionality = new TestPlan.Area(
                "Functionality",
                "Test that all " + feature + " features work as expected",
                List.of(
                        testCase("FUNC-001", "Test basic " + feature + " functionality with valid inputs",
                                "Provide valid input data", "Feature should work as intended"),
                        testCase("FUNC-002", "Test " + feature + " functionality with edge cases",
                                "Provide edge case inputs", "Feature should handle edge cases appropriately")));

        TestPlan.Area validation = new TestPlan.Area(
                "Input Validation",
                "Test how " + feature + " validates and handles different inputs",
                List.of(
                        testCase("VAL-001", "Test " + feature + " with invalid inputs",
                                "Provide invalid input data",
                                "Error messages should be displayed and no invalid data should be processed"),
                        testCase("VAL-002", "Test " + feature + " with boundary values",
                                "Provide boundary value inputs",
                                "System should handle boundary values according to requirements"),
                        testCase("VAL-003", "Test " + feature + " with special characters and potentially malicious inputs",
                                "Provide inputs with special characters",
                                "System should sanitize and handle special characters appropriately")));

        TestPlan.Area accessibility = new TestPlan.Area(
                "Accessibility",
                "Test that " + feature + " is accessible to all users",
                List.of(
                        new TestPlan.Case("ACC-001", "Test " + feature + " keyboard navigation",
                                List.of("Navigate to the feature",
                                        "Attempt to use all feature functionality using only keyboard",
                                        "Check tab order and focus indicators"),
                                "All functionality should be accessible via keyboard"),
                        new TestPlan.Case("ACC-002", "Test " + feature + " for readable text and proper contrast",
                                List.of("Navigate to the feature",
                                        "Check text size and contrast",
                                        "Verify all content is readable"),
                                "All text should be readable with adequate contrast")));

        return new TestPlan(
                "Test the " + feature + " at " + url + " to ensure functionality, usability, and accessibility",
                List.of(functionality, validation, accessibility),
                "This test plan covers basic functionality, input validation, and accessibility testing for "
                        + feature + ". Execute each test case systematically and report any issues.");
    }

    private static TestPlan.Case testCase(String id, String description, String inputStep, String expected) {
        List<String> steps = NAVIGATE_SUBMIT.stream()
                .map(step -> step.equals("%s") ? inputStep : step)
                .toList();
        return new TestPlan.Case(id, description, steps, expected);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Cannot serialise planner result", e);
        }
    }
}
