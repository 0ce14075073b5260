package webpilot.action;

import webpilot.planning.TestPlanner;
import webpilot.session.BrowserSession;

/**
 * Everything an action handler may act on.
 */
public record ActionContext(BrowserSession session, TestPlanner planner, HumanInput human) {

    public static ActionContext of(BrowserSession session, HumanInput human) {
        return new ActionContext(session, new TestPlanner(session), human);
    }
}
