package webpilot.dom;

import java.util.Set;

/**
 * Tag names shared by the capture script and the snapshot classifier.
 */
public final class DomTags {

    /** Elements that never carry page content: rejected and not descended. */
    public static final Set<String> NON_CONTENT = Set.of("svg", "script", "style", "link", "meta");

    private DomTags() {}
}
