package webpilot.snapshot;

import webpilot.model.ElementNode;
import webpilot.model.SnapshotNode;
import webpilot.model.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the human-readable text of a snapshot subtree: text nodes plus the
 * descriptive attributes of every element, in pre-order.
 */
public final class TextAggregator {

    /** Length cap for text shown in element details and used for text-based resolution. */
    public static final int DISPLAY_LIMIT = 300;

    static final List<String> TEXT_ATTRIBUTES = List.of("placeholder", "alt", "title", "aria-label", "value");

    private TextAggregator() {}

    public static String aggregate(SnapshotNode node) {
        List<String> parts = new ArrayList<>();
        collect(node, parts);
        return String.join(" ", parts);
    }

    public static String aggregate(SnapshotNode node, int maxLength) {
        String text = aggregate(node);
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    private static void collect(SnapshotNode node, List<String> parts) {
        if (node instanceof TextNode text) {
            add(parts, text.getText());
        } else if (node instanceof ElementNode el) {
            for (String attr : TEXT_ATTRIBUTES) {
                add(parts, el.attribute(attr));
            }
            for (SnapshotNode child : el.getChildren()) {
                collect(child, parts);
            }
        }
    }

    private static void add(List<String> parts, String value) {
        if (value == null) return;
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) parts.add(trimmed);
    }
}
