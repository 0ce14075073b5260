package webpilot.snapshot;

import webpilot.dom.ListenerIntrospection;
import webpilot.dom.LiveNode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an element is something a user can act on.
 *
 * <p>Two tiers: declarative signals (tag, role, tabindex, known widget
 * markers) and click affinity (handlers, listeners, drag, ARIA state). The
 * click-affinity tier is skipped for {@code body} and its direct children,
 * which frequently carry page-wide delegated handlers.
 */
public class InteractivityClassifier {

    static final Set<String> INTERACTIVE_TAGS = Set.of(
            "a", "button", "details", "embed", "input", "label", "menu",
            "menuitem", "object", "select", "textarea", "summary");

    static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "menu", "menuitem", "link", "checkbox", "radio", "slider",
            "tab", "tabpanel", "textbox", "combobox", "grid", "listbox", "option",
            "progressbar", "scrollbar", "searchbox", "switch", "tree", "treeitem",
            "spinbutton", "tooltip", "a-button-inner", "a-dropdown-button", "click",
            "menuitemcheckbox", "menuitemradio", "a-button-text", "button-text",
            "button-icon", "button-icon-only", "button-text-icon-only", "dropdown");

    static final String AUTOCOMPLETE_CLASS = "address-input__container__input";

    static final Set<String> DROPDOWN_ACTIONS = Set.of("a-dropdown-select", "a-dropdown-button");

    static final List<String> CLICK_BINDING_ATTRIBUTES = List.of("onclick", "ng-click", "@click", "v-on:click");

    static final Set<String> CLICK_EVENT_TYPES = Set.of("click", "mousedown", "mouseup", "touchstart", "touchend");

    static final List<String> ARIA_STATE_ATTRIBUTES = List.of(
            "aria-expanded", "aria-pressed", "aria-selected", "aria-checked");

    public boolean isInteractive(LiveNode node, Optional<ListenerIntrospection> listeners) {
        if (isDeclarativelyInteractive(node)) return true;
        if ("body".equals(node.getTagName()) || "body".equals(node.getParentTagName())) return false;
        return hasClickAffinity(node, listeners);
    }

    boolean isDeclarativelyInteractive(LiveNode node) {
        if (INTERACTIVE_TAGS.contains(node.getTagName())) return true;
        if (INTERACTIVE_ROLES.contains(node.attribute("role"))) return true;
        if (INTERACTIVE_ROLES.contains(node.attribute("aria-role"))) return true;

        String tabindex = node.attribute("tabindex");
        if (tabindex != null && !"-1".equals(tabindex) && !"body".equals(node.getParentTagName())) return true;

        if (hasClass(node, AUTOCOMPLETE_CLASS)) return true;
        return DROPDOWN_ACTIONS.contains(node.attribute("data-action"));
    }

    boolean hasClickAffinity(LiveNode node, Optional<ListenerIntrospection> listeners) {
        if (node.hasClickHandler()) return true;
        for (String attr : CLICK_BINDING_ATTRIBUTES) {
            if (node.hasAttribute(attr)) return true;
        }
        if (hasClickListener(node, listeners)) return true;
        if (node.isDraggable() || "true".equals(node.attribute("draggable"))) return true;
        for (String attr : ARIA_STATE_ATTRIBUTES) {
            if (node.hasAttribute(attr)) return true;
        }
        return false;
    }

    private boolean hasClickListener(LiveNode node, Optional<ListenerIntrospection> listeners) {
        if (listeners.isPresent()) {
            return listeners.get().listenerTypes(node).stream().anyMatch(CLICK_EVENT_TYPES::contains);
        }
        // No introspection: fall back to inline on<type> handlers
        return CLICK_EVENT_TYPES.stream().anyMatch(type -> node.hasAttribute("on" + type));
    }

    private static boolean hasClass(LiveNode node, String className) {
        String cls = node.attribute("class");
        return cls != null && Arrays.asList(cls.trim().split("\\s+")).contains(className);
    }
}
