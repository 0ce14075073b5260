package webpilot.resolver;

import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds displayed elements by ARIA role (explicit or implied by the tag) whose
 * accessible name contains the given name, case-insensitively.
 */
public class ByAccessibleRole extends By {

    private static final Map<String, String> IMPLICIT_ROLES = Map.of(
            "button", "button:not([role]), input[type=button]:not([role]), input[type=submit]:not([role]),"
                    + " input[type=reset]:not([role]), input[type=image]:not([role]), summary:not([role])",
            "link", "a[href]:not([role]), area[href]:not([role])",
            "checkbox", "input[type=checkbox]:not([role])",
            "radio", "input[type=radio]:not([role])",
            "textbox", "input:not([type]):not([role]), input[type=text]:not([role]), input[type=email]:not([role]),"
                    + " input[type=tel]:not([role]), input[type=url]:not([role]), textarea:not([role])",
            "combobox", "select:not([role])",
            "searchbox", "input[type=search]:not([role])");

    private final String role;
    private final String name;

    public ByAccessibleRole(String role, String name) {
        this.role = role;
        this.name = name;
    }

    @Override
    public List<WebElement> findElements(SearchContext context) {
        String wanted = name == null ? "" : VisibleTextXPath.normalize(name).toLowerCase(Locale.ROOT);
        return context.findElements(By.cssSelector(selector())).stream()
                .filter(WebElement::isDisplayed)
                .filter(el -> wanted.isEmpty() || accessibleName(el).contains(wanted))
                .toList();
    }

    String selector() {
        String explicit = "[role=\"" + role.replace("\"", "\\\"") + "\"]";
        String implicit = IMPLICIT_ROLES.get(role);
        return implicit == null ? explicit : explicit + ", " + implicit;
    }

    private static String accessibleName(WebElement el) {
        String computed;
        try {
            computed = el.getAccessibleName();
        } catch (WebDriverException | UnsupportedOperationException e) {
            computed = null;
        }
        if (computed == null || computed.isBlank()) {
            String label = el.getAttribute("aria-label");
            computed = label != null && !label.isBlank() ? label : el.getText();
        }
        return computed == null ? "" : VisibleTextXPath.normalize(computed).toLowerCase(Locale.ROOT);
    }

    public String getRole() { return role; }
    public String getName() { return name; }

    @Override
    public String toString() {
        return "By.role: " + role + " [name~=\"" + name + "\"]";
    }
}
