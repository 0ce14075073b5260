package webpilot.resolver;

import org.openqa.selenium.By;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.dom.OverlaySurface;
import webpilot.model.ElementNode;
import webpilot.model.Snapshot;
import webpilot.snapshot.TextAggregator;

import java.util.List;

/**
 * Maps a highlight index from the current snapshot back to a locator in the
 * live page.
 *
 * <p>Tiers, first applicable wins:
 * <ol>
 *   <li>no snapshot: the overlay marker attribute</li>
 *   <li>{@code button}: role plus accessible name</li>
 *   <li>{@code a} with text: visible text</li>
 *   <li>{@code id}</li>
 *   <li>{@code class}, as a compound class selector</li>
 *   <li>id-or-class composite, which is invalid and fails on use</li>
 * </ol>
 * Text-based tiers can pick a different element when several share the same
 * text; the first match is used.
 *
 * <p>An element inside shadow DOM is looked up through its host chain, and
 * only with CSS-based locators, since shadow roots do not answer XPath.
 */
public class ElementResolver {

    private static final Logger log = LoggerFactory.getLogger(ElementResolver.class);

    /**
     * @throws ElementNotIndexedException if the snapshot has no element with that index
     */
    public ResolvedLocator resolve(Snapshot snapshot, int highlightIndex) {
        if (snapshot == null) {
            String selector = "[" + OverlaySurface.MARKER_ATTRIBUTE + "=\""
                    + OverlaySurface.MARKER_PREFIX + highlightIndex + "\"]";
            log.debug("No snapshot, resolving index {} via marker attribute", highlightIndex);
            return new ResolvedLocator(LocatorStrategy.HIGHLIGHT_ATTRIBUTE, By.cssSelector(selector));
        }

        ElementNode el = snapshot.findByHighlightIndex(highlightIndex)
                .orElseThrow(() -> new ElementNotIndexedException(highlightIndex));
        ResolvedLocator locator = resolve(el);
        log.debug("Resolved index {} <{}> -> {}", highlightIndex, el.getTagName(), locator);
        return locator;
    }

    ResolvedLocator resolve(ElementNode el) {
        List<By> hosts = el.getShadowHosts().stream().<By>map(By::cssSelector).toList();
        boolean inShadow = !hosts.isEmpty();
        String text = TextAggregator.aggregate(el, TextAggregator.DISPLAY_LIMIT);
        String tag = el.getTagName();

        if ("button".equals(tag)) {
            String role = el.attribute("role");
            return new ResolvedLocator(LocatorStrategy.ROLE,
                    new ByAccessibleRole(isBlank(role) ? "button" : role, text), hosts);
        }
        if ("a".equals(tag) && !text.isBlank()) {
            By byText = inShadow ? new ByTextContent("a", text) : By.xpath(VisibleTextXPath.containing(text));
            return new ResolvedLocator(LocatorStrategy.TEXT, byText, hosts);
        }

        String id = el.attribute("id");
        if (!isBlank(id)) {
            By byId = inShadow ? By.cssSelector("#" + CssSelectors.escape(id)) : By.id(id);
            return new ResolvedLocator(LocatorStrategy.ID, byId, hosts);
        }
        String cls = el.attribute("class");
        if (!isBlank(cls)) {
            return new ResolvedLocator(LocatorStrategy.CLASS, By.cssSelector(CssSelectors.compoundClass(cls)), hosts);
        }
        String composite = "#" + (id != null ? id : cls != null ? cls : "");
        return new ResolvedLocator(LocatorStrategy.COMPOSITE, By.cssSelector(composite), hosts);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
