package webpilot.resolver;

import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.List;

/**
 * Finds displayed elements of a tag whose visible text contains a phrase,
 * folding A-Z the way {@link VisibleTextXPath} does.
 *
 * <p>Shadow roots answer CSS queries only, so this stands in for the XPath
 * text match there.
 */
public class ByTextContent extends By {

    private final String tagName;
    private final String text;

    public ByTextContent(String tagName, String text) {
        this.tagName = tagName;
        this.text = text;
    }

    @Override
    public List<WebElement> findElements(SearchContext context) {
        String wanted = VisibleTextXPath.foldAscii(VisibleTextXPath.normalize(text));
        return context.findElements(By.cssSelector(tagName)).stream()
                .filter(WebElement::isDisplayed)
                .filter(el -> {
                    String visible = el.getText();
                    return visible != null
                            && VisibleTextXPath.foldAscii(VisibleTextXPath.normalize(visible)).contains(wanted);
                })
                .toList();
    }

    public String getTagName() { return tagName; }
    public String getText()    { return text; }

    @Override
    public String toString() {
        return "By.text: " + tagName + " [text~=\"" + text + "\"]";
    }
}
