package webpilot.resolver;

import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchShadowRootException;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ResolvedLocator} lookups through shadow roots.
 */
public class ResolvedLocatorTest {

    private static final By OUTER = By.cssSelector("html:nth-of-type(1) > body:nth-of-type(1) > my-el:nth-of-type(1)");
    private static final By INNER = By.cssSelector("div:nth-of-type(1) > x-field:nth-of-type(1)");

    private WebDriver driver;

    @BeforeMethod
    public void setUp() {
        driver = mock(WebDriver.class);
    }

    @Test(description = "A light DOM locator searches the page directly")
    public void testLightDom() {
        WebElement input = mock(WebElement.class);
        By byId = By.id("q");
        when(driver.findElement(byId)).thenReturn(input);

        assertThat(new ResolvedLocator(LocatorStrategy.ID, byId).locate(driver)).isSameAs(input);
    }

    @Test(description = "A button inside a web component is found through its host's shadow root")
    public void testShadowRootChild() {
        WebElement host = mock(WebElement.class);
        SearchContext root = mock(SearchContext.class);
        WebElement button = mock(WebElement.class);
        By byRole = new ByAccessibleRole("button", "Go");
        when(driver.findElement(OUTER)).thenReturn(host);
        when(host.getShadowRoot()).thenReturn(root);
        when(root.findElement(byRole)).thenReturn(button);

        WebElement found = new ResolvedLocator(LocatorStrategy.ROLE, byRole, List.of(OUTER)).locate(driver);

        assertThat(found).isSameAs(button);
        verify(driver, never()).findElement(byRole);
    }

    @Test(description = "Nested shadow roots are entered outermost first")
    public void testNestedShadowRoots() {
        WebElement outerHost = mock(WebElement.class);
        SearchContext outerRoot = mock(SearchContext.class);
        WebElement innerHost = mock(WebElement.class);
        SearchContext innerRoot = mock(SearchContext.class);
        WebElement input = mock(WebElement.class);
        By byId = By.cssSelector("#email");
        when(driver.findElement(OUTER)).thenReturn(outerHost);
        when(outerHost.getShadowRoot()).thenReturn(outerRoot);
        when(outerRoot.findElement(INNER)).thenReturn(innerHost);
        when(innerHost.getShadowRoot()).thenReturn(innerRoot);
        when(innerRoot.findElement(byId)).thenReturn(input);

        WebElement found = new ResolvedLocator(LocatorStrategy.ID, byId, List.of(OUTER, INNER)).locate(driver);

        assertThat(found).isSameAs(input);
    }

    @Test(description = "A host that lost its shadow root fails the lookup")
    public void testMissingShadowRoot() {
        WebElement host = mock(WebElement.class);
        when(driver.findElement(OUTER)).thenReturn(host);
        when(host.getShadowRoot()).thenThrow(new NoSuchShadowRootException("no shadow root"));
        ResolvedLocator locator = new ResolvedLocator(LocatorStrategy.CLASS, By.cssSelector(".btn"), List.of(OUTER));

        assertThatThrownBy(() -> locator.locate(driver)).isInstanceOf(NoSuchShadowRootException.class);
        verify(host, never()).findElement(any());
    }

    @Test(description = "Text matching inside a shadow root filters CSS matches by visible text")
    public void testByTextContent() {
        SearchContext root = mock(SearchContext.class);
        WebElement home = mock(WebElement.class);
        WebElement about = mock(WebElement.class);
        WebElement hidden = mock(WebElement.class);
        when(home.isDisplayed()).thenReturn(true);
        when(home.getText()).thenReturn("Home");
        when(about.isDisplayed()).thenReturn(true);
        when(about.getText()).thenReturn("  Über\n UNS ");
        when(hidden.isDisplayed()).thenReturn(false);
        when(hidden.getText()).thenReturn("Über uns");
        when(root.findElements(By.cssSelector("a"))).thenReturn(List.of(home, hidden, about));

        List<WebElement> found = new ByTextContent("a", "Über uns").findElements(root);

        assertThat(found).containsExactly(about);
    }
}
