package webpilot.resolver;

import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.List;

/**
 * A lazily evaluated locator. Nothing touches the page until {@link #locate}
 * is called, so an invalid selector only fails when the action uses it.
 *
 * <p>An element inside shadow DOM carries its host chain, outermost first;
 * {@link #locate} enters each host's shadow root before applying {@link #by}.
 */
public record ResolvedLocator(LocatorStrategy strategy, By by, List<By> shadowHosts) {

    public ResolvedLocator {
        shadowHosts = List.copyOf(shadowHosts);
    }

    public ResolvedLocator(LocatorStrategy strategy, By by) {
        this(strategy, by, List.of());
    }

    /**
     * First matching element.
     *
     * @throws org.openqa.selenium.NoSuchElementException if a host or the element is missing
     * @throws org.openqa.selenium.NoSuchShadowRootException if a host no longer has a shadow root
     */
    public WebElement locate(SearchContext context) {
        SearchContext scope = context;
        for (By host : shadowHosts) {
            scope = scope.findElement(host).getShadowRoot();
        }
        return scope.findElement(by);
    }

    @Override
    public String toString() {
        if (shadowHosts.isEmpty()) return strategy + " " + by;
        return strategy + " " + by + " in shadow root of " + shadowHosts;
    }
}
