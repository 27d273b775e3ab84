package pagebind.locator;

import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Locates elements directly against a {@link SearchContext}.
 *
 * <p>No waiting, no caching and no retry: a criterion either matches right
 * now or the next one is tried. Staleness of returned handles is handled by
 * the proxies built on top of this locator.
 */
public class DefaultElementLocator implements ElementLocator {

    private static final Logger log = LoggerFactory.getLogger(DefaultElementLocator.class);

    private final SearchContext searchContext;

    /**
     * @param searchContext driver or element that scopes every lookup
     */
    public DefaultElementLocator(SearchContext searchContext) {
        this.searchContext = Objects.requireNonNull(searchContext, "searchContext must not be null");
    }

    @Override
    public SearchContext getSearchContext() {
        return searchContext;
    }

    @Override
    public WebElement locateElement(LocatorCriteria criteria) {
        Objects.requireNonNull(criteria, "List of criteria may not be null");

        StringBuilder tried = null;
        NoSuchElementException last = null;
        for (By by : criteria) {
            try {
                WebElement found = searchContext.findElement(by);
                log.debug("Located element by {}", by);
                return found;
            } catch (ElementNotFoundException e) {
                // the scoping element itself is gone; later criteria would fail the same way
                throw e;
            } catch (NoSuchElementException e) {
                log.debug("No element found by {}", by);
                tried = tried == null
                        ? new StringBuilder("Could not find element by: ").append(by)
                        : tried.append(", or: ").append(by);
                last = e;
            }
        }

        throw new ElementNotFoundException(String.valueOf(tried), criteria, last);
    }

    @Override
    public List<WebElement> locateElements(LocatorCriteria criteria) {
        Objects.requireNonNull(criteria, "List of criteria may not be null");

        List<WebElement> all = new ArrayList<>();
        for (By by : criteria) {
            List<WebElement> found = searchContext.findElements(by);
            log.debug("Located {} element(s) by {}", found.size(), by);
            all.addAll(found);
        }
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return "DefaultElementLocator{" + searchContext + "}";
    }
}
