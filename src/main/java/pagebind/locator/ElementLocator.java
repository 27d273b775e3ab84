package pagebind.locator;

import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.List;

/**
 * Resolves {@link LocatorCriteria} against a {@link SearchContext}.
 *
 * <p>Implementations are the non-caching resolution primitive used by the
 * element proxies; any waiting or retry belongs either below (in the search
 * context) or above (in the proxies).
 */
public interface ElementLocator {

    /** The root every lookup of this locator is evaluated under. */
    SearchContext getSearchContext();

    /**
     * Locates the first element matched by the criteria, trying each criterion
     * in declaration order.
     *
     * @throws ElementNotFoundException if no criterion matches
     */
    WebElement locateElement(LocatorCriteria criteria);

    /**
     * Locates every element matched by any criterion, in criteria order.
     *
     * @return an unmodifiable list, empty when nothing matches
     */
    List<WebElement> locateElements(LocatorCriteria criteria);
}
