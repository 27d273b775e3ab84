package pagebind.proxy;

import org.openqa.selenium.WebElement;
import pagebind.locator.ElementLocator;
import pagebind.locator.LocatorCriteria;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code List<WebElement>} that re-locates its elements on every access.
 *
 * <p>Each access runs one {@link ElementLocator#locateElements} call across
 * all criteria and wraps every element found in its own {@link ElementProxy},
 * so pages whose element count changes between reads are always seen as they
 * are now, while each captured element still recovers from staleness on its
 * own. The list is read-only.
 */
public class ElementListProxy extends RelocatingList<WebElement> {

    private final ElementLocator locator;
    private final LocatorCriteria criteria;

    public ElementListProxy(ElementLocator locator, LocatorCriteria criteria) {
        this.locator  = Objects.requireNonNull(locator, "locator must not be null");
        this.criteria = Objects.requireNonNull(criteria, "criteria must not be null");
    }

    @Override
    protected List<WebElement> snapshot() {
        List<WebElement> located = locator.locateElements(criteria);
        List<WebElement> proxies = new ArrayList<>(located.size());
        for (int i = 0; i < located.size(); i++) {
            proxies.add(ElementProxy.forListMember(locator, criteria, i, located.get(i)));
        }
        return Collections.unmodifiableList(proxies);
    }

    @Override
    public String toString() {
        return "Proxy element list for: " + criteria;
    }
}
