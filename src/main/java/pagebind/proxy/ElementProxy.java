package pagebind.proxy;

import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.Point;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.WrapsElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pagebind.locator.ElementLocator;
import pagebind.locator.ElementNotFoundException;
import pagebind.locator.LocatorCriteria;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link WebElement} that locates its target lazily and heals itself once
 * per call when the target goes stale.
 *
 * <p>Every call goes through the same pipeline:
 * <ol>
 *   <li>If no element is cached, locate one.</li>
 *   <li>Invoke the call on the cached element.</li>
 *   <li>On {@link StaleElementReferenceException}, drop the cached element,
 *       locate again and retry the call once.</li>
 *   <li>A second staleness within the same call is rethrown unchanged.</li>
 * </ol>
 * Any other exception propagates immediately and leaves the cache as it is.
 * Nothing is located at construction time, and a cached element is never
 * re-validated until a call on it fails.
 *
 * <p>One lock per proxy guards the cache. A thread that sees a stale element
 * only re-locates if that element is still the cached one, so two threads
 * failing on the same stale element cause a single re-location.
 */
public class ElementProxy implements WebElement, WrapsElement {

    private static final Logger log = LoggerFactory.getLogger(ElementProxy.class);

    private final Supplier<WebElement> resolver;
    private final String description;
    private final Object lock = new Object();

    private WebElement cached;

    ElementProxy(Supplier<WebElement> resolver, String description, WebElement located) {
        this.resolver    = resolver;
        this.description = description;
        this.cached      = located;
    }

    /**
     * Creates a proxy for the first element matched by {@code criteria}.
     *
     * @param locator  locator used on first use and after staleness
     * @param criteria criteria, tried in order
     */
    public static ElementProxy create(ElementLocator locator, LocatorCriteria criteria) {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(criteria, "criteria must not be null");
        return new ElementProxy(() -> locator.locateElement(criteria),
                "Proxy element for: " + criteria, null);
    }

    /**
     * Creates a proxy for the element at {@code index} of a list that was just
     * located. The proxy starts out holding {@code located}; after staleness
     * it re-locates the whole list and takes the element at the same index.
     */
    static ElementProxy forListMember(ElementLocator locator, LocatorCriteria criteria,
                                      int index, WebElement located) {
        Supplier<WebElement> resolver = () -> {
            List<WebElement> all = locator.locateElements(criteria);
            if (index >= all.size()) {
                throw new ElementNotFoundException(String.format(
                        "Could not find element #%d by: %s (only %d present)", index, criteria, all.size()),
                        criteria);
            }
            return all.get(index);
        };
        return new ElementProxy(resolver, "Proxy element #" + index + " for: " + criteria, located);
    }

    // ── Resolve / invoke / recover ────────────────────────────────────────

    private WebElement current() {
        synchronized (lock) {
            if (cached == null) {
                cached = resolver.get();
                log.debug("Resolved {}", description);
            }
            return cached;
        }
    }

    private WebElement relocate(WebElement stale) {
        synchronized (lock) {
            if (cached == null || cached == stale) {
                // stays empty if re-location fails
                cached = null;
                cached = resolver.get();
                log.debug("Re-resolved stale {}", description);
            }
            return cached;
        }
    }

    private <T> T invoke(Function<WebElement, T> call) {
        WebElement element = current();
        try {
            return call.apply(element);
        } catch (StaleElementReferenceException e) {
            log.debug("Stale element reference in {}, retrying once", description);
            return call.apply(relocate(element));
        }
    }

    private void execute(Consumer<WebElement> call) {
        invoke(element -> {
            call.accept(element);
            return null;
        });
    }

    // ── WrapsElement ──────────────────────────────────────────────────────

    /** The located element, locating it first if necessary. */
    @Override
    public WebElement getWrappedElement() {
        return current();
    }

    // ── WebElement ────────────────────────────────────────────────────────

    @Override
    public void click() {
        execute(WebElement::click);
    }

    @Override
    public void submit() {
        execute(WebElement::submit);
    }

    @Override
    public void sendKeys(CharSequence... keysToSend) {
        execute(e -> e.sendKeys(keysToSend));
    }

    @Override
    public void clear() {
        execute(WebElement::clear);
    }

    @Override
    public String getTagName() {
        return invoke(WebElement::getTagName);
    }

    @Override
    public String getDomProperty(String name) {
        return invoke(e -> e.getDomProperty(name));
    }

    @Override
    public String getDomAttribute(String name) {
        return invoke(e -> e.getDomAttribute(name));
    }

    @Override
    public String getAttribute(String name) {
        return invoke(e -> e.getAttribute(name));
    }

    @Override
    public String getAriaRole() {
        return invoke(WebElement::getAriaRole);
    }

    @Override
    public String getAccessibleName() {
        return invoke(WebElement::getAccessibleName);
    }

    @Override
    public boolean isSelected() {
        return invoke(WebElement::isSelected);
    }

    @Override
    public boolean isEnabled() {
        return invoke(WebElement::isEnabled);
    }

    @Override
    public String getText() {
        return invoke(WebElement::getText);
    }

    @Override
    public List<WebElement> findElements(By by) {
        return invoke(e -> e.findElements(by));
    }

    @Override
    public WebElement findElement(By by) {
        return invoke(e -> e.findElement(by));
    }

    @Override
    public SearchContext getShadowRoot() {
        return invoke(WebElement::getShadowRoot);
    }

    @Override
    public boolean isDisplayed() {
        return invoke(WebElement::isDisplayed);
    }

    @Override
    public Point getLocation() {
        return invoke(WebElement::getLocation);
    }

    @Override
    public Dimension getSize() {
        return invoke(WebElement::getSize);
    }

    @Override
    public Rectangle getRect() {
        return invoke(WebElement::getRect);
    }

    @Override
    public String getCssValue(String propertyName) {
        return invoke(e -> e.getCssValue(propertyName));
    }

    @Override
    public <X> X getScreenshotAs(OutputType<X> target) {
        return invoke(e -> e.getScreenshotAs(target));
    }

    /**
     * Two element handles are equal when they locate the same element. Both
     * sides are unwrapped, so a proxy equals the element it located and any
     * other proxy that located it. Locates this proxy's element if needed.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebElement)) return false;
        Object other = o instanceof WrapsElement ? ((WrapsElement) o).getWrappedElement() : o;
        return current().equals(other);
    }

    /** Hash of the located element. Locates it if needed. */
    @Override
    public int hashCode() {
        return current().hashCode();
    }

    @Override
    public String toString() {
        return description;
    }
}
