package pagebind.locator;

import org.openqa.selenium.NoSuchElementException;

/**
 * Thrown when none of the configured criteria match an element.
 * Carries the attempted criteria for diagnostics.
 */
public class ElementNotFoundException extends NoSuchElementException {

    private final LocatorCriteria criteria;

    public ElementNotFoundException(String msg, LocatorCriteria criteria) {
        super(msg);
        this.criteria = criteria;
    }

    public ElementNotFoundException(String msg, LocatorCriteria criteria, Throwable cause) {
        super(msg, cause);
        this.criteria = criteria;
    }

    public LocatorCriteria getCriteria() {
        return criteria;
    }
}
