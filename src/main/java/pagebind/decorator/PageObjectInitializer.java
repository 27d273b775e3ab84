package pagebind.decorator;

import pagebind.locator.ElementLocator;

/**
 * Populates the members of a nested page object, such as a wrapper that was
 * just created around an element.
 */
@FunctionalInterface
public interface PageObjectInitializer {

    /**
     * @param page    the object whose members are populated
     * @param locator locator scoped to the page's root
     */
    void initElements(Object page, ElementLocator locator);
}
