package pagebind.decorator;

import org.openqa.selenium.WebElement;

/**
 * Creates instances of user-defined wrapper types around an element.
 */
public interface ElementActivator {

    /**
     * @param type    wrapper type to instantiate
     * @param element element the wrapper is built around
     * @return a new wrapper instance, never null
     */
    <W> W create(Class<W> type, WebElement element);
}
