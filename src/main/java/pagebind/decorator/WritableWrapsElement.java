package pagebind.decorator;

import org.openqa.selenium.WebElement;
import org.openqa.selenium.WrapsElement;

/**
 * A wrapper whose embedded element slot can be assigned after construction.
 * The decorator writes the element proxy into it right after activation.
 */
public interface WritableWrapsElement extends WrapsElement {

    void setWrappedElement(WebElement element);
}
