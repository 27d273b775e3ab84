package pagebind.proxy;

import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A list of wrappers rebuilt from a fresh {@link ElementListProxy} snapshot
 * on every access. Each wrapper is created around its own element proxy.
 *
 * @param <W> wrapper type
 */
public class WrapperListProxy<W> extends RelocatingList<W> {

    private final ElementListProxy elements;
    private final Function<? super WebElement, ? extends W> wrap;

    /**
     * @param elements source of fresh element proxies
     * @param wrap     builds and populates one wrapper around one element
     */
    public WrapperListProxy(ElementListProxy elements, Function<? super WebElement, ? extends W> wrap) {
        this.elements = Objects.requireNonNull(elements, "elements must not be null");
        this.wrap     = Objects.requireNonNull(wrap, "wrap must not be null");
    }

    @Override
    protected List<W> snapshot() {
        List<WebElement> current = elements.snapshot();
        List<W> wrappers = new ArrayList<>(current.size());
        for (WebElement element : current) {
            wrappers.add(wrap.apply(element));
        }
        return Collections.unmodifiableList(wrappers);
    }

    // Counting or indexing only wraps what is asked for

    @Override
    public int size() {
        return elements.snapshot().size();
    }

    @Override
    public boolean isEmpty() {
        return elements.snapshot().isEmpty();
    }

    @Override
    public W get(int index) {
        return wrap.apply(elements.snapshot().get(index));
    }

    @Override
    public String toString() {
        return "Proxy wrapper list over " + elements;
    }
}
