package pagebind.decorator;

import org.openqa.selenium.WebElement;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates wrappers from explicitly registered factory functions, without
 * reflection.
 *
 * <pre>{@code
 * ElementActivator activator = new RegistryElementActivator()
 *         .register(SearchResult.class, SearchResult::new)
 *         .register(MenuItem.class, MenuItem::new);
 * }</pre>
 *
 * Unregistered types go to the fallback activator when one is configured.
 */
public class RegistryElementActivator implements ElementActivator {

    private final Map<Class<?>, Function<WebElement, ?>> factories = new ConcurrentHashMap<>();
    private final ElementActivator fallback;

    public RegistryElementActivator() {
        this(null);
    }

    /**
     * @param fallback activator used for unregistered types, or {@code null}
     *                 to reject them
     */
    public RegistryElementActivator(ElementActivator fallback) {
        this.fallback = fallback;
    }

    public <W> RegistryElementActivator register(Class<W> type, Function<WebElement, ? extends W> factory) {
        factories.put(Objects.requireNonNull(type, "type must not be null"),
                Objects.requireNonNull(factory, "factory must not be null"));
        return this;
    }

    @Override
    public <W> W create(Class<W> type, WebElement element) {
        Function<WebElement, ?> factory = factories.get(type);
        if (factory != null) {
            return type.cast(factory.apply(element));
        }
        if (fallback != null) {
            return fallback.create(type, element);
        }
        throw new DecorationException("No activator registered for wrapper type " + type.getName());
    }
}
