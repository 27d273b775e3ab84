package pagebind.decorator;

import org.openqa.selenium.WebElement;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Creates wrappers through their constructors.
 *
 * <p>A constructor taking a single {@link WebElement} is preferred; otherwise
 * the no-arg constructor is used and the element is expected to be written
 * into a {@link WritableWrapsElement} slot afterwards. Runtime exceptions
 * thrown by the wrapper's own constructor propagate unchanged.
 */
public class DefaultElementActivator implements ElementActivator {

    @Override
    public <W> W create(Class<W> type, WebElement element) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new DecorationException("Cannot create wrapper of abstract type " + type.getName());
        }

        try {
            Constructor<W> ctor = findConstructor(type);
            ctor.setAccessible(true);
            return ctor.getParameterCount() == 1 ? ctor.newInstance(element) : ctor.newInstance();
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new DecorationException("Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException | SecurityException e) {
            throw new DecorationException("Cannot create wrapper " + type.getName(), e);
        }
    }

    private static <W> Constructor<W> findConstructor(Class<W> type) throws NoSuchMethodException {
        try {
            return type.getDeclaredConstructor(WebElement.class);
        } catch (NoSuchMethodException e) {
            return type.getDeclaredConstructor();
        }
    }
}
