package pagebind.decorator;

import org.openqa.selenium.WebElement;
import org.openqa.selenium.WrapsElement;
import pagebind.proxy.ElementProxy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The declared static type of a page-object member.
 *
 * <p>Java erases generic arguments at runtime, so a list member carries its
 * element type explicitly. The type parameter ties the descriptor to the
 * setter it is bound with, so a binding that mixes up types does not compile.
 *
 * @param <T> the member's declared type
 */
public final class MemberType<T> {

    private final Class<?> rawType;
    private final Class<?> elementType;

    private MemberType(Class<?> rawType, Class<?> elementType) {
        this.rawType     = rawType;
        this.elementType = elementType;
    }

    public static MemberType<WebElement> element() {
        return of(WebElement.class);
    }

    public static MemberType<List<WebElement>> elementList() {
        return listOf(WebElement.class);
    }

    public static <T> MemberType<T> of(Class<T> type) {
        return new MemberType<>(Objects.requireNonNull(type, "type must not be null"), null);
    }

    public static <E> MemberType<List<E>> listOf(Class<E> elementType) {
        return new MemberType<>(List.class, Objects.requireNonNull(elementType, "elementType must not be null"));
    }

    public Class<?> getRawType() {
        return rawType;
    }

    /** Element type of a list member; empty for a single-valued member. */
    public Optional<Class<?>> getElementType() {
        return Optional.ofNullable(elementType);
    }

    /**
     * The shape this type is decorated as, checked in the order
     * element, wrapper, list of elements, list of wrappers.
     *
     * @return the first matching shape, or empty if none applies
     */
    public Optional<MemberShape> shape() {
        if (elementType == null) {
            if (holdsElementProxy(rawType)) {
                return Optional.of(MemberShape.ELEMENT);
            }
            if (WrapsElement.class.isAssignableFrom(rawType)) {
                return Optional.of(MemberShape.WRAPPER);
            }
            return Optional.empty();
        }
        if (holdsElementProxy(elementType)) {
            return Optional.of(MemberShape.ELEMENT_LIST);
        }
        if (WrapsElement.class.isAssignableFrom(elementType)) {
            return Optional.of(MemberShape.WRAPPER_LIST);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    T cast(Object value) {
        return (T) value;
    }

    public String getTypeName() {
        return elementType == null
                ? rawType.getSimpleName()
                : rawType.getSimpleName() + "<" + elementType.getSimpleName() + ">";
    }

    // A WebElement subtype the proxy can actually be assigned to
    private static boolean holdsElementProxy(Class<?> type) {
        return WebElement.class.isAssignableFrom(type) && type.isAssignableFrom(ElementProxy.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberType)) return false;
        MemberType<?> other = (MemberType<?>) o;
        return rawType.equals(other.rawType) && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawType, elementType);
    }

    @Override
    public String toString() {
        return "MemberType{" + getTypeName() + "}";
    }
}
