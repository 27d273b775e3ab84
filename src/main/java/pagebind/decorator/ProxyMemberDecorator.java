package pagebind.decorator;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pagebind.locator.DefaultElementLocator;
import pagebind.locator.ElementLocator;
import pagebind.locator.LocatorCriteria;
import pagebind.proxy.ElementListProxy;
import pagebind.proxy.ElementProxy;
import pagebind.proxy.WrapperListProxy;

import java.util.Objects;

/**
 * Decorates members with lazy proxies, so no element is located until the
 * page object actually uses it.
 *
 * <p>Dispatch follows {@link MemberType#shape()}:
 * <ul>
 *   <li>{@code WebElement}: an {@link ElementProxy}</li>
 *   <li>wrapper: a wrapper created around an {@link ElementProxy}, with its
 *       own members populated against a locator rooted at that element</li>
 *   <li>{@code List<WebElement>}: an {@link ElementListProxy}</li>
 *   <li>{@code List<wrapper>}: a {@link WrapperListProxy}, each wrapper
 *       created and populated as above</li>
 * </ul>
 * Anything else raises {@link UnsupportedMemberTypeException}. The decorator
 * returns values only; writing them into members is the caller's job.
 */
public class ProxyMemberDecorator implements MemberDecorator {

    private static final Logger log = LoggerFactory.getLogger(ProxyMemberDecorator.class);

    private final ElementActivator activator;
    private final PageObjectInitializer initializer;

    /**
     * @param activator   creates wrapper instances
     * @param initializer populates the members of created wrappers
     */
    public ProxyMemberDecorator(ElementActivator activator, PageObjectInitializer initializer) {
        this.activator   = Objects.requireNonNull(activator, "activator must not be null");
        this.initializer = Objects.requireNonNull(initializer, "initializer must not be null");
    }

    @Override
    public <T> T decorate(MemberType<T> memberType, LocatorCriteria criteria, ElementLocator locator) {
        MemberShape shape = memberType.shape()
                .orElseThrow(() -> new UnsupportedMemberTypeException(memberType));
        log.debug("Decorating {} as {} for {}", memberType.getTypeName(), shape, criteria);

        Object value = switch (shape) {
            case ELEMENT      -> ElementProxy.create(locator, criteria);
            case WRAPPER      -> createAndPopulate(memberType.getRawType(), ElementProxy.create(locator, criteria));
            case ELEMENT_LIST -> new ElementListProxy(locator, criteria);
            case WRAPPER_LIST -> decorateWrapperList(memberType.getElementType().orElseThrow(), criteria, locator);
        };
        return memberType.cast(value);
    }

    private <W> WrapperListProxy<W> decorateWrapperList(Class<W> wrapperType, LocatorCriteria criteria,
                                                        ElementLocator locator) {
        return new WrapperListProxy<>(new ElementListProxy(locator, criteria),
                element -> createAndPopulate(wrapperType, element));
    }

    private <W> W createAndPopulate(Class<W> wrapperType, WebElement element) {
        W wrapper = activator.create(wrapperType, element);
        if (wrapper instanceof WritableWrapsElement) {
            ((WritableWrapsElement) wrapper).setWrappedElement(element);
        }
        initializer.initElements(wrapper, new DefaultElementLocator(element));
        return wrapper;
    }
}
