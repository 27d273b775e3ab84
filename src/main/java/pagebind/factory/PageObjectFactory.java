package pagebind.factory;

import org.openqa.selenium.SearchContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pagebind.decorator.DefaultElementActivator;
import pagebind.decorator.ElementActivator;
import pagebind.decorator.MemberDecorator;
import pagebind.decorator.PageObjectInitializer;
import pagebind.decorator.ProxyMemberDecorator;
import pagebind.decorator.UnsupportedMemberTypeException;
import pagebind.locator.DefaultElementLocator;
import pagebind.locator.ElementLocator;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Populates page objects from their registered {@link PageObjectBinding}s.
 *
 * <p>For each declared member the factory asks its {@link MemberDecorator} for
 * a value and writes it through the member's setter. Wrappers created by the
 * decorator come back through {@link #initElements(Object, ElementLocator)}
 * with a locator rooted at their element, so nested page objects are
 * populated the same way.
 *
 * <pre>{@code
 * PageObjectFactory factory = new PageObjectFactory(driver)
 *         .register(LoginPage.BINDING)
 *         .register(ErrorBanner.BINDING);
 * LoginPage page = new LoginPage();
 * factory.initElements(page);
 * }</pre>
 */
public class PageObjectFactory implements PageObjectInitializer {

    private static final Logger log = LoggerFactory.getLogger(PageObjectFactory.class);

    private final ElementLocator elementLocator;
    private final MemberDecorator memberDecorator;
    private final PageObjectConfig config;
    private final Map<Class<?>, PageObjectBinding<?>> bindings = new ConcurrentHashMap<>();

    /**
     * Creates a factory locating elements directly against {@code searchContext},
     * creating wrappers with a {@link DefaultElementActivator} and reading
     * settings from {@code pagebind.properties}.
     *
     * @param searchContext usually the {@code WebDriver}
     */
    public PageObjectFactory(SearchContext searchContext) {
        this(searchContext, new DefaultElementActivator());
    }

    public PageObjectFactory(SearchContext searchContext, ElementActivator activator) {
        this(new DefaultElementLocator(searchContext),
                factory -> new ProxyMemberDecorator(activator, factory),
                new PageObjectConfig());
    }

    /**
     * @param elementLocator  locator for top-level page objects
     * @param memberDecorator decorator producing member values
     * @param config          factory settings
     */
    public PageObjectFactory(ElementLocator elementLocator, MemberDecorator memberDecorator,
                             PageObjectConfig config) {
        this(elementLocator, factory -> memberDecorator, config);
    }

    private PageObjectFactory(ElementLocator elementLocator,
                              Function<PageObjectFactory, MemberDecorator> decoratorFactory,
                              PageObjectConfig config) {
        this.elementLocator  = Objects.requireNonNull(elementLocator, "elementLocator must not be null");
        this.config          = Objects.requireNonNull(config, "config must not be null");
        this.memberDecorator = Objects.requireNonNull(decoratorFactory.apply(this),
                "memberDecorator must not be null");
    }

    /**
     * Registers the members of one page-object type, replacing any earlier
     * binding for the same type.
     */
    public <P> PageObjectFactory register(PageObjectBinding<P> binding) {
        Objects.requireNonNull(binding, "binding must not be null");
        PageObjectBinding<?> previous = bindings.put(binding.getPageType(), binding);
        if (previous != null) {
            log.debug("Replaced binding for {}", binding.getPageType().getName());
        }
        return this;
    }

    /**
     * Populates the declared members of {@code page} against this factory's
     * root locator.
     *
     * @throws NullPointerException           if {@code page} is null
     * @throws UnsupportedMemberTypeException if a member type is unsupported
     *                                        and the policy is FAIL
     * @throws MemberNotWritableException     if a member setter refuses the value
     */
    public void initElements(Object page) {
        Objects.requireNonNull(page, "page must not be null");
        initElements(page, elementLocator);
    }

    @Override
    public void initElements(Object page, ElementLocator locator) {
        Objects.requireNonNull(page, "page must not be null");
        Objects.requireNonNull(locator, "locator must not be null");

        boolean bound = false;
        Class<?> type = page.getClass();
        while (type != null && type != Object.class) {
            PageObjectBinding<?> binding = bindings.get(type);
            if (binding != null) {
                apply(binding, page, locator);
                bound = true;
            }
            if (!config.isBindSuperclasses()) {
                break;
            }
            type = type.getSuperclass();
        }

        if (!bound) {
            log.debug("No binding registered for {}, nothing to decorate", page.getClass().getName());
        }
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private <P> void apply(PageObjectBinding<P> binding, Object page, ElementLocator locator) {
        P typed = binding.getPageType().cast(page);
        for (MemberBinding<P, ?> member : binding.getMembers()) {
            decorateMember(binding.getPageType(), member, typed, locator);
        }
    }

    private <P, T> void decorateMember(Class<P> pageType, MemberBinding<P, T> member, P page,
                                       ElementLocator locator) {
        T value;
        try {
            value = memberDecorator.decorate(member.getMemberType(), member.getCriteria(), locator);
        } catch (UnsupportedMemberTypeException e) {
            if (config.getUnsupportedMemberPolicy() == PageObjectConfig.UnsupportedMemberPolicy.SKIP) {
                log.warn("Skipping {}.{}: {}", pageType.getSimpleName(), member.getName(), e.getMessage());
                return;
            }
            throw e;
        }

        if (value == null) {
            log.debug("Decorator returned no value for {}.{}", pageType.getSimpleName(), member.getName());
            return;
        }

        try {
            member.assign(page, value);
        } catch (UnsupportedOperationException e) {
            throw new MemberNotWritableException(String.format(
                    "Unable to decorate %s.%s, it cannot be written to", pageType.getSimpleName(), member.getName()), e);
        }
    }
}
