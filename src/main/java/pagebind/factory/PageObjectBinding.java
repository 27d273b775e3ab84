package pagebind.factory;

import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.WrapsElement;
import pagebind.decorator.MemberType;
import pagebind.locator.LocatorCriteria;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * The statically declared members of one page-object type.
 *
 * <pre>{@code
 * PageObjectBinding<LoginPage> binding = PageObjectBinding.builder(LoginPage.class)
 *         .element("userName", (p, e) -> p.userName = e, By.id("user"), By.name("user"))
 *         .element("submit", (p, e) -> p.submit = e, By.cssSelector("button[type=submit]"))
 *         .wrappers("errors", ErrorBanner.class, (p, l) -> p.errors = l, By.className("error"))
 *         .build();
 * }</pre>
 *
 * @param <P> page-object type
 */
public final class PageObjectBinding<P> {

    private final Class<P> pageType;
    private final List<MemberBinding<P, ?>> members;

    private PageObjectBinding(Class<P> pageType, List<MemberBinding<P, ?>> members) {
        this.pageType = pageType;
        this.members  = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public static <P> Builder<P> builder(Class<P> pageType) {
        return new Builder<>(pageType);
    }

    public Class<P>                  getPageType() { return pageType; }
    public List<MemberBinding<P, ?>> getMembers()  { return members; }

    @Override
    public String toString() {
        return "PageObjectBinding{" + pageType.getSimpleName() + ", members=" + members + "}";
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder<P> {

        private final Class<P> pageType;
        private final List<MemberBinding<P, ?>> members = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder(Class<P> pageType) {
            this.pageType = Objects.requireNonNull(pageType, "pageType must not be null");
        }

        public Builder<P> element(String name, BiConsumer<? super P, ? super WebElement> setter, By... bys) {
            return member(name, MemberType.element(), setter, bys);
        }

        public Builder<P> elements(String name, BiConsumer<? super P, ? super List<WebElement>> setter,
                                   By... bys) {
            return member(name, MemberType.elementList(), setter, bys);
        }

        public <W extends WrapsElement> Builder<P> wrapper(String name, Class<W> type,
                                                           BiConsumer<? super P, ? super W> setter, By... bys) {
            return member(name, MemberType.of(type), setter, bys);
        }

        public <W extends WrapsElement> Builder<P> wrappers(String name, Class<W> type,
                                                            BiConsumer<? super P, ? super List<W>> setter,
                                                            By... bys) {
            return member(name, MemberType.listOf(type), setter, bys);
        }

        /**
         * Declares a member of any type. Types outside the supported shapes are
         * accepted here and rejected when the member is decorated.
         *
         * @throws IllegalArgumentException if {@code name} is already declared
         *                                  or no criteria are given
         */
        public <T> Builder<P> member(String name, MemberType<T> type, BiConsumer<? super P, ? super T> setter,
                                     By... bys) {
            if (!names.add(Objects.requireNonNull(name, "name must not be null"))) {
                throw new IllegalArgumentException(
                        "Member '" + name + "' is already declared on " + pageType.getSimpleName());
            }
            members.add(new MemberBinding<P, T>(name, type, LocatorCriteria.of(bys), setter));
            return this;
        }

        public PageObjectBinding<P> build() {
            return new PageObjectBinding<>(pageType, members);
        }
    }
}
