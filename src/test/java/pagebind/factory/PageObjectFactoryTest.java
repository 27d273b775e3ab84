package pagebind.factory;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pagebind.decorator.DefaultElementActivator;
import pagebind.decorator.MemberDecorator;
import pagebind.decorator.MemberType;
import pagebind.decorator.ProxyMemberDecorator;
import pagebind.decorator.UnsupportedMemberTypeException;
import pagebind.decorator.WritableWrapsElement;
import pagebind.locator.DefaultElementLocator;
import pagebind.locator.ElementLocator;
import pagebind.locator.LocatorCriteria;
import pagebind.proxy.ElementProxy;

import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PageObjectFactory}.
 *
 * <p>Member-assignment tests mock the {@link MemberDecorator}; the nested
 * page-object tests run the real decorator against a mocked
 * {@link SearchContext} so the whole chain from factory to locator is
 * exercised without a browser.
 */
public class PageObjectFactoryTest {

    // ── Page objects under test ───────────────────────────────────────────

    static class LoginPage {
        WebElement userName;
        WebElement submit;
        List<WebElement> errors;
        String notAnElement;
    }

    static class BasePage {
        WebElement header;
    }

    static class HomePage extends BasePage {
        WebElement logo;
    }

    public static class ResultCard implements WritableWrapsElement {
        private WebElement root;
        WebElement title;

        @Override
        public WebElement getWrappedElement() {
            return root;
        }

        @Override
        public void setWrappedElement(WebElement element) {
            this.root = element;
        }
    }

    static class SearchPage {
        ResultCard featured;
        List<ResultCard> results;
    }

    private static final PageObjectBinding<LoginPage> LOGIN = PageObjectBinding.builder(LoginPage.class)
            .element("userName", (p, e) -> p.userName = e, By.id("user"), By.name("user"))
            .element("submit", (p, e) -> p.submit = e, By.cssSelector("button[type=submit]"))
            .elements("errors", (p, l) -> p.errors = l, By.className("error"))
            .build();

    private static final PageObjectBinding<BasePage> BASE = PageObjectBinding.builder(BasePage.class)
            .element("header", (p, e) -> p.header = e, By.tagName("header"))
            .build();

    private static final PageObjectBinding<HomePage> HOME = PageObjectBinding.builder(HomePage.class)
            .element("logo", (p, e) -> p.logo = e, By.id("logo"))
            .build();

    private static final PageObjectBinding<ResultCard> CARD = PageObjectBinding.builder(ResultCard.class)
            .element("title", (c, e) -> c.title = e, By.className("title"))
            .build();

    private static final PageObjectBinding<SearchPage> SEARCH = PageObjectBinding.builder(SearchPage.class)
            .wrapper("featured", ResultCard.class, (p, c) -> p.featured = c, By.id("featured"))
            .wrappers("results", ResultCard.class, (p, l) -> p.results = l, By.className("result"))
            .build();

    @Mock
    private ElementLocator locator;

    @Mock
    private MemberDecorator decorator;

    @Mock
    private WebElement element;

    @Mock
    private SearchContext driver;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static PageObjectConfig config(String policy, boolean bindSuperclasses) {
        Properties p = new Properties();
        p.setProperty("pagebind.unsupported.member.policy", policy);
        p.setProperty("pagebind.bind.superclasses", String.valueOf(bindSuperclasses));
        return new PageObjectConfig(p);
    }

    private PageObjectFactory mockedFactory(PageObjectConfig config) {
        return new PageObjectFactory(locator, decorator, config);
    }

    private PageObjectFactory realFactory(PageObjectConfig config) {
        return new PageObjectFactory(new DefaultElementLocator(driver),
                new ProxyMemberDecorator(new DefaultElementActivator(), (page, scoped) -> { }), config);
    }

    // ── Member assignment ─────────────────────────────────────────────────

    @Test(description = "Every declared member receives the decorated value")
    public void testDecoratesMembers() {
        List<WebElement> errors = List.of(element);
        when(decorator.decorate(eq(MemberType.element()), any(), eq(locator))).thenReturn(element);
        when(decorator.decorate(eq(MemberType.elementList()), any(), eq(locator))).thenReturn(errors);

        PageObjectFactory factory = mockedFactory(config("FAIL", true)).register(LOGIN);
        LoginPage page = new LoginPage();
        factory.initElements(page);

        assertThat(page.userName).isSameAs(element);
        assertThat(page.submit).isSameAs(element);
        assertThat(page.errors).isSameAs(errors);
        verify(decorator).decorate(MemberType.element(),
                LocatorCriteria.of(By.id("user"), By.name("user")), locator);
        verify(decorator, times(3)).decorate(any(), any(), any());
    }

    @Test(description = "Pages without a registered binding are left untouched")
    public void testUnboundPageUntouched() {
        PageObjectFactory factory = mockedFactory(config("FAIL", true));

        LoginPage page = new LoginPage();
        factory.initElements(page);

        assertThat(page.userName).isNull();
        verifyNoInteractions(decorator, locator);
    }

    @Test(description = "A null page is rejected")
    public void testNullPage() {
        assertThatThrownBy(() -> mockedFactory(config("FAIL", true)).initElements(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test(description = "Constructor rejects null collaborators")
    public void testNullCollaborators() {
        assertThatThrownBy(() -> new PageObjectFactory(null, decorator, config("FAIL", true)))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new PageObjectFactory(locator, null, config("FAIL", true)))
                .isInstanceOf(NullPointerException.class);
    }

    @Test(description = "A null decorated value leaves the member unset")
    public void testNullValueSkipped() {
        PageObjectFactory factory = mockedFactory(config("FAIL", true)).register(LOGIN);

        LoginPage page = new LoginPage();
        factory.initElements(page);

        assertThat(page.userName).isNull();
        assertThat(page.errors).isNull();
    }

    // ── Superclass bindings ───────────────────────────────────────────────

    @Test(description = "Bindings of superclasses also apply")
    public void testSuperclassBindings() {
        when(decorator.decorate(eq(MemberType.element()), any(), any())).thenReturn(element);
        PageObjectFactory factory = mockedFactory(config("FAIL", true)).register(BASE).register(HOME);

        HomePage page = new HomePage();
        factory.initElements(page);

        assertThat(page.logo).isSameAs(element);
        assertThat(page.header).isSameAs(element);
    }

    @Test(description = "Superclass bindings are ignored when disabled")
    public void testSuperclassBindingsDisabled() {
        when(decorator.decorate(eq(MemberType.element()), any(), any())).thenReturn(element);
        PageObjectFactory factory = mockedFactory(config("FAIL", false)).register(BASE).register(HOME);

        HomePage page = new HomePage();
        factory.initElements(page);

        assertThat(page.logo).isSameAs(element);
        assertThat(page.header).isNull();
    }

    // ── Failure policy ────────────────────────────────────────────────────

    private static PageObjectBinding<LoginPage> loginWithStringMember() {
        return PageObjectBinding.builder(LoginPage.class)
                .element("userName", (p, e) -> p.userName = e, By.id("user"))
                .member("notAnElement", MemberType.of(String.class), (p, s) -> p.notAnElement = s, By.id("s"))
                .element("submit", (p, e) -> p.submit = e, By.id("go"))
                .build();
    }

    @Test(description = "Unsupported member types fail decoration under the FAIL policy")
    public void testUnsupportedFails() {
        PageObjectFactory factory = realFactory(config("FAIL", true)).register(loginWithStringMember());

        assertThatThrownBy(() -> factory.initElements(new LoginPage()))
                .isInstanceOf(UnsupportedMemberTypeException.class)
                .hasMessageContaining("String");
    }

    @Test(description = "Unsupported member types are skipped under the SKIP policy")
    public void testUnsupportedSkipped() {
        PageObjectFactory factory = realFactory(config("SKIP", true)).register(loginWithStringMember());

        LoginPage page = new LoginPage();
        factory.initElements(page);

        assertThat(page.userName).isInstanceOf(ElementProxy.class);
        assertThat(page.submit).isInstanceOf(ElementProxy.class);
        assertThat(page.notAnElement).isNull();
        verifyNoInteractions(driver);
    }

    @Test(description = "A setter refusing the value raises MemberNotWritableException")
    public void testMemberNotWritable() {
        when(decorator.decorate(eq(MemberType.element()), any(), any())).thenReturn(element);
        PageObjectBinding<LoginPage> frozen = PageObjectBinding.builder(LoginPage.class)
                .element("userName", (p, e) -> {
                    throw new UnsupportedOperationException("frozen");
                }, By.id("user"))
                .build();
        PageObjectFactory factory = mockedFactory(config("FAIL", true)).register(frozen);

        assertThatThrownBy(() -> factory.initElements(new LoginPage()))
                .isInstanceOf(MemberNotWritableException.class)
                .hasMessageContaining("LoginPage.userName")
                .hasCauseInstanceOf(UnsupportedOperationException.class);
    }

    // ── Nested page objects, end to end ───────────────────────────────────

    @Test(description = "Wrapper members are populated against a locator rooted at their element")
    public void testNestedWrapper() {
        WebElement featured = mock(WebElement.class);
        WebElement title = mock(WebElement.class);
        when(driver.findElement(By.id("featured"))).thenReturn(featured);
        when(featured.findElement(By.className("title"))).thenReturn(title);
        when(title.getText()).thenReturn("Top story");

        PageObjectFactory factory = new PageObjectFactory(driver).register(SEARCH).register(CARD);
        SearchPage page = new SearchPage();
        factory.initElements(page);

        verifyNoInteractions(driver);
        assertThat(page.featured.getWrappedElement()).isInstanceOf(ElementProxy.class);
        assertThat(page.featured.title).isInstanceOf(ElementProxy.class);

        assertThat(page.featured.title.getText()).isEqualTo("Top story");
        verify(driver, times(1)).findElement(By.id("featured"));
        verify(featured, times(1)).findElement(By.className("title"));
    }

    @Test(description = "A stale wrapper root is re-located when a nested member is located under it")
    public void testNestedWrapperRootGoesStale() {
        WebElement staleRoot = mock(WebElement.class);
        WebElement freshRoot = mock(WebElement.class);
        WebElement title = mock(WebElement.class);
        when(driver.findElement(By.id("featured"))).thenReturn(staleRoot, freshRoot);
        when(staleRoot.findElement(any())).thenThrow(new StaleElementReferenceException("stale"));
        when(freshRoot.findElement(By.className("title"))).thenReturn(title);
        when(title.getText()).thenReturn("Recovered");

        PageObjectFactory factory = new PageObjectFactory(driver).register(SEARCH).register(CARD);
        SearchPage page = new SearchPage();
        factory.initElements(page);

        assertThat(page.featured.title.getText()).isEqualTo("Recovered");
        verify(driver, times(2)).findElement(By.id("featured"));
    }

    @Test(description = "Wrapper lists populate one nested page object per located element")
    public void testNestedWrapperList() {
        WebElement r1 = mock(WebElement.class);
        WebElement r2 = mock(WebElement.class);
        WebElement t1 = mock(WebElement.class);
        WebElement t2 = mock(WebElement.class);
        when(driver.findElements(By.className("result"))).thenReturn(List.of(r1, r2));
        when(r1.findElement(By.className("title"))).thenReturn(t1);
        when(r2.findElement(By.className("title"))).thenReturn(t2);
        when(t1.getText()).thenReturn("First");
        when(t2.getText()).thenReturn("Second");

        PageObjectFactory factory = new PageObjectFactory(driver).register(SEARCH).register(CARD);
        SearchPage page = new SearchPage();
        factory.initElements(page);

        List<String> titles = page.results.stream()
                .map(card -> card.title.getText())
                .collect(Collectors.toList());

        assertThat(titles).containsExactly("First", "Second");
        verify(driver, times(1)).findElements(By.className("result"));
    }
}
