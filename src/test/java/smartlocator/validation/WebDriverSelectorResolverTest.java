package smartlocator.validation;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import smartlocator.model.LocatorType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link WebDriverSelectorResolver} against a mocked driver.
 */
public class WebDriverSelectorResolverTest {

    @Mock private WebDriver driver;

    private AutoCloseable mocks;
    private WebDriverSelectorResolver resolver;

    @BeforeMethod
    public void setUp() {
        mocks    = MockitoAnnotations.openMocks(this);
        resolver = new WebDriverSelectorResolver(driver);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static WebElement element(String role, String name) {
        WebElement el = mock(WebElement.class);
        when(el.getAriaRole()).thenReturn(role);
        when(el.getAccessibleName()).thenReturn(name);
        return el;
    }

    // ── CSS / XPath ───────────────────────────────────────────────────────

    @Test
    public void css_countsFindElements() {
        WebElement el = mock(WebElement.class);
        when(driver.findElements(By.cssSelector("#email"))).thenReturn(List.of(el));

        ResolveResult r = resolver.resolve(LocatorType.CSS, "#email");

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.matchCount()).isEqualTo(1);
    }

    @Test
    public void xpath_countsFindElements() {
        when(driver.findElements(By.xpath("/html[1]/body[1]/div[1]")))
                .thenReturn(List.of(mock(WebElement.class), mock(WebElement.class)));

        assertThat(resolver.resolve(LocatorType.XPATH, "/html[1]/body[1]/div[1]").matchCount()).isEqualTo(2);
    }

    @Test
    public void noMatch_isSuccessWithZero() {
        when(driver.findElements(any(By.class))).thenReturn(List.of());

        ResolveResult r = resolver.resolve(LocatorType.CSS, ".missing");

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.matchCount()).isZero();
    }

    @Test
    public void driverError_reportsFirstLineOnly() {
        when(driver.findElements(any(By.class)))
                .thenThrow(new InvalidSelectorException("invalid selector: An invalid or illegal selector was specified"));

        ResolveResult r = resolver.resolve(LocatorType.CSS, "div[");

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.error()).startsWith("invalid selector").doesNotContain("\n");
    }

    // ── Role selectors ────────────────────────────────────────────────────

    @Test
    public void role_matchesAriaRoleAndAccessibleName() {
        WebElement save = element("button", "Save");
        WebElement cancel = element("button", "Cancel");
        WebElement spacedSave = element("BUTTON", "  Save \n");
        when(driver.findElements(By.cssSelector(WebDriverSelectorResolver.prefilter("button"))))
                .thenReturn(List.of(save, cancel, spacedSave));

        ResolveResult r = resolver.resolve(LocatorType.ROLE, "role=button[name=\"Save\"s]");

        assertThat(r.matchCount()).isEqualTo(2);
        verify(driver).findElements(By.cssSelector(WebDriverSelectorResolver.prefilter("button")));
    }

    @Test
    public void role_malformedSelector_isResolverError() {
        ResolveResult r = resolver.resolve(LocatorType.ROLE, "button Save");

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.error()).contains("Not a role selector");
        verifyNoInteractions(driver);
    }

    @Test
    public void prefilter_coversExplicitAndImplicitRoles() {
        assertThat(WebDriverSelectorResolver.prefilter("link"))
                .isEqualTo("[role=\"link\"], a[href], area[href]");
        assertThat(WebDriverSelectorResolver.prefilter("tab")).isEqualTo("[role=\"tab\"]");
    }
}
