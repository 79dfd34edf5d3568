package smartlocator.validation;

import org.mockito.InOrder;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link AuthOptions} and the {@link TargetPageAuthenticator}
 * it wraps every login in.
 */
public class AuthOptionsTest {

    private static final String TARGET = "https://app.example.com/orders";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static AuthOptions formLogin() {
        return new AuthOptions()
                .setAuthUrl("https://app.example.com/login")
                .setUser("qa@example.com")
                .setPassword("secret")
                .setUserSelector("#user")
                .setPassSelector("#pass")
                .setSubmitSelector("button[type=submit]");
    }

    // ── Authenticator selection ───────────────────────────────────────────

    @Test(description = "No options at all means no login")
    public void testNothingConfigured() {
        AuthOptions opts = new AuthOptions();

        assertThat(opts.isConfigured()).isFalse();
        assertThat(opts.toAuthenticator(mock(WebDriver.class), TARGET, TIMEOUT).describe()).isEqualTo("none");
    }

    @Test(description = "A complete set of form fields selects form login")
    public void testFormLogin() {
        Authenticator auth = formLogin().toAuthenticator(mock(WebDriver.class), TARGET, TIMEOUT);

        assertThat(auth).isInstanceOf(TargetPageAuthenticator.class);
        assertThat(auth.describe()).isEqualTo("form login at https://app.example.com/login");
    }

    @Test(description = "A missing password leaves the form incomplete and falls back to no login")
    public void testIncompleteFormLogin() {
        AuthOptions opts = formLogin().setPassword(null);

        assertThat(opts.isConfigured()).isTrue();
        assertThat(opts.isFormLoginComplete()).isFalse();
        assertThat(opts.toAuthenticator(mock(WebDriver.class), TARGET, TIMEOUT).describe()).isEqualTo("none");
    }

    @Test(description = "An existing storage-state file wins over form fields")
    public void testStorageStateWins() throws IOException {
        Path state = Files.createTempFile("auth-state-", ".json");
        try {
            Authenticator auth = formLogin().setStorageState(state)
                    .toAuthenticator(mock(WebDriver.class), TARGET, TIMEOUT);

            assertThat(auth.describe()).isEqualTo("storage state " + state.getFileName());
        } finally {
            Files.deleteIfExists(state);
        }
    }

    @Test(description = "A storage-state path that does not exist falls back to form login")
    public void testMissingStorageStateFallsBack() {
        AuthOptions opts = formLogin().setStorageState(Path.of("does-not-exist-auth.json"));

        assertThat(opts.hasStorageState()).isFalse();
        assertThat(opts.toAuthenticator(mock(WebDriver.class), TARGET, TIMEOUT).describe())
                .startsWith("form login");
    }

    @Test(description = "Blank selectors count as unset")
    public void testBlankValuesAreUnset() {
        AuthOptions opts = formLogin().setUserSelector("   ").setWaitSelector("");

        assertThat(opts.getUserSelector()).isNull();
        assertThat(opts.getWaitSelector()).isNull();
        assertThat(opts.isFormLoginComplete()).isFalse();
    }

    @Test(description = "toString never prints credentials")
    public void testToStringMasksCredentials() {
        String text = formLogin().toString();

        assertThat(text).doesNotContain("qa@example.com").doesNotContain("secret").contains("***");
    }

    // ── TargetPageAuthenticator ───────────────────────────────────────────

    @Test(description = "The target page is opened after the wrapped login")
    public void testTargetPageOpenedAfterLogin() {
        WebDriver driver = mock(WebDriver.class);
        Authenticator login = mock(Authenticator.class);

        new TargetPageAuthenticator(login, driver, TARGET).authenticate();

        InOrder order = inOrder(login, driver);
        order.verify(login).authenticate();
        order.verify(driver).get(TARGET);
    }

    @Test(description = "A failed login never navigates")
    public void testFailedLoginDoesNotNavigate() {
        WebDriver driver = mock(WebDriver.class);
        Authenticator login = mock(Authenticator.class);
        doThrow(new AuthenticationException("denied")).when(login).authenticate();

        assertThatThrownBy(() -> new TargetPageAuthenticator(login, driver, TARGET).authenticate())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("denied");
        verify(driver, never()).get(anyString());
    }

    @Test(description = "A navigation error becomes an authentication failure")
    public void testNavigationFailure() {
        WebDriver driver = mock(WebDriver.class);
        doThrow(new WebDriverException("net::ERR_CONNECTION_REFUSED")).when(driver).get(TARGET);

        assertThatThrownBy(() -> new TargetPageAuthenticator(NoAuthentication.INSTANCE, driver, TARGET).authenticate())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Cannot open " + TARGET);
    }
}
