package smartlocator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mockito.ArgumentCaptor;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

public class StorageStateAuthenticatorTest {

    private static final String STATE = "{"
            + "\"cookies\": ["
            + "  {\"name\": \"sid\", \"value\": \"abc\", \"domain\": \".example.com\", \"path\": \"/\","
            + "   \"expires\": 1893456000, \"httpOnly\": true, \"secure\": true, \"sameSite\": \"Lax\"},"
            + "  {\"name\": \"other\", \"value\": \"x\", \"domain\": \"tracker.net\"}"
            + "],"
            + "\"origins\": ["
            + "  {\"origin\": \"https://app.example.com\", \"localStorage\": [{\"name\": \"token\", \"value\": \"t1\"}]},"
            + "  {\"origin\": \"https://elsewhere.org\", \"localStorage\": [{\"name\": \"nope\", \"value\": \"n\"}]}"
            + "]}";

    private Path tempDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("storage-state-test-");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> walk = Files.walk(tempDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    // ── Helpers under test ────────────────────────────────────────────────

    @Test
    public void domainMatches_coversSubdomains() {
        assertThat(StorageStateAuthenticator.domainMatches(".example.com", "app.example.com")).isTrue();
        assertThat(StorageStateAuthenticator.domainMatches("example.com", "example.com")).isTrue();
        assertThat(StorageStateAuthenticator.domainMatches("EXAMPLE.com", "App.Example.COM")).isTrue();
        assertThat(StorageStateAuthenticator.domainMatches("example.com", "badexample.com")).isFalse();
        assertThat(StorageStateAuthenticator.domainMatches("", "example.com")).isFalse();
    }

    @Test
    public void origin_keepsExplicitPortOnly() {
        assertThat(StorageStateAuthenticator.origin("https://app.example.com/login?x=1"))
                .isEqualTo("https://app.example.com");
        assertThat(StorageStateAuthenticator.origin("http://localhost:8080/page"))
                .isEqualTo("http://localhost:8080");
    }

    @Test
    public void toCookie_mapsPlaywrightFields() throws IOException {
        Cookie c = StorageStateAuthenticator.toCookie(new ObjectMapper().readTree(STATE).path("cookies").get(0));

        assertThat(c.getName()).isEqualTo("sid");
        assertThat(c.getValue()).isEqualTo("abc");
        assertThat(c.getDomain()).isEqualTo(".example.com");
        assertThat(c.isHttpOnly()).isTrue();
        assertThat(c.isSecure()).isTrue();
        assertThat(c.getSameSite()).isEqualTo("Lax");
        assertThat(c.getExpiry()).isNotNull();
    }

    @Test
    public void toCookie_sessionCookieHasNoExpiry() throws IOException {
        Cookie c = StorageStateAuthenticator.toCookie(new ObjectMapper().readTree(STATE).path("cookies").get(1));

        assertThat(c.getExpiry()).isNull();
        assertThat(c.getPath()).isEqualTo("/");
    }

    // ── authenticate ──────────────────────────────────────────────────────

    @Test
    public void authenticate_appliesMatchingCookiesAndStorage() throws IOException {
        Path state = tempDir.resolve("state.json");
        Files.writeString(state, STATE, StandardCharsets.UTF_8);
        WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        WebDriver.Options manage = mock(WebDriver.Options.class);
        when(driver.manage()).thenReturn(manage);

        new StorageStateAuthenticator(driver, state, "https://app.example.com/dashboard").authenticate();

        verify(driver).get("https://app.example.com/dashboard");
        ArgumentCaptor<Cookie> cookies = ArgumentCaptor.forClass(Cookie.class);
        verify(manage, times(1)).addCookie(cookies.capture());
        assertThat(cookies.getValue().getName()).isEqualTo("sid");
        verify((JavascriptExecutor) driver).executeScript(anyString(), eq("token"),
                eq("t1"));
        verify((JavascriptExecutor) driver, never()).executeScript(anyString(),
                eq("nope"), eq("n"));
    }

    @Test
    public void authenticate_missingFile_fails() {
        WebDriver driver = mock(WebDriver.class);
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> new StorageStateAuthenticator(driver, missing, "https://example.com").authenticate())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Storage state file not found");
        verify(driver, never()).get(anyString());
    }

    @Test
    public void authenticate_nonObjectJson_fails() throws IOException {
        Path state = tempDir.resolve("array.json");
        Files.writeString(state, "[1, 2]", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new StorageStateAuthenticator(mock(WebDriver.class), state, "https://example.com")
                .authenticate())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    public void describe_namesFileWithoutPath() {
        StorageStateAuthenticator auth = new StorageStateAuthenticator(
                mock(WebDriver.class), tempDir.resolve("auth.json"), "https://example.com");

        assertThat(auth.describe()).isEqualTo("storage state auth.json");
    }
}
