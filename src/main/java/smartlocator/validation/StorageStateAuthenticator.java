package smartlocator.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;

/**
 * Restores a logged-in session from a Playwright storage-state file
 * ({@code {"cookies": [...], "origins": [{"origin", "localStorage": [...]}]}}).
 *
 * <p>Selenium only accepts cookies for the domain of the current page, so
 * the driver first opens {@code targetUrl}, then receives the matching
 * cookies and local-storage entries. The page is reloaded by the caller.
 */
public class StorageStateAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(StorageStateAuthenticator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebDriver driver;
    private final Path      stateFile;
    private final String    targetUrl;

    public StorageStateAuthenticator(WebDriver driver, Path stateFile, String targetUrl) {
        this.driver    = Objects.requireNonNull(driver, "driver");
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile");
        this.targetUrl = Objects.requireNonNull(targetUrl, "targetUrl");
    }

    @Override
    public void authenticate() {
        JsonNode state = readState();
        String host = URI.create(targetUrl).getHost();
        if (host == null) {
            throw new AuthenticationException("Target URL has no host: " + targetUrl);
        }

        try {
            driver.get(targetUrl);
            int cookies = 0;
            for (JsonNode c : state.path("cookies")) {
                String domain = c.path("domain").asText("");
                if (!domainMatches(domain, host)) continue;
                driver.manage().addCookie(toCookie(c));
                cookies++;
            }

            int entries = 0;
            String origin = origin(targetUrl);
            for (JsonNode o : state.path("origins")) {
                if (!origin.equalsIgnoreCase(o.path("origin").asText(""))) continue;
                for (JsonNode item : o.path("localStorage")) {
                    ((JavascriptExecutor) driver).executeScript(
                            "window.localStorage.setItem(arguments[0], arguments[1]);",
                            item.path("name").asText(), item.path("value").asText());
                    entries++;
                }
            }
            log.info("Restored {} cookies and {} local-storage entries for {}", cookies, entries, host);
        } catch (WebDriverException | ClassCastException e) {
            throw new AuthenticationException("Cannot apply storage state " + stateFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "storage state " + stateFile.getFileName();
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private JsonNode readState() {
        if (!Files.isRegularFile(stateFile)) {
            throw new AuthenticationException("Storage state file not found: " + stateFile.toAbsolutePath());
        }
        try {
            JsonNode root = MAPPER.readTree(stateFile.toFile());
            if (root == null || !root.isObject()) {
                throw new AuthenticationException("Storage state is not a JSON object: " + stateFile);
            }
            return root;
        } catch (IOException e) {
            throw new AuthenticationException("Cannot read storage state " + stateFile + ": " + e.getMessage(), e);
        }
    }

    static Cookie toCookie(JsonNode c) {
        Cookie.Builder b = new Cookie.Builder(c.path("name").asText(), c.path("value").asText())
                .path(c.path("path").asText("/"))
                .isHttpOnly(c.path("httpOnly").asBoolean(false))
                .isSecure(c.path("secure").asBoolean(false));
        String domain = c.path("domain").asText("");
        if (!domain.isEmpty()) b.domain(domain);
        double expires = c.path("expires").asDouble(-1);
        if (expires > 0) b.expiresOn(new Date((long) (expires * 1000)));
        String sameSite = c.path("sameSite").asText("");
        if (!sameSite.isEmpty()) b.sameSite(sameSite);
        return b.build();
    }

    /** Cookie domain {@code .example.com} or {@code example.com} covers {@code app.example.com}. */
    static boolean domainMatches(String cookieDomain, String host) {
        if (cookieDomain == null || cookieDomain.isBlank()) return false;
        String d = cookieDomain.toLowerCase(Locale.ROOT);
        if (d.startsWith(".")) d = d.substring(1);
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals(d) || h.endsWith("." + d);
    }

    static String origin(String url) {
        URI uri = URI.create(url);
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
    }
}
