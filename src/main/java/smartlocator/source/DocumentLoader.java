package smartlocator.source;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.engine.SmartLocatorException;
import smartlocator.engine.Stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Turns the user's input into markup: a URL (plain HTTP fetch, or rendered
 * in a headless browser when JavaScript is needed), a local HTML file, or
 * raw markup passed inline.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final String USER_AGENT = "smart-locator/1.0";

    private final OkHttpClient        http;
    private final Supplier<WebDriver> browser;

    /**
     * @param httpTimeout call timeout for plain URL fetches
     * @param browser     creates a browser session for JavaScript rendering; only called when needed
     */
    public DocumentLoader(Duration httpTimeout, Supplier<WebDriver> browser) {
        this(new OkHttpClient.Builder()
                .callTimeout(httpTimeout)
                .followRedirects(true)
                .build(), browser);
    }

    DocumentLoader(OkHttpClient http, Supplier<WebDriver> browser) {
        this.http    = Objects.requireNonNull(http, "http");
        this.browser = browser;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * @param input    URL, file path or raw markup
     * @param renderJs render URL and file inputs in a browser before reading the DOM
     * @throws SmartLocatorException (stage {@code load}) when nothing could be read
     */
    public LoadedDocument load(String input, boolean renderJs) {
        if (input == null || input.isBlank()) {
            throw new SmartLocatorException(Stage.LOAD, "No input given");
        }
        String trimmed = input.trim();

        if (isUrl(trimmed)) {
            String markup = renderJs ? render(trimmed) : fetch(trimmed);
            return new LoadedDocument(markup, trimmed, LoadedDocument.Kind.URL, trimmed);
        }
        if (looksLikeMarkup(trimmed)) {
            if (renderJs) {
                log.warn("JavaScript rendering is not available for inline markup, parsing it as is");
            }
            return new LoadedDocument(input, SmartLocatorException.preview(trimmed), LoadedDocument.Kind.RAW, null);
        }

        Path file = toPath(trimmed);
        String fileUrl = file.toAbsolutePath().toUri().toString();
        String markup = renderJs ? render(fileUrl) : read(file);
        return new LoadedDocument(markup, file.toString(), LoadedDocument.Kind.FILE, fileUrl);
    }

    // ── Classification ────────────────────────────────────────────────────

    static boolean isUrl(String input) {
        String lower = input.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    static boolean looksLikeMarkup(String input) {
        return input.startsWith("<") || (input.contains("<") && input.contains(">"));
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private Path toPath(String input) {
        Path file;
        try {
            file = Path.of(input);
        } catch (InvalidPathException e) {
            throw new SmartLocatorException(Stage.LOAD, "Input is neither a URL, a file nor markup: '"
                    + SmartLocatorException.preview(input) + "'", e);
        }
        if (!Files.isRegularFile(file)) {
            throw new SmartLocatorException(Stage.LOAD, "Input file not found: " + file.toAbsolutePath());
        }
        return file;
    }

    private String read(Path file) {
        try {
            String markup = Files.readString(file, StandardCharsets.UTF_8);
            log.info("Read {} characters from {}", markup.length(), file);
            return markup;
        } catch (IOException e) {
            throw new SmartLocatorException(Stage.LOAD, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private String fetch(String url) {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml")
                .get()
                .build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SmartLocatorException(Stage.LOAD, "GET " + url + " returned HTTP " + response.code());
            }
            String body = response.body() != null ? response.body().string() : "";
            log.info("Fetched {} characters from {}", body.length(), url);
            return body;
        } catch (IOException e) {
            throw new SmartLocatorException(Stage.LOAD, "Cannot fetch " + url + ": " + e.getMessage(), e);
        }
    }

    private String render(String url) {
        if (browser == null) {
            throw new SmartLocatorException(Stage.LOAD, "JavaScript rendering requested but no browser is configured");
        }
        WebDriver driver = null;
        try {
            driver = browser.get();
            driver.get(url);
            String source = driver.getPageSource();
            log.info("Rendered {} ({} characters)", url, source == null ? 0 : source.length());
            return source == null ? "" : source;
        } catch (WebDriverException e) {
            throw new SmartLocatorException(Stage.LOAD, "Cannot render " + url + ": "
                    + e.getClass().getSimpleName(), e);
        } finally {
            if (driver != null) {
                try {
                    driver.quit();
                } catch (WebDriverException e) {
                    log.warn("Failed to close browser after rendering: {}", e.getMessage());
                }
            }
        }
    }
}
