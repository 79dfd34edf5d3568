package smartlocator.source;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Creates headless WebDriver sessions for browser-rendered sources and
 * live validation.
 *
 * <p>Selenium Manager (Selenium 4.11+) downloads the matching driver binary,
 * so nothing has to be installed besides the browser itself.
 */
public class BrowserFactory implements Supplier<WebDriver> {

    private static final Logger log = LoggerFactory.getLogger(BrowserFactory.class);

    private final String   browser;
    private final Duration pageLoadTimeout;

    /**
     * @param browser         {@code chrome}, {@code edge} or {@code firefox}
     * @param pageLoadTimeout page-load timeout applied to every new session
     */
    public BrowserFactory(String browser, Duration pageLoadTimeout) {
        this.browser         = browser == null ? "chrome" : browser.toLowerCase(Locale.ROOT).trim();
        this.pageLoadTimeout = pageLoadTimeout;
        if (!this.browser.equals("chrome") && !this.browser.equals("edge") && !this.browser.equals("firefox")) {
            throw new IllegalArgumentException("Unsupported browser: '" + browser + "' (expected chrome, edge or firefox)");
        }
    }

    /** Starts a new headless session. The caller owns it and must {@code quit()} it. */
    @Override
    public WebDriver get() {
        log.info("Starting headless {} (page-load timeout {}s)", browser, pageLoadTimeout.toSeconds());
        WebDriver driver = switch (browser) {
            case "firefox" -> {
                FirefoxOptions opts = new FirefoxOptions();
                opts.addArguments("-headless");
                yield new FirefoxDriver(opts);
            }
            case "edge" -> {
                EdgeOptions opts = new EdgeOptions();
                opts.addArguments("--headless=new", "--window-size=1366,900");
                yield new EdgeDriver(opts);
            }
            default -> {
                ChromeOptions opts = new ChromeOptions();
                opts.addArguments("--headless=new", "--window-size=1366,900");
                yield new ChromeDriver(opts);
            }
        };
        driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        return driver;
    }

    public String getBrowser() { return browser; }
}
