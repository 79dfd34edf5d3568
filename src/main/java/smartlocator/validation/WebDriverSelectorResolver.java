package smartlocator.validation;

import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.dom.AriaRoles;
import smartlocator.dom.CssEscaper;
import smartlocator.model.LocatorType;
import smartlocator.model.RoleQuery;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link SelectorResolver} backed by a live Selenium session.
 *
 * <p>CSS and XPath selectors go straight to {@code findElements}. Selenium has
 * no role engine, so a role selector is answered in two steps: a CSS prefilter
 * for elements that can carry the role (explicit {@code role} attribute or the
 * tags with that implicit role), then the browser's own
 * {@link WebElement#getAriaRole()} and {@link WebElement#getAccessibleName()}
 * on each survivor.
 *
 * <p>A WebDriver session is not safe for concurrent commands: the resolver
 * serves one call at a time and callers waiting for it can be interrupted.
 */
public class WebDriverSelectorResolver implements SelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(WebDriverSelectorResolver.class);

    /** Tags whose implicit role is the key. */
    private static final Map<String, String> IMPLICIT_ROLE_TAGS = Map.ofEntries(
            Map.entry("button",      "button, input[type=button], input[type=submit], input[type=reset], input[type=image]"),
            Map.entry("link",        "a[href], area[href]"),
            Map.entry("textbox",     "input:not([type]), input[type=text], input[type=email], input[type=tel], input[type=url], textarea"),
            Map.entry("searchbox",   "input[type=search]"),
            Map.entry("checkbox",    "input[type=checkbox]"),
            Map.entry("radio",       "input[type=radio]"),
            Map.entry("slider",      "input[type=range]"),
            Map.entry("spinbutton",  "input[type=number]"),
            Map.entry("combobox",    "select, input[list]"),
            Map.entry("listbox",     "select[multiple], select[size]"),
            Map.entry("heading",     "h1, h2, h3, h4, h5, h6"),
            Map.entry("img",         "img"),
            Map.entry("navigation",  "nav"),
            Map.entry("main",        "main"),
            Map.entry("complementary", "aside"),
            Map.entry("dialog",      "dialog"),
            Map.entry("list",        "ul, ol"),
            Map.entry("listitem",    "li"),
            Map.entry("table",       "table"),
            Map.entry("option",      "option"),
            Map.entry("progressbar", "progress"),
            Map.entry("group",       "details, fieldset"));

    private final WebDriver     driver;
    private final ReentrantLock lock = new ReentrantLock();

    public WebDriverSelectorResolver(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    // ── Public API ────────────────────────────────────────────────────────

    @Override
    public ResolveResult resolve(LocatorType type, String value) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResolveResult.failed("Interrupted waiting for the browser");
        }
        try {
            int count = switch (type) {
                case CSS   -> driver.findElements(By.cssSelector(value)).size();
                case XPATH -> driver.findElements(By.xpath(value)).size();
                case ROLE  -> countRole(AriaRoles.parseSelector(value));
            };
            log.debug("[{}] {} -> {}", type, value, count);
            return ResolveResult.matched(count);
        } catch (IllegalArgumentException e) {
            return ResolveResult.failed(e.getMessage());
        } catch (WebDriverException e) {
            log.debug("[{}] {} failed: {}", type, value, e.getClass().getSimpleName());
            return ResolveResult.failed(firstLine(e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    /** One browser session, one command at a time. */
    @Override
    public int maxConcurrentCalls() {
        return 1;
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private int countRole(RoleQuery query) {
        int count = 0;
        for (WebElement el : driver.findElements(By.cssSelector(prefilter(query.role())))) {
            if (query.role().equalsIgnoreCase(el.getAriaRole())
                    && query.name().equals(normalize(el.getAccessibleName()))) {
                count++;
            }
        }
        return count;
    }

    /** CSS selecting every element that may expose {@code role}. */
    static String prefilter(String role) {
        String explicit = "[role=" + CssEscaper.quoted(role) + "]";
        String implicit = IMPLICIT_ROLE_TAGS.get(role);
        return implicit == null ? explicit : explicit + ", " + implicit;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }

    private static String firstLine(String msg) {
        if (msg == null || msg.isBlank()) return "WebDriver error";
        return List.of(msg.split("\\R")).get(0);
    }
}
