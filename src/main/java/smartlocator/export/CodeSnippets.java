package smartlocator.export;

import smartlocator.dom.AriaRoles;
import smartlocator.model.LocatorType;
import smartlocator.model.RoleQuery;

import java.util.Locale;
import java.util.Set;

/**
 * Java source fragments that use a selector from Playwright or Selenium.
 *
 * <p>Role selectors become {@code page.getByRole(AriaRole.X, ...)} when the
 * role is one of Playwright's {@code AriaRole} constants, and fall back to the
 * equivalent {@code role=} selector engine otherwise. Selenium has no role
 * lookup, so there is no Selenium snippet for them.
 */
public final class CodeSnippets {

    /** Constants of {@code com.microsoft.playwright.options.AriaRole}, lower-cased. */
    static final Set<String> ARIA_ROLES = Set.of(
            "alert", "alertdialog", "application", "article", "banner", "blockquote", "button",
            "caption", "cell", "checkbox", "code", "columnheader", "combobox", "complementary",
            "contentinfo", "definition", "deletion", "dialog", "directory", "document", "emphasis",
            "feed", "figure", "form", "generic", "grid", "gridcell", "group", "heading", "img",
            "insertion", "link", "list", "listbox", "listitem", "log", "main", "marquee", "math",
            "meter", "menu", "menubar", "menuitem", "menuitemcheckbox", "menuitemradio", "navigation",
            "none", "note", "option", "paragraph", "presentation", "progressbar", "radio", "radiogroup",
            "region", "row", "rowgroup", "rowheader", "scrollbar", "search", "searchbox", "separator",
            "slider", "spinbutton", "status", "strong", "subscript", "superscript", "switch", "tab",
            "table", "tablist", "tabpanel", "term", "textbox", "time", "timer", "toolbar", "tooltip",
            "tree", "treegrid", "treeitem");

    private CodeSnippets() {}

    /** Playwright {@code Locator} expression on a variable named {@code page}. */
    public static String playwrightLocator(LocatorType type, String value) {
        switch (type) {
            case CSS:
                return "page.locator(" + javaString(value) + ")";
            case XPATH:
                return "page.locator(" + javaString("xpath=" + value) + ")";
            case ROLE:
                RoleQuery q = AriaRoles.parseSelector(value);
                if (!ARIA_ROLES.contains(q.role())) {
                    return "page.locator(" + javaString(value) + ")";
                }
                return "page.getByRole(AriaRole." + q.role().toUpperCase(Locale.ROOT)
                        + ", new Page.GetByRoleOptions().setName(" + javaString(q.name()) + ").setExact(true))";
            default:
                throw new IllegalArgumentException("Unhandled locator type: " + type);
        }
    }

    /**
     * Selenium {@code By} expression, or {@code null} when Selenium cannot use the selector.
     */
    public static String seleniumBy(LocatorType type, String value) {
        switch (type) {
            case CSS:   return "By.cssSelector(" + javaString(value) + ")";
            case XPATH: return "By.xpath(" + javaString(value) + ")";
            case ROLE:  return null;
            default:    throw new IllegalArgumentException("Unhandled locator type: " + type);
        }
    }

    /** Lookup statement on a variable named {@code driver}, or {@code null}. */
    public static String seleniumFind(LocatorType type, String value) {
        String by = seleniumBy(type, value);
        return by == null ? null : "driver.findElement(" + by + ")";
    }

    /** Double-quoted Java string literal. */
    public static String javaString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n");  break;
                case '\r': sb.append("\\r");  break;
                case '\t': sb.append("\\t");  break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
