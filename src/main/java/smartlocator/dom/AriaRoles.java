package smartlocator.dom;

import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;
import smartlocator.model.RoleQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Explicit and implicit ARIA roles plus a simplified accessible-name
 * computation over the static {@link ElementModel}.
 *
 * <p>The implicit-role table follows the HTML-AAM mappings Playwright's
 * {@code getByRole} understands; context-dependent roles (header/footer
 * landmarks, table cells) are left out.
 */
public final class AriaRoles {

    /** Names longer than this are not worth building a role selector on. */
    static final int MAX_NAME_LENGTH = 80;

    private static final Map<String, String> TAG_ROLES = Map.ofEntries(
            Map.entry("button",   "button"),
            Map.entry("textarea", "textbox"),
            Map.entry("h1",       "heading"),
            Map.entry("h2",       "heading"),
            Map.entry("h3",       "heading"),
            Map.entry("h4",       "heading"),
            Map.entry("h5",       "heading"),
            Map.entry("h6",       "heading"),
            Map.entry("nav",      "navigation"),
            Map.entry("main",     "main"),
            Map.entry("aside",    "complementary"),
            Map.entry("dialog",   "dialog"),
            Map.entry("ul",       "list"),
            Map.entry("ol",       "list"),
            Map.entry("li",       "listitem"),
            Map.entry("table",    "table"),
            Map.entry("option",   "option"),
            Map.entry("progress", "progressbar"),
            Map.entry("details",  "group"),
            Map.entry("fieldset", "group"));

    private static final Map<String, String> INPUT_ROLES = Map.ofEntries(
            Map.entry("button",   "button"),
            Map.entry("submit",   "button"),
            Map.entry("reset",    "button"),
            Map.entry("image",    "button"),
            Map.entry("checkbox", "checkbox"),
            Map.entry("radio",    "radio"),
            Map.entry("range",    "slider"),
            Map.entry("number",   "spinbutton"),
            Map.entry("search",   "searchbox"),
            Map.entry("text",     "textbox"),
            Map.entry("email",    "textbox"),
            Map.entry("tel",      "textbox"),
            Map.entry("url",      "textbox"));

    /** Roles whose accessible name may come from their text content. */
    private static final Set<String> NAME_FROM_CONTENT = Set.of(
            "button", "link", "heading", "option", "listitem", "tab", "menuitem",
            "checkbox", "radio", "switch", "treeitem", "cell", "columnheader",
            "rowheader", "tooltip");

    private static final Pattern ROLE_SELECTOR =
            Pattern.compile("role=([^\\[\\s]+)\\[name=(\".*\")s?]", Pattern.DOTALL);

    private AriaRoles() {}

    /**
     * Explicit {@code role} (first token) or the implicit role of the tag.
     */
    public static Optional<String> roleOf(DomElement el) {
        String explicit = el.attribute("role");
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(explicit.trim().split("\\s+")[0].toLowerCase(Locale.ROOT));
        }
        return implicitRole(el);
    }

    static Optional<String> implicitRole(DomElement el) {
        String tag = el.getTagName();
        switch (tag) {
            case "a":
            case "area":
                return el.getAttributes().containsKey("href") ? Optional.of("link") : Optional.empty();
            case "img":
                String alt = el.attribute("alt");
                if (alt == null) return Optional.of("img");
                return alt.isEmpty() ? Optional.empty() : Optional.of("img");
            case "select":
                return Optional.of(isListbox(el) ? "listbox" : "combobox");
            case "input":
                return inputRole(el);
            default:
                return Optional.ofNullable(TAG_ROLES.get(tag));
        }
    }

    private static Optional<String> inputRole(DomElement el) {
        String type = Optional.ofNullable(el.attribute("type")).orElse("text").trim().toLowerCase(Locale.ROOT);
        if (type.isEmpty()) type = "text";
        boolean hasList = el.hasValue("list");
        if (hasList && Set.of("text", "search", "email", "tel", "url").contains(type)) {
            return Optional.of("combobox");
        }
        return Optional.ofNullable(INPUT_ROLES.get(type));
    }

    private static boolean isListbox(DomElement el) {
        if (el.getAttributes().containsKey("multiple")) return true;
        try {
            String size = el.attribute("size");
            return size != null && Integer.parseInt(size.trim()) > 1;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Simplified accessible name: aria-labelledby, aria-label, associated
     * label, alt, input button value, text content for name-from-content roles,
     * title, placeholder. Whitespace is collapsed; blank means no name.
     */
    public static String accessibleName(DomElement el, ElementModel model) {
        String labelledBy = labelledByText(el, model);
        if (!labelledBy.isEmpty()) return labelledBy;

        if (el.hasValue("aria-label")) return clean(el.attribute("aria-label"));
        if (!el.getLabelText().isBlank()) return clean(el.getLabelText());

        String tag = el.getTagName();
        if (("img".equals(tag) || "area".equals(tag)) && el.hasValue("alt")) {
            return clean(el.attribute("alt"));
        }
        if ("input".equals(tag)) {
            String type = Optional.ofNullable(el.attribute("type")).orElse("").toLowerCase(Locale.ROOT);
            switch (type) {
                case "submit":
                    return el.hasValue("value") ? clean(el.attribute("value")) : "Submit";
                case "reset":
                    return el.hasValue("value") ? clean(el.attribute("value")) : "Reset";
                case "button":
                    if (el.hasValue("value")) return clean(el.attribute("value"));
                    break;
                case "image":
                    if (el.hasValue("alt")) return clean(el.attribute("alt"));
                    break;
                default:
                    break;
            }
        }

        Optional<String> role = roleOf(el);
        if (role.isPresent() && NAME_FROM_CONTENT.contains(role.get()) && !"input".equals(tag)
                && !el.getText().isBlank()) {
            return clean(el.getText());
        }
        if (el.hasValue("title")) return clean(el.attribute("title"));
        if (el.hasValue("placeholder")) return clean(el.attribute("placeholder"));
        return "";
    }

    /**
     * Role plus accessible name, when both are known and the name is short
     * enough to be a sensible selector.
     */
    public static Optional<RoleQuery> roleQuery(DomElement el, ElementModel model) {
        Optional<String> role = roleOf(el);
        if (role.isEmpty() || "none".equals(role.get()) || "presentation".equals(role.get())) {
            return Optional.empty();
        }
        String name = accessibleName(el, model);
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) return Optional.empty();
        return Optional.of(new RoleQuery(role.get(), name));
    }

    /**
     * Playwright role selector text, e.g. {@code role=button[name="Save"s]}.
     * The {@code s} flag makes Playwright match the whole name, case-sensitively.
     */
    public static String selector(RoleQuery query) {
        return "role=" + query.role() + "[name=" + CssEscaper.quoted(query.name()) + "s]";
    }

    /**
     * Parses the output of {@link #selector} back into its role and name.
     * The {@code s} flag is optional; names are always compared exactly.
     *
     * @throws IllegalArgumentException if {@code selector} is not of that form
     */
    public static RoleQuery parseSelector(String selector) {
        Matcher m = ROLE_SELECTOR.matcher(selector == null ? "" : selector.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a role selector: " + selector);
        }
        return new RoleQuery(m.group(1), CssEscaper.unquoted(m.group(2)));
    }

    private static String labelledByText(DomElement el, ElementModel model) {
        String ids = el.attribute("aria-labelledby");
        if (ids == null || ids.isBlank() || model == null) return "";
        List<String> parts = new ArrayList<>();
        for (String id : ids.trim().split("\\s+")) {
            model.stream()
                    .filter(other -> id.equals(other.attribute("id")))
                    .findFirst()
                    .map(DomElement::getText)
                    .filter(t -> !t.isBlank())
                    .ifPresent(parts::add);
        }
        return clean(String.join(" ", parts));
    }

    private static String clean(String s) {
        return DomParser.normalize(s);
    }
}
