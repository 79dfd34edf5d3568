package smartlocator.engine;

import smartlocator.model.DomElement;

import java.util.Locale;
import java.util.Map;

/**
 * Derives a readable camelCase name such as {@code submitButton} or
 * {@code emailInput} for an element. Used as the Page-Object member name.
 */
final class CustomNames {

    private static final Map<String, String> SUFFIXES = Map.of(
            "a",        "Link",
            "button",   "Button",
            "input",    "Input",
            "select",   "Select",
            "textarea", "Textarea");

    private CustomNames() {}

    static String guess(DomElement el) {
        String tag = el.getTagName();
        String text = el.getText().trim();

        String visible = "";
        if (("button".equals(tag) || "a".equals(tag)) && !text.isEmpty()) {
            visible = text;
        } else if (!el.getLabelText().isBlank()) {
            visible = el.getLabelText();
        } else if (el.hasValue("aria-label")) {
            visible = el.attribute("aria-label");
        } else if (el.hasValue("placeholder") && ("input".equals(tag) || "textarea".equals(tag))) {
            visible = el.attribute("placeholder");
        }

        String base;
        if (!visible.isBlank()) {
            base = camelCase(visible);
        } else if (el.hasValue("data-testid")) {
            base = camelCase(el.attribute("data-testid"));
        } else if (el.hasValue("data-test")) {
            base = camelCase(el.attribute("data-test"));
        } else if (el.hasValue("id")) {
            base = camelCase(el.attribute("id"));
        } else if (el.hasValue("name")) {
            base = camelCase(el.attribute("name"));
        } else if (!el.classes().isEmpty()) {
            base = camelCase(el.classes().get(0));
        } else {
            base = camelCase(tag);
        }
        if (base.isEmpty()) base = "element";
        if (Character.isDigit(base.charAt(0))) base = "e" + base;

        String suffix = SUFFIXES.getOrDefault(tag, "Element");
        return base.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT)) ? base : base + suffix;
    }

    /** {@code "Add to cart!"} becomes {@code addToCart}. Long names keep their first six words. */
    static String camelCase(String raw) {
        String[] parts = raw.split("[^A-Za-z0-9]+");
        StringBuilder sb = new StringBuilder();
        int words = 0;
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (words == 6) break;
            if (sb.length() == 0) {
                sb.append(part.toLowerCase(Locale.ROOT));
            } else {
                sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
            }
            words++;
        }
        return sb.toString();
    }
}
