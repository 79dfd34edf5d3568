package smartlocator.engine;

import smartlocator.model.DomElement;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/** Which elements of the document enter candidate generation. */
public enum ScanScope {
    /** Every element, {@code html} included. */
    ALL,
    /** Form controls, links, buttons and anything carrying a role, handler or test id. */
    INTERACTIVE;

    private static final Set<String> INTERACTABLE_TAGS = Set.of("a", "button", "input", "select", "textarea");

    public boolean includes(DomElement el, Collection<String> identifyingAttributes) {
        if (this == ALL) return true;
        if (INTERACTABLE_TAGS.contains(el.getTagName())) return true;
        if (el.hasValue("role") || el.getAttributes().containsKey("onclick")) return true;
        for (String attr : identifyingAttributes) {
            if (el.hasValue(attr)) return true;
        }
        return false;
    }

    public static ScanScope parse(String raw) {
        if (raw == null || raw.isBlank()) return ALL;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scan scope: '" + raw + "' (expected all or interactive)", e);
        }
    }
}
