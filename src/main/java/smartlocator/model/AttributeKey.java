package smartlocator.model;

import java.util.Objects;

/**
 * (attribute-name, attribute-value) pair that identifies a candidate and keys
 * the document-wide frequency counts.
 */
public record AttributeKey(String name, String value) {

    /** Pseudo-attribute name used for role + accessible-name pairs. */
    public static final String ROLE = "role";
    /** Attribute name used for the tag plus normalized class list. */
    public static final String CLASS = "class";

    public AttributeKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static AttributeKey of(String name, String value) {
        return new AttributeKey(name, value);
    }

    /** Key of a {@code tag.cls1.cls2} selector: {@code tag|cls1 cls2}, classes sorted. */
    public static AttributeKey classList(String tagName, String normalizedClassList) {
        return new AttributeKey(CLASS, tagName + "|" + normalizedClassList);
    }

    @Override
    public String toString() {
        return name + "=\"" + value + "\"";
    }
}
