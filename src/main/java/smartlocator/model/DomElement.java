package smartlocator.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of one parsed element.
 *
 * <p>Relations are expressed as indices into the owning {@link ElementModel},
 * never as object references, so the structure stays acyclic.
 */
public final class DomElement {

    /** Parent index of the document root. */
    public static final int NO_PARENT = -1;

    private final int index;
    private final String tagName;
    private final Map<String, String> attributes;
    private final String text;
    private final String labelText;
    private final int parentIndex;
    private final List<Integer> childIndices;

    public DomElement(int index, String tagName, Map<String, String> attributes,
                      String text, String labelText, int parentIndex, List<Integer> childIndices) {
        this.index        = index;
        this.tagName      = tagName == null ? "" : tagName.toLowerCase(Locale.ROOT);
        this.attributes   = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text         = text == null ? "" : text;
        this.labelText    = labelText == null ? "" : labelText;
        this.parentIndex  = parentIndex;
        this.childIndices = childIndices == null ? List.of() : List.copyOf(childIndices);
    }

    public int                 getIndex()        { return index; }
    public String              getTagName()      { return tagName; }
    public Map<String, String> getAttributes()   { return attributes; }
    public String              getText()         { return text; }
    public String              getLabelText()    { return labelText; }
    public int                 getParentIndex()  { return parentIndex; }
    public List<Integer>       getChildIndices() { return childIndices; }

    public boolean isRoot() { return parentIndex == NO_PARENT; }

    /** Attribute value, or {@code null} when absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /** True when the attribute is present with a non-blank value. */
    public boolean hasValue(String name) {
        String v = attributes.get(name);
        return v != null && !v.isBlank();
    }

    /** Class tokens in source order, without duplicates. */
    public List<String> classes() {
        String raw = attributes.get("class");
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.trim().split("\\s+"))
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    /** Sorted, space-joined class tokens; empty string when there are none. */
    public String normalizedClassList() {
        return classes().stream().sorted().collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DomElement{#").append(index).append(" <").append(tagName);
        if (hasValue("id")) sb.append(" id='").append(attribute("id")).append('\'');
        if (hasValue("class")) sb.append(" class='").append(attribute("class")).append('\'');
        return sb.append(">}").toString();
    }
}
