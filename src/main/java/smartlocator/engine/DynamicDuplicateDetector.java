package smartlocator.engine;

import smartlocator.model.AttributeKey;
import smartlocator.model.DomElement;
import smartlocator.model.LocatorCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sets the {@code duplicate} and {@code dynamic} flags on freshly generated
 * candidates. Never touches the score; the scorer turns the flags into
 * penalties.
 *
 * <ul>
 *   <li>{@code duplicate}: the candidate's identifying pair occurs on more
 *       than one element according to the {@link FrequencyContext}.</li>
 *   <li>{@code dynamic}: an identifying value of the owning element (id,
 *       identifying attributes, class tokens) or the candidate's own key value
 *       matches {@link DynamicValuePatterns}. The element-level findings apply
 *       to every candidate of that element.</li>
 * </ul>
 */
public class DynamicDuplicateDetector {

    private final FrequencyContext frequencies;
    private final List<String> identifyingAttributes;

    public DynamicDuplicateDetector(FrequencyContext frequencies, List<String> identifyingAttributes) {
        this.frequencies = Objects.requireNonNull(frequencies, "frequencies");
        this.identifyingAttributes = List.copyOf(identifyingAttributes);
    }

    /**
     * Annotates all candidates of one element.
     */
    public void annotate(DomElement el, List<LocatorCandidate> candidates) {
        List<String> elementFindings = dynamicFindings(el);

        for (LocatorCandidate c : candidates) {
            AttributeKey key = c.getKey();
            if (key != null && frequencies.isDuplicate(key)) {
                c.markDuplicate(duplicateWarning(key, frequencies.count(key)));
            }

            for (String finding : elementFindings) {
                c.markDynamic(finding);
            }
            if (c.getRoleQuery() != null) {
                String name = c.getRoleQuery().name();
                DynamicValuePatterns.reason(name).ifPresent(reason ->
                        c.markDynamic("accessible name '" + name + "' appears dynamic (" + reason + ")"));
            }
        }
    }

    private List<String> dynamicFindings(DomElement el) {
        List<String> findings = new ArrayList<>();
        check("id", el.attribute("id"), findings);
        for (String attr : identifyingAttributes) {
            if (!"id".equals(attr)) check(attr, el.attribute(attr), findings);
        }
        for (String token : el.classes()) {
            Optional<String> reason = DynamicValuePatterns.reason(token);
            if (reason.isPresent()) {
                findings.add("class token '" + token + "' appears dynamic (" + reason.get() + ")");
                break;
            }
        }
        return findings;
    }

    private static void check(String attr, String value, List<String> findings) {
        DynamicValuePatterns.reason(value).ifPresent(reason ->
                findings.add(attr + " '" + value + "' appears dynamic (" + reason + ")"));
    }

    private static String duplicateWarning(AttributeKey key, int count) {
        switch (key.name()) {
            case AttributeKey.CLASS:
                return "Duplicate tag and class list '" + key.value().replace('|', ' ') + "' shared by " + count + " elements";
            case AttributeKey.ROLE:
                return "Duplicate role and name '" + key.value().replace('|', ' ') + "' shared by " + count + " elements";
            default:
                return "Duplicate " + key.name() + " '" + key.value() + "' shared by " + count + " elements";
        }
    }
}
