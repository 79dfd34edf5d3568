package smartlocator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.dom.AriaRoles;
import smartlocator.model.AttributeKey;
import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Document-wide occurrence counts of identifying attribute values.
 *
 * <p>Built in one pass over the whole model before any element is scored and
 * read-only afterwards; instances are safe to share between worker threads.
 * Counted keys are {@code id}, each configured identifying attribute, the
 * tag with its normalized {@code class} list ({@code tag|classes}) and the
 * {@code role} pseudo-attribute ({@code role|accessible name}). Blank values are never counted.
 */
public final class FrequencyContext {

    private static final Logger log = LoggerFactory.getLogger(FrequencyContext.class);

    private final Map<AttributeKey, Integer> counts;

    private FrequencyContext(Map<AttributeKey, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static FrequencyContext build(ElementModel model, Collection<String> identifyingAttributes) {
        Map<AttributeKey, Integer> counts = new HashMap<>();
        List<String> attrs = identifyingAttributes.stream()
                .filter(a -> !"id".equals(a))
                .collect(Collectors.toList());

        for (DomElement el : model.elements()) {
            if (el.hasValue("id")) {
                counts.merge(AttributeKey.of("id", el.attribute("id")), 1, Integer::sum);
            }
            for (String attr : attrs) {
                if (el.hasValue(attr)) {
                    counts.merge(AttributeKey.of(attr, el.attribute(attr)), 1, Integer::sum);
                }
            }
            String classList = el.normalizedClassList();
            if (!classList.isEmpty()) {
                counts.merge(AttributeKey.classList(el.getTagName(), classList), 1, Integer::sum);
            }
            AriaRoles.roleQuery(el, model).ifPresent(q ->
                    counts.merge(AttributeKey.of(AttributeKey.ROLE, q.frequencyValue()), 1, Integer::sum));
        }

        log.debug("Frequency context: {} distinct keys over {} elements", counts.size(), model.size());
        return new FrequencyContext(counts);
    }

    /** Number of elements carrying {@code key}; 0 when never seen. */
    public int count(AttributeKey key) {
        return counts.getOrDefault(key, 0);
    }

    public int count(String name, String value) {
        return count(AttributeKey.of(name, value));
    }

    public boolean isDuplicate(AttributeKey key) {
        return count(key) > 1;
    }

    public int distinctKeys() {
        return counts.size();
    }

    @Override
    public String toString() {
        return "FrequencyContext{keys=" + counts.size() + "}";
    }
}
