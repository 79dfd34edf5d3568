package smartlocator.engine;

import smartlocator.model.Framework;
import smartlocator.model.FrameworkTag;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorSummary;
import smartlocator.model.LocatorType;
import smartlocator.model.MinStability;
import smartlocator.model.StabilityLabel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Final pipeline phase: framework tagging, de-duplication, stability and
 * framework filtering, ranking and summary counts.
 *
 * <p>Every method except {@link #tagFrameworks} returns a new list and leaves
 * its input untouched; the filters are idempotent.
 */
public class Aggregator {

    private static final Comparator<LocatorCandidate> RANKING =
            Comparator.comparingInt(LocatorCandidate::getElementIndex)
                    .thenComparing(Comparator.comparingInt(Aggregator::scoreOf).reversed());

    /** Sets {@code frameworkTag} from the locator type. */
    public void tagFrameworks(List<LocatorCandidate> candidates) {
        for (LocatorCandidate c : candidates) {
            c.tagFramework(FrameworkTag.forType(c.getType()));
        }
    }

    /**
     * Keeps candidates whose stability label meets {@code min}.
     *
     * @throws IllegalStateException if a candidate has not been scored
     */
    public List<LocatorCandidate> filter(List<LocatorCandidate> candidates, MinStability min) {
        return candidates.stream()
                .filter(c -> min.accepts(c.getStabilityLabel()))
                .collect(Collectors.toList());
    }

    /** Keeps candidates usable by at least one of {@code frameworks}. */
    public List<LocatorCandidate> selectFrameworks(List<LocatorCandidate> candidates, Set<Framework> frameworks) {
        return candidates.stream()
                .filter(c -> frameworks.stream().anyMatch(tagOf(c)::supports))
                .collect(Collectors.toList());
    }

    /** Per element, keeps the first of candidates with the same type and value. */
    public List<LocatorCandidate> deduplicate(List<LocatorCandidate> candidates) {
        List<LocatorCandidate> kept = new ArrayList<>(candidates.size());
        Set<SelectorKey> seen = new HashSet<>();
        for (LocatorCandidate c : candidates) {
            if (seen.add(new SelectorKey(c.getElementIndex(), c.getType(), c.getValue()))) {
                kept.add(c);
            }
        }
        return kept;
    }

    /** Stable order: document order of the element, then score descending. */
    public List<LocatorCandidate> rank(List<LocatorCandidate> candidates) {
        List<LocatorCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING);
        return ranked;
    }

    /**
     * Tags, de-duplicates, filters by stability and framework, then ranks.
     */
    public List<LocatorCandidate> aggregate(List<LocatorCandidate> candidates, MinStability min,
                                            Set<Framework> frameworks) {
        tagFrameworks(candidates);
        List<LocatorCandidate> result = deduplicate(candidates);
        result = filter(result, min);
        result = selectFrameworks(result, frameworks);
        return rank(result);
    }

    public LocatorSummary summarize(List<LocatorCandidate> candidates, int totalElements) {
        Map<String, Integer> types = new LinkedHashMap<>();
        types.put("css", 0);
        types.put("xpath", 0);
        types.put("role", 0);
        Map<String, Integer> tools = new LinkedHashMap<>();
        tools.put("playwright", 0);
        tools.put("selenium", 0);
        tools.put("both", 0);
        Map<String, Integer> labels = new LinkedHashMap<>();
        labels.put("high", 0);
        labels.put("medium", 0);
        labels.put("low", 0);

        for (LocatorCandidate c : candidates) {
            types.merge(typeKey(c.getType()), 1, Integer::sum);
            tools.merge(toolKey(tagOf(c)), 1, Integer::sum);
            labels.merge(labelKey(c.getStabilityLabel()), 1, Integer::sum);
        }
        return new LocatorSummary(totalElements, candidates.size(), types, tools, labels);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private record SelectorKey(int elementIndex, LocatorType type, String value) {}

    private static FrameworkTag tagOf(LocatorCandidate c) {
        return c.getFrameworkTag() != null ? c.getFrameworkTag() : FrameworkTag.forType(c.getType());
    }

    private static int scoreOf(LocatorCandidate c) {
        return c.getStabilityScore() != null ? c.getStabilityScore() : 0;
    }

    private static String typeKey(LocatorType type) {
        switch (type) {
            case CSS:   return "css";
            case XPATH: return "xpath";
            case ROLE:  return "role";
            default:    throw new IllegalArgumentException("Unhandled locator type: " + type);
        }
    }

    private static String toolKey(FrameworkTag tag) {
        switch (tag) {
            case PLAYWRIGHT_ONLY: return "playwright";
            case SELENIUM_ONLY:   return "selenium";
            case BOTH:            return "both";
            default:              throw new IllegalArgumentException("Unhandled framework tag: " + tag);
        }
    }

    private static String labelKey(StabilityLabel label) {
        switch (label) {
            case HIGH:   return "high";
            case MEDIUM: return "medium";
            case LOW:    return "low";
            default:     throw new IllegalArgumentException("Unhandled label: " + label);
        }
    }
}
