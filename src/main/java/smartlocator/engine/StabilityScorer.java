package smartlocator.engine;

import smartlocator.model.LocatorCandidate;
import smartlocator.model.Strategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns the 1–10 stability score: base score of the strategy, minus fixed
 * penalties for the {@code dynamic} and {@code duplicate} flags, clamped.
 * The label is derived from the score by
 * {@link smartlocator.model.StabilityLabel#fromScore(int)}.
 *
 * <p>Constants are fixed for every run; the base table keeps the order
 * ID &gt; attribute &gt; role &gt; class &gt; absolute XPath.
 */
public class StabilityScorer {

    public static final int ID_BASE             = 10;
    public static final int ATTRIBUTE_BASE      = 9;
    public static final int ROLE_BASE           = 8;
    public static final int CLASS_BASE          = 6;
    public static final int ABSOLUTE_XPATH_BASE = 3;

    public static final int DYNAMIC_PENALTY   = 4;
    public static final int DUPLICATE_PENALTY = 3;

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    private static final Map<Strategy, Integer> BASE_SCORES;

    static {
        Map<Strategy, Integer> m = new EnumMap<>(Strategy.class);
        m.put(Strategy.ID,             ID_BASE);
        m.put(Strategy.ATTRIBUTE,      ATTRIBUTE_BASE);
        m.put(Strategy.ROLE,           ROLE_BASE);
        m.put(Strategy.CLASS,          CLASS_BASE);
        m.put(Strategy.ABSOLUTE_XPATH, ABSOLUTE_XPATH_BASE);
        BASE_SCORES = Collections.unmodifiableMap(m);
    }

    public static int baseScore(Strategy strategy) {
        Integer base = BASE_SCORES.get(strategy);
        if (base == null) throw new IllegalArgumentException("No base score for " + strategy);
        return base;
    }

    /** Pure score computation from the candidate's strategy and flags. */
    public int score(LocatorCandidate c) {
        int score = baseScore(c.getStrategy());
        if (c.isDynamic())   score -= DYNAMIC_PENALTY;
        if (c.isDuplicate()) score -= DUPLICATE_PENALTY;
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public void annotate(LocatorCandidate c) {
        c.applyScore(score(c));
    }

    public void annotate(List<LocatorCandidate> candidates) {
        candidates.forEach(this::annotate);
    }
}
