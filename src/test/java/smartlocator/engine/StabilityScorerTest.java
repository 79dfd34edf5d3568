package smartlocator.engine;

import org.testng.annotations.Test;
import smartlocator.model.AttributeKey;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.RoleQuery;
import smartlocator.model.StabilityLabel;
import smartlocator.model.Strategy;

import static org.assertj.core.api.Assertions.assertThat;

public class StabilityScorerTest {

    private final StabilityScorer scorer = new StabilityScorer();

    private static LocatorCandidate css(Strategy strategy) {
        return LocatorCandidate.attributeBased(0, strategy, "x", AttributeKey.of("k", "v"), "n");
    }

    @Test(description = "Base scores keep ID > attribute > role > class > absolute XPath")
    public void testBaseOrder() {
        assertThat(StabilityScorer.baseScore(Strategy.ID))
                .isGreaterThan(StabilityScorer.baseScore(Strategy.ATTRIBUTE));
        assertThat(StabilityScorer.baseScore(Strategy.ATTRIBUTE))
                .isGreaterThan(StabilityScorer.baseScore(Strategy.ROLE));
        assertThat(StabilityScorer.baseScore(Strategy.ROLE))
                .isGreaterThan(StabilityScorer.baseScore(Strategy.CLASS));
        assertThat(StabilityScorer.baseScore(Strategy.CLASS))
                .isGreaterThan(StabilityScorer.baseScore(Strategy.ABSOLUTE_XPATH));
    }

    @Test(description = "Clean candidates score their base")
    public void testCleanScores() {
        assertThat(scorer.score(css(Strategy.ID))).isEqualTo(10);
        assertThat(scorer.score(css(Strategy.ATTRIBUTE))).isEqualTo(9);
        assertThat(scorer.score(LocatorCandidate.role(0, "role=button[name=\"A\"s]",
                new RoleQuery("button", "A"), "n"))).isEqualTo(8);
        assertThat(scorer.score(css(Strategy.CLASS))).isEqualTo(6);
        assertThat(scorer.score(LocatorCandidate.absoluteXPath(0, "/html[1]", "n"))).isEqualTo(3);
    }

    @Test(description = "Dynamic and duplicate penalties add up and clamp at 1")
    public void testPenalties() {
        LocatorCandidate dynamicId = css(Strategy.ID);
        dynamicId.markDynamic("id looks generated");
        assertThat(scorer.score(dynamicId)).isEqualTo(6);

        LocatorCandidate duplicateClass = css(Strategy.CLASS);
        duplicateClass.markDuplicate("shared");
        assertThat(scorer.score(duplicateClass)).isEqualTo(3);

        LocatorCandidate worst = LocatorCandidate.absoluteXPath(0, "/html[1]", "n");
        worst.markDynamic("d");
        worst.markDuplicate("d");
        assertThat(scorer.score(worst)).isEqualTo(StabilityScorer.MIN_SCORE);
    }

    @Test(description = "annotate stores the score; the label follows from it")
    public void testAnnotate() {
        LocatorCandidate c = css(Strategy.ATTRIBUTE);
        c.markDuplicate("shared");

        scorer.annotate(c);

        assertThat(c.getStabilityScore()).isEqualTo(6);
        assertThat(c.getStabilityLabel()).isEqualTo(StabilityLabel.MEDIUM);
    }
}
