package smartlocator.model;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LocatorCandidateTest {

    private static LocatorCandidate idCandidate() {
        return LocatorCandidate.attributeBased(4, Strategy.ID, "#save", AttributeKey.of("id", "save"), "saveButton");
    }

    @Test(description = "Scores outside 1..10 are rejected")
    public void testScoreRange() {
        LocatorCandidate c = idCandidate();

        assertThatThrownBy(() -> c.applyScore(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.applyScore(11)).isInstanceOf(IllegalArgumentException.class);
        c.applyScore(10);
        assertThat(c.getStabilityLabel()).isEqualTo(StabilityLabel.HIGH);
    }

    @Test(description = "Label is unavailable before scoring")
    public void testLabelBeforeScoring() {
        assertThatThrownBy(() -> idCandidate().getStabilityLabel())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test(description = "Identical warnings are recorded once")
    public void testWarningsDeduplicated() {
        LocatorCandidate c = idCandidate();
        c.markDuplicate("Duplicate id 'save' shared by 2 elements");
        c.markDuplicate("Duplicate id 'save' shared by 2 elements");
        c.addWarning(" ");

        assertThat(c.isDuplicate()).isTrue();
        assertThat(c.getWarnings()).containsExactly("Duplicate id 'save' shared by 2 elements");
    }

    @Test(description = "Validation fields start null and record either a count or an error")
    public void testValidationFields() {
        LocatorCandidate c = idCandidate();
        assertThat(c.getValidated()).isNull();
        assertThat(c.getMatchCount()).isNull();

        c.recordValidationError(null);
        assertThat(c.getValidated()).isTrue();
        assertThat(c.getValidationError()).isEqualTo("Unknown validation error");

        c.recordMatchCount(1);
        assertThat(c.getMatchCount()).isEqualTo(1);
        assertThat(c.getValidationError()).isNull();
    }

    @Test(description = "Attribute-keyed factories only build CSS candidates")
    public void testFactoryTypeCheck() {
        assertThatThrownBy(() -> LocatorCandidate.attributeBased(0, Strategy.ROLE, "role=x[name=\"y\"s]",
                AttributeKey.of("role", "x|y"), "n"))
                .isInstanceOf(IllegalArgumentException.class);

        LocatorCandidate role = LocatorCandidate.role(1, "role=button[name=\"Save\"s]",
                new RoleQuery("button", "Save"), "saveButton");
        assertThat(role.getKey()).isEqualTo(AttributeKey.of("role", "button|Save"));
        assertThat(role.getType()).isEqualTo(LocatorType.ROLE);
        assertThat(LocatorCandidate.absoluteXPath(2, "/html[1]", "htmlElement").getKey()).isNull();
    }
}
