package smartlocator.engine;

import org.testng.annotations.Test;
import smartlocator.dom.DomParser;
import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorType;
import smartlocator.model.RoleQuery;
import smartlocator.model.Strategy;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CandidateGenerator}.
 */
public class CandidateGeneratorTest {

    private static final String FORM = "<form>"
            + "<input id='email' name='email' data-testid='email-input' class='form-control'>"
            + "<button class='btn primary'>Save</button>"
            + "<button class='btn'>Cancel</button>"
            + "<div>plain</div>"
            + "</form>";

    private final ElementModel model = new DomParser().parse(FORM);
    private final CandidateGenerator generator =
            new CandidateGenerator(model, PipelineOptions.DEFAULT_IDENTIFYING_ATTRIBUTES);

    // ── Strategy order ────────────────────────────────────────────────────

    @Test(description = "Candidates follow the ID, attribute, class, role, absolute XPath order")
    public void testPriorityOrder() {
        List<LocatorCandidate> candidates = generator.generate(byTag("input"));

        assertThat(candidates.stream().map(LocatorCandidate::getStrategy).collect(Collectors.toList()))
                .containsExactly(Strategy.ID, Strategy.ATTRIBUTE, Strategy.ATTRIBUTE,
                        Strategy.CLASS, Strategy.ABSOLUTE_XPATH);
        assertThat(candidates.stream().map(LocatorCandidate::getValue).collect(Collectors.toList()))
                .containsExactly("#email", "[name=\"email\"]", "[data-testid=\"email-input\"]",
                        "input.form-control", "/html[1]/body[1]/form[1]/input[1]");
    }

    @Test(description = "The class candidate comes before the role candidate")
    public void testClassBeforeRole() {
        List<LocatorCandidate> candidates = generator.generate(byText("Save"));

        assertThat(candidates.stream().map(LocatorCandidate::getStrategy).collect(Collectors.toList()))
                .containsExactly(Strategy.CLASS, Strategy.ROLE, Strategy.ABSOLUTE_XPATH);
    }

    @Test(description = "Buttons get a role candidate with their accessible name")
    public void testRoleCandidate() {
        LocatorCandidate role = generator.generate(byText("Save")).stream()
                .filter(c -> c.getType() == LocatorType.ROLE)
                .findFirst().orElseThrow();

        assertThat(role.getValue()).isEqualTo("role=button[name=\"Save\"s]");
        assertThat(role.getRoleQuery()).isEqualTo(new RoleQuery("button", "Save"));
        assertThat(role.getWarnings()).isEmpty();
    }

    @Test(description = "An element without any attribute still gets its absolute XPath")
    public void testXPathFallback() {
        List<LocatorCandidate> candidates = generator.generate(byTag("div"));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getStrategy()).isEqualTo(Strategy.ABSOLUTE_XPATH);
        assertThat(candidates.get(0).getValue()).isEqualTo("/html[1]/body[1]/form[1]/div[1]");
    }

    // ── Uniqueness ────────────────────────────────────────────────────────

    @Test(description = "A class selector matching several elements is kept with a warning")
    public void testNonUniqueClassWarned() {
        LocatorCandidate cls = generator.generate(byText("Cancel")).stream()
                .filter(c -> c.getStrategy() == Strategy.CLASS)
                .findFirst().orElseThrow();

        assertThat(cls.getValue()).isEqualTo("button.btn");
        assertThat(cls.getWarnings()).containsExactly("Selector is not unique: matches 2 elements");
    }

    @Test(description = "A class selector with more classes than its siblings is unique")
    public void testUniqueClassNotWarned() {
        LocatorCandidate cls = generator.generate(byText("Save")).stream()
                .filter(c -> c.getStrategy() == Strategy.CLASS)
                .findFirst().orElseThrow();

        assertThat(cls.getValue()).isEqualTo("button.btn.primary");
        assertThat(cls.getWarnings()).isEmpty();
    }

    @Test(description = "Role names that only share a prefix stay unique under exact matching")
    public void testRoleNamePrefixIsUnique() {
        ElementModel m = new DomParser().parse("<button>Save</button><button>Save draft</button>");
        CandidateGenerator g = new CandidateGenerator(m, PipelineOptions.DEFAULT_IDENTIFYING_ATTRIBUTES);
        DomElement save = m.stream().filter(e -> "Save".equals(e.getText())).findFirst().orElseThrow();

        LocatorCandidate role = g.generate(save).stream()
                .filter(c -> c.getStrategy() == Strategy.ROLE)
                .findFirst().orElseThrow();

        assertThat(role.getValue()).isEqualTo("role=button[name=\"Save\"s]");
        assertThat(role.getWarnings()).isEmpty();
    }

    @Test(description = "Special characters in ids and attribute values are escaped")
    public void testEscaping() {
        ElementModel m = new DomParser().parse("<input id='user.name' name='a\"b'>");
        List<LocatorCandidate> candidates = new CandidateGenerator(m, List.of("name"))
                .generate(m.get(3));

        assertThat(candidates.get(0).getValue()).isEqualTo("#user\\.name");
        assertThat(candidates.get(1).getValue()).isEqualTo("[name=\"a\\\"b\"]");
    }

    // ── Custom names ──────────────────────────────────────────────────────

    @Test(description = "Custom names are camelCase with a tag suffix")
    public void testCustomNames() {
        assertThat(generator.generate(byText("Save")).get(0).getCustomName()).isEqualTo("saveButton");
        assertThat(generator.generate(byTag("input")).get(0).getCustomName()).isEqualTo("emailInput");
        assertThat(generator.generate(byTag("div")).get(0).getCustomName()).isEqualTo("divElement");
    }

    @Test(description = "camelCase keeps at most six words")
    public void testCamelCase() {
        assertThat(CustomNames.camelCase("Add to cart!")).isEqualTo("addToCart");
        assertThat(CustomNames.camelCase("one two three four five six seven"))
                .isEqualTo("oneTwoThreeFourFiveSix");
    }

    @Test(description = "id is never treated as an identifying attribute")
    public void testIdExcludedFromAttributes() {
        CandidateGenerator g = new CandidateGenerator(model, List.of("id", "name", "name"));

        assertThat(g.getIdentifyingAttributes()).containsExactly("name");
    }

    private DomElement byTag(String tag) {
        return model.stream().filter(e -> tag.equals(e.getTagName())).findFirst().orElseThrow();
    }

    private DomElement byText(String text) {
        return model.stream().filter(e -> text.equals(e.getText()) && "button".equals(e.getTagName()))
                .findFirst().orElseThrow();
    }
}
