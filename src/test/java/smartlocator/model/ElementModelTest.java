package smartlocator.model;

import org.testng.annotations.Test;
import smartlocator.dom.DomParser;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ElementModel} and {@link DomElement}.
 */
public class ElementModelTest {

    private static final String FORM =
            "<form id='login'><input name='user'><span>hint</span><input name='pass'>"
            + "<button class='btn  primary btn'>Go</button></form>";

    private final ElementModel model = new DomParser().parse(FORM);

    @Test(description = "Absolute XPath indexes every step among same-tag siblings")
    public void testAbsoluteXPath() {
        int pass = indexOf("pass");

        assertThat(model.absoluteXPath(pass)).isEqualTo("/html[1]/body[1]/form[1]/input[2]");
        assertThat(model.absoluteXPath(0)).isEqualTo("/html[1]");
    }

    @Test(description = "sameTagPosition counts only earlier siblings with the same tag")
    public void testSameTagPosition() {
        assertThat(model.sameTagPosition(indexOf("user"))).isEqualTo(1);
        assertThat(model.sameTagPosition(indexOf("pass"))).isEqualTo(2);
    }

    @Test(description = "Parent, children and siblings navigate by index")
    public void testNavigation() {
        int form = model.stream().filter(e -> "form".equals(e.getTagName())).findFirst().orElseThrow().getIndex();
        int user = indexOf("user");

        assertThat(model.parent(user)).hasValueSatisfying(p -> assertThat(p.getIndex()).isEqualTo(form));
        assertThat(model.children(form).stream().map(DomElement::getTagName).collect(Collectors.toList()))
                .containsExactly("input", "span", "input", "button");
        assertThat(model.siblings(user)).hasSize(3).noneMatch(e -> e.getIndex() == user);
        assertThat(model.parent(0)).isEmpty();
        assertThat(model.closestAncestor(user, "form")).isPresent();
        assertThat(model.closestAncestor(user, "table")).isEmpty();
    }

    @Test(description = "Class tokens drop duplicates; the normalized list is sorted")
    public void testClasses() {
        DomElement button = model.stream().filter(e -> "button".equals(e.getTagName())).findFirst().orElseThrow();

        assertThat(button.classes()).containsExactly("btn", "primary");
        assertThat(button.normalizedClassList()).isEqualTo("btn primary");
    }

    @Test(description = "Element views are unmodifiable")
    public void testImmutability() {
        DomElement el = model.get(indexOf("user"));

        assertThatThrownBy(() -> el.getAttributes().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> model.elements().add(el))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test(description = "A model whose indices do not match positions is rejected")
    public void testIndexMismatchRejected() {
        DomElement stray = new DomElement(3, "div", Map.of(), "", "", DomElement.NO_PARENT, List.of());

        assertThatThrownBy(() -> new ElementModel(List.of(stray)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private int indexOf(String name) {
        return model.stream().filter(e -> name.equals(e.attribute("name"))).findFirst().orElseThrow().getIndex();
    }
}
