package smartlocator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.dom.AriaRoles;
import smartlocator.dom.CssEscaper;
import smartlocator.model.AttributeKey;
import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.RoleQuery;
import smartlocator.model.Strategy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Produces every viable locator candidate for an element, in priority order:
 * ID → identifying attribute → class → role → absolute XPath.
 *
 * <p>CSS and role candidates are counted against the whole
 * {@link ElementModel} with the selector's own matching semantics. A
 * candidate that does not address exactly one element is still emitted, with
 * a "not unique" warning, so the aggregator and the report can show it.
 *
 * <p>Role and class-set lookups are precomputed once per document; after
 * construction the generator is read-only and may be shared across threads.
 */
public class CandidateGenerator {

    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final ElementModel model;
    private final List<String> identifyingAttributes;
    private final List<Optional<RoleQuery>> roles;
    private final List<Set<String>> classSets;

    /**
     * @param model                 the parsed document
     * @param identifyingAttributes attributes tried by the attribute strategy, in order;
     *                              {@code id} is ignored here as it has its own strategy
     */
    public CandidateGenerator(ElementModel model, List<String> identifyingAttributes) {
        this.model = Objects.requireNonNull(model, "model");
        this.identifyingAttributes = identifyingAttributes.stream()
                .filter(a -> a != null && !a.isBlank() && !"id".equals(a))
                .distinct()
                .collect(Collectors.toUnmodifiableList());

        List<Optional<RoleQuery>> r = new ArrayList<>(model.size());
        List<Set<String>> c = new ArrayList<>(model.size());
        for (DomElement el : model.elements()) {
            r.add(AriaRoles.roleQuery(el, model));
            c.add(Set.copyOf(el.classes()));
        }
        this.roles = List.copyOf(r);
        this.classSets = List.copyOf(c);
    }

    /**
     * Generates all candidates for {@code el}.
     *
     * @return at least one candidate, the absolute XPath always being last
     * @throws GenerationException if no candidate could be built
     */
    public List<LocatorCandidate> generate(DomElement el) {
        String customName = CustomNames.guess(el);
        List<LocatorCandidate> out = new ArrayList<>();

        // 1. ID
        if (el.hasValue("id")) {
            String id = el.attribute("id");
            LocatorCandidate c = LocatorCandidate.attributeBased(el.getIndex(), Strategy.ID,
                    "#" + CssEscaper.identifier(id), AttributeKey.of("id", id), customName);
            warnIfNotUnique(c, model.countMatching(e -> id.equals(e.attribute("id"))));
            out.add(c);
        }

        // 2. Identifying attributes
        for (String attr : identifyingAttributes) {
            if (!el.hasValue(attr)) continue;
            String value = el.attribute(attr);
            String selector = "[" + CssEscaper.identifier(attr) + "=" + CssEscaper.quoted(value) + "]";
            LocatorCandidate c = LocatorCandidate.attributeBased(el.getIndex(), Strategy.ATTRIBUTE,
                    selector, AttributeKey.of(attr, value), customName);
            warnIfNotUnique(c, model.countMatching(e -> value.equals(e.attribute(attr))));
            out.add(c);
        }

        // 3. Tag + class list
        List<String> classes = el.classes();
        if (!classes.isEmpty()) {
            String selector = el.getTagName() + classes.stream()
                    .map(cls -> "." + CssEscaper.identifier(cls))
                    .collect(Collectors.joining());
            Set<String> wanted = new HashSet<>(classes);
            String tag = el.getTagName();
            LocatorCandidate c = LocatorCandidate.attributeBased(el.getIndex(), Strategy.CLASS, selector,
                    AttributeKey.classList(tag, el.normalizedClassList()), customName);
            warnIfNotUnique(c, countIndices(i ->
                    tag.equals(model.get(i).getTagName()) && classSets.get(i).containsAll(wanted)));
            out.add(c);
        }

        // 4. Role + accessible name
        Optional<RoleQuery> role = roles.get(el.getIndex());
        if (role.isPresent()) {
            RoleQuery q = role.get();
            LocatorCandidate c = LocatorCandidate.role(el.getIndex(), AriaRoles.selector(q), q, customName);
            warnIfNotUnique(c, countIndices(i -> roles.get(i).filter(q::equals).isPresent()));
            out.add(c);
        }

        // 5. Absolute XPath, always
        String xpath = model.absoluteXPath(el.getIndex());
        if (xpath == null || xpath.isEmpty()) {
            throw new GenerationException("No locator candidate produced for " + el);
        }
        out.add(LocatorCandidate.absoluteXPath(el.getIndex(), xpath, customName));
        log.debug("Generated {} candidates for {}", out.size(), el);
        return out;
    }

    public List<String> getIdentifyingAttributes() {
        return identifyingAttributes;
    }

    private int countIndices(Predicate<Integer> predicate) {
        int count = 0;
        for (int i = 0; i < model.size(); i++) {
            if (predicate.test(i)) count++;
        }
        return count;
    }

    private static void warnIfNotUnique(LocatorCandidate c, int matches) {
        if (matches != 1) {
            c.addWarning("Selector is not unique: matches " + matches + " elements");
        }
    }
}
