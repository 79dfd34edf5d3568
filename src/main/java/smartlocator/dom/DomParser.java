package smartlocator.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.engine.SmartLocatorException;
import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds an {@link ElementModel} from HTML markup with jsoup's lenient parser.
 *
 * <p>Malformed markup is recovered the way browsers do (unclosed tags closed,
 * stray end tags dropped, implied {@code html/head/body} inserted). Only input
 * that is blank or contains no tag at all is rejected with a
 * {@link ParseException}.
 */
public class DomParser {

    private static final Logger log = LoggerFactory.getLogger(DomParser.class);

    /** Something that opens a tag, comment or doctype. */
    private static final Pattern MARKUP = Pattern.compile("<\\s*[A-Za-z!?/]");

    private static final Set<String> LABELLABLE = Set.of("input", "select", "textarea");

    /** Visible text is cut at this length, as long names make poor locators anyway. */
    static final int MAX_TEXT_LENGTH = 200;

    /**
     * Parses {@code markup} into an immutable element model.
     *
     * @param markup raw HTML
     * @return the model, elements numbered in document order from {@code html}
     * @throws ParseException if the input is blank or contains no markup
     */
    public ElementModel parse(String markup) {
        if (markup == null || markup.isBlank()) {
            throw new ParseException("Input is empty, nothing to parse");
        }
        if (!MARKUP.matcher(markup).find()) {
            throw new ParseException("Input is not markup: '" + SmartLocatorException.preview(markup) + "'");
        }

        Document doc;
        try {
            doc = Jsoup.parse(markup);
        } catch (RuntimeException e) {
            throw new ParseException("jsoup could not parse input '"
                    + SmartLocatorException.preview(markup) + "': " + e.getMessage(), e);
        }

        // Pre-order, skipping the Document node itself
        List<Element> ordered = new ArrayList<>();
        for (Element el : doc.getAllElements()) {
            if (!(el instanceof Document)) ordered.add(el);
        }
        if (ordered.isEmpty()) {
            throw new ParseException("Document has no elements: '" + SmartLocatorException.preview(markup) + "'");
        }

        Map<Element, Integer> indexOf = new IdentityHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            indexOf.put(ordered.get(i), i);
        }
        Map<String, String> labelsByFor = collectLabelsByFor(doc);

        List<DomElement> elements = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Element el = ordered.get(i);
            Integer parent = el.parent() == null ? null : indexOf.get(el.parent());

            List<Integer> children = new ArrayList<>(el.childrenSize());
            for (Element child : el.children()) {
                children.add(indexOf.get(child));
            }

            elements.add(new DomElement(
                    i,
                    el.normalName(),
                    attributesOf(el),
                    visibleText(el),
                    labelText(el, labelsByFor),
                    parent == null ? DomElement.NO_PARENT : parent,
                    children));
        }

        ElementModel model = new ElementModel(elements);
        log.debug("Parsed {} elements from {} chars of markup", model.size(), markup.length());
        return model;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private static Map<String, String> attributesOf(Element el) {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (Attribute a : el.attributes()) {
            // jsoup keeps the first of duplicate names, which matches browsers
            attrs.putIfAbsent(a.getKey(), a.getValue());
        }
        return attrs;
    }

    private static String visibleText(Element el) {
        String text = "input".equals(el.normalName()) ? el.attr("value") : el.text();
        return truncate(normalize(text));
    }

    private static String labelText(Element el, Map<String, String> labelsByFor) {
        if (!LABELLABLE.contains(el.normalName())) return "";
        String id = el.id();
        if (!id.isEmpty() && labelsByFor.containsKey(id)) {
            return labelsByFor.get(id);
        }
        for (Element ancestor : el.parents()) {
            if ("label".equals(ancestor.normalName())) {
                return truncate(normalize(ancestor.text()));
            }
        }
        return "";
    }

    private static Map<String, String> collectLabelsByFor(Document doc) {
        Map<String, String> result = new HashMap<>();
        Elements labels = doc.select("label[for]");
        for (Element label : labels) {
            // first label wins, as for the browser's label activation
            result.putIfAbsent(label.attr("for"), truncate(normalize(label.text())));
        }
        return result;
    }

    static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }
}
