package smartlocator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Ordered, indexed and read-only view of a parsed document.
 *
 * <p>Elements are stored in document (pre-order) order and {@code get(i)}
 * returns the element whose {@link DomElement#getIndex()} is {@code i}.
 * Same-tag sibling positions are computed once at construction so XPath
 * building and parent/child/sibling lookups are constant time.
 */
public final class ElementModel {

    private final List<DomElement> elements;
    private final int[] sameTagPositions;

    public ElementModel(List<DomElement> elements) {
        this.elements = List.copyOf(elements);
        for (int i = 0; i < this.elements.size(); i++) {
            if (this.elements.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Element at position " + i
                        + " carries index " + this.elements.get(i).getIndex());
            }
        }
        this.sameTagPositions = computeSameTagPositions();
    }

    public int size() { return elements.size(); }

    public boolean isEmpty() { return elements.isEmpty(); }

    public DomElement get(int index) { return elements.get(index); }

    public List<DomElement> elements() { return elements; }

    public Stream<DomElement> stream() { return elements.stream(); }

    public Optional<DomElement> root() {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    public Optional<DomElement> parent(int index) {
        int p = elements.get(index).getParentIndex();
        return p == DomElement.NO_PARENT ? Optional.empty() : Optional.of(elements.get(p));
    }

    public List<DomElement> children(int index) {
        List<Integer> ids = elements.get(index).getChildIndices();
        List<DomElement> result = new ArrayList<>(ids.size());
        for (int id : ids) result.add(elements.get(id));
        return result;
    }

    /** Other children of the same parent, in document order. */
    public List<DomElement> siblings(int index) {
        int p = elements.get(index).getParentIndex();
        if (p == DomElement.NO_PARENT) return List.of();
        List<DomElement> result = new ArrayList<>();
        for (int id : elements.get(p).getChildIndices()) {
            if (id != index) result.add(elements.get(id));
        }
        return result;
    }

    /** 1-based position among same-tag siblings (XPath {@code tag[n]} semantics). */
    public int sameTagPosition(int index) {
        return sameTagPositions[index];
    }

    /** Nearest ancestor with the given tag, if any. */
    public Optional<DomElement> closestAncestor(int index, String tagName) {
        int p = elements.get(index).getParentIndex();
        while (p != DomElement.NO_PARENT) {
            DomElement candidate = elements.get(p);
            if (candidate.getTagName().equals(tagName)) return Optional.of(candidate);
            p = candidate.getParentIndex();
        }
        return Optional.empty();
    }

    /**
     * Absolute, fully indexed XPath from the document root,
     * e.g. {@code /html[1]/body[1]/form[1]/input[2]}.
     */
    public String absoluteXPath(int index) {
        List<String> parts = new ArrayList<>();
        int current = index;
        while (current != DomElement.NO_PARENT) {
            DomElement el = elements.get(current);
            parts.add(0, el.getTagName() + "[" + sameTagPositions[current] + "]");
            current = el.getParentIndex();
        }
        return "/" + String.join("/", parts);
    }

    /** Number of elements in the whole document satisfying {@code predicate}. */
    public int countMatching(Predicate<DomElement> predicate) {
        int count = 0;
        for (DomElement el : elements) {
            if (predicate.test(el)) count++;
        }
        return count;
    }

    private int[] computeSameTagPositions() {
        int[] positions = new int[elements.size()];
        for (DomElement el : elements) {
            int pos = 1;
            if (!el.isRoot()) {
                for (int sib : elements.get(el.getParentIndex()).getChildIndices()) {
                    if (sib == el.getIndex()) break;
                    if (elements.get(sib).getTagName().equals(el.getTagName())) pos++;
                }
            }
            positions[el.getIndex()] = pos;
        }
        return positions;
    }

    @Override
    public String toString() {
        return "ElementModel{elements=" + elements.size() + "}";
    }
}
