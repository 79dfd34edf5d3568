package smartlocator.ai;

import smartlocator.model.DomElement;
import smartlocator.model.LocatorCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Optional source of extra locator suggestions for one element.
 *
 * <p>An empty result, or any runtime exception, only means the element gets
 * no suggestions; the scan itself never fails because of enrichment.
 */
@FunctionalInterface
public interface EnrichmentAdapter {

    Optional<List<String>> enrich(DomElement element, List<LocatorCandidate> candidates);
}
