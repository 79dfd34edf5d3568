package smartlocator.engine;

import smartlocator.model.ElementModel;
import smartlocator.model.ElementSuggestion;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorSummary;
import smartlocator.validation.ValidationOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produced.
 *
 * @param model             the parsed document
 * @param scannedElements   elements that entered candidate generation
 * @param allCandidates     every scored candidate, before aggregation, in generation order
 * @param locators          the aggregated, ranked candidates
 * @param summary           counts over {@code locators}
 * @param validation        validation totals, or {@code null} when validation did not run
 * @param suggestions       enrichment output; empty without an adapter
 */
public record ScanResult(ElementModel model,
                         int scannedElements,
                         List<LocatorCandidate> allCandidates,
                         List<LocatorCandidate> locators,
                         LocatorSummary summary,
                         ValidationOutcome validation,
                         List<ElementSuggestion> suggestions) {

    public ScanResult {
        allCandidates = List.copyOf(allCandidates);
        locators      = List.copyOf(locators);
        suggestions   = List.copyOf(suggestions);
    }

    public Optional<ValidationOutcome> validationOutcome() {
        return Optional.ofNullable(validation);
    }

    public boolean isValidated() {
        return validation != null && !validation.isAborted();
    }
}
