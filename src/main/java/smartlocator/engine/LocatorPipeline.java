package smartlocator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.ai.EnrichmentAdapter;
import smartlocator.model.DomElement;
import smartlocator.model.ElementModel;
import smartlocator.model.ElementSuggestion;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorSummary;
import smartlocator.validation.LocatorValidator;
import smartlocator.validation.ValidationOutcome;
import smartlocator.validation.ValidationSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the locator phases over one parsed document:
 * <ol>
 *   <li>frequency context over the whole document (barrier)</li>
 *   <li>candidate generation per scanned element, on {@code parallelism} workers</li>
 *   <li>dynamic/duplicate detection, then scoring</li>
 *   <li>aggregation: framework tags, de-duplication, stability and framework filters</li>
 *   <li>optional live validation of the surviving candidates</li>
 *   <li>ranking and summary</li>
 *   <li>optional enrichment</li>
 * </ol>
 * Each phase finishes for every candidate before the next one starts.
 */
public class LocatorPipeline {

    private static final Logger log = LoggerFactory.getLogger(LocatorPipeline.class);

    private final PipelineOptions options;
    private final Aggregator      aggregator = new Aggregator();
    private final StabilityScorer scorer     = new StabilityScorer();

    private LocatorValidator  validator;
    private ValidationSession session;
    private EnrichmentAdapter enricher;
    private int               maxEnrichedElements = Integer.MAX_VALUE;

    public LocatorPipeline(PipelineOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    // ── Collaborators ─────────────────────────────────────────────────────

    /** Enables live validation of the surviving candidates. */
    public LocatorPipeline withValidation(LocatorValidator validator, ValidationSession session) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.session   = Objects.requireNonNull(session, "session");
        return this;
    }

    /** Enables enrichment for at most {@code maxElements} elements, in document order. */
    public LocatorPipeline withEnrichment(EnrichmentAdapter enricher, int maxElements) {
        this.enricher            = Objects.requireNonNull(enricher, "enricher");
        this.maxEnrichedElements = maxElements;
        return this;
    }

    public PipelineOptions getOptions() { return options; }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * @throws GenerationException if an element produced no candidate
     */
    public ScanResult run(ElementModel model) {
        List<String> attrs = options.identifyingAttributes();

        FrequencyContext frequencies = FrequencyContext.build(model, attrs);
        log.info("Frequency context built: {} distinct keys over {} elements",
                frequencies.distinctKeys(), model.size());

        List<DomElement> scanned = model.stream()
                .filter(el -> options.scope().includes(el, attrs))
                .collect(Collectors.toList());

        CandidateGenerator generator = new CandidateGenerator(model, attrs);
        List<List<LocatorCandidate>> perElement = generateAll(generator, scanned);
        log.info("Generated {} candidates for {} elements ({} scope)",
                perElement.stream().mapToInt(List::size).sum(), scanned.size(),
                options.scope().name().toLowerCase(Locale.ROOT));

        DynamicDuplicateDetector detector = new DynamicDuplicateDetector(frequencies, attrs);
        List<LocatorCandidate> all = new ArrayList<>();
        for (int i = 0; i < scanned.size(); i++) {
            detector.annotate(scanned.get(i), perElement.get(i));
            all.addAll(perElement.get(i));
        }
        scorer.annotate(all);

        aggregator.tagFrameworks(all);
        List<LocatorCandidate> survivors = aggregator.deduplicate(all);
        survivors = aggregator.filter(survivors, options.minStability());
        survivors = aggregator.selectFrameworks(survivors, options.frameworks());
        log.info("{} of {} candidates kept (min stability {}, frameworks {})",
                survivors.size(), all.size(), options.minStability(), options.frameworks());

        ValidationOutcome outcome = null;
        if (validator != null) {
            outcome = validator.validate(survivors, session);
        }

        List<LocatorCandidate> ranked = aggregator.rank(survivors);
        LocatorSummary summary = aggregator.summarize(ranked, scanned.size());

        List<ElementSuggestion> suggestions = enricher != null
                ? enrich(model, ranked)
                : List.of();

        return new ScanResult(model, scanned.size(), all, ranked, summary, outcome, suggestions);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    /** Per element generation, results in the order of {@code elements}. */
    private List<List<LocatorCandidate>> generateAll(CandidateGenerator generator, List<DomElement> elements) {
        if (options.parallelism() == 1 || elements.size() < 2) {
            return elements.stream().map(generator::generate).collect(Collectors.toList());
        }

        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(options.parallelism(), r -> {
            Thread t = new Thread(r, "smart-locator-gen-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<List<LocatorCandidate>>> futures = new ArrayList<>(elements.size());
            for (DomElement el : elements) {
                futures.add(pool.submit(() -> generator.generate(el)));
            }
            List<List<LocatorCandidate>> results = new ArrayList<>(elements.size());
            for (Future<List<LocatorCandidate>> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SmartLocatorException) throw (SmartLocatorException) cause;
            throw new GenerationException("Candidate generation failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted during candidate generation", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<ElementSuggestion> enrich(ElementModel model, List<LocatorCandidate> ranked) {
        Map<Integer, List<LocatorCandidate>> byElement = ranked.stream()
                .collect(Collectors.groupingBy(LocatorCandidate::getElementIndex,
                        LinkedHashMap::new, Collectors.toList()));

        List<ElementSuggestion> out = new ArrayList<>();
        int asked = 0;
        for (Map.Entry<Integer, List<LocatorCandidate>> e : byElement.entrySet()) {
            if (asked >= maxEnrichedElements) break;
            asked++;
            DomElement el = model.get(e.getKey());
            try {
                Optional<List<String>> result = enricher.enrich(el, e.getValue());
                result.filter(s -> !s.isEmpty()).ifPresent(s ->
                        out.add(new ElementSuggestion(e.getValue().get(0).getCustomName(), el.getIndex(), s)));
            } catch (RuntimeException ex) {
                log.warn("Enrichment failed for {}: {}", el, ex.getMessage());
            }
        }
        log.info("Enrichment produced suggestions for {} of {} elements", out.size(), asked);
        return out;
    }
}
