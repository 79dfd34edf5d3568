package smartlocator.engine;

import smartlocator.model.Framework;
import smartlocator.model.MinStability;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of one pipeline run.
 *
 * @param minStability          lowest stability label kept in the report
 * @param frameworks            frameworks the report is generated for; never empty
 * @param scope                 which elements enter candidate generation
 * @param identifyingAttributes attributes besides {@code id} that identify an element, in priority order
 * @param parallelism           worker threads for candidate generation; 1 runs inline
 */
public record PipelineOptions(MinStability minStability,
                              Set<Framework> frameworks,
                              ScanScope scope,
                              List<String> identifyingAttributes,
                              int parallelism) {

    public static final List<String> DEFAULT_IDENTIFYING_ATTRIBUTES =
            List.of("name", "data-testid", "data-test", "data-test-id", "data-qa", "data-cy");

    public PipelineOptions {
        Objects.requireNonNull(minStability, "minStability");
        Objects.requireNonNull(scope, "scope");
        if (frameworks == null || frameworks.isEmpty()) {
            throw new IllegalArgumentException("At least one framework is required");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        frameworks = Collections.unmodifiableSet(EnumSet.copyOf(frameworks));
        identifyingAttributes = identifyingAttributes == null
                ? DEFAULT_IDENTIFYING_ATTRIBUTES
                : identifyingAttributes.stream()
                        .filter(a -> a != null && !a.isBlank())
                        .map(String::trim)
                        .distinct()
                        .collect(Collectors.toUnmodifiableList());
    }

    /** All labels, both frameworks, every element, default attributes, one thread per core. */
    public static PipelineOptions defaults() {
        return new PipelineOptions(MinStability.ALL, EnumSet.allOf(Framework.class), ScanScope.ALL,
                DEFAULT_IDENTIFYING_ATTRIBUTES, Runtime.getRuntime().availableProcessors());
    }

    public PipelineOptions withMinStability(MinStability min) {
        return new PipelineOptions(min, frameworks, scope, identifyingAttributes, parallelism);
    }

    public PipelineOptions withFrameworks(Set<Framework> selected) {
        return new PipelineOptions(minStability, selected, scope, identifyingAttributes, parallelism);
    }

    public PipelineOptions withScope(ScanScope newScope) {
        return new PipelineOptions(minStability, frameworks, newScope, identifyingAttributes, parallelism);
    }

    public PipelineOptions withIdentifyingAttributes(List<String> attributes) {
        return new PipelineOptions(minStability, frameworks, scope, attributes, parallelism);
    }

    public PipelineOptions withParallelism(int threads) {
        return new PipelineOptions(minStability, frameworks, scope, identifyingAttributes, threads);
    }
}
