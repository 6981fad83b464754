package io.pulse4j.pipeline;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered, fixed sequence of causally dependent steps.
 *
 * @param source value of the {@code source} field sent with every trigger
 */
public record PipelineSpec(
        String name,
        String source,
        List<PipelineStep> steps
) {
    public PipelineSpec {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("pipeline name must not be blank");
        }
        source = source == null || source.isBlank() ? name : source;
        Objects.requireNonNull(steps, "steps must not be null");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("pipeline must have at least one step: " + name);
        }
        steps = List.copyOf(steps);

        Set<String> seen = new HashSet<>();
        for (PipelineStep step : steps) {
            if (!seen.add(step.name())) {
                throw new IllegalArgumentException("Duplicate step name '" + step.name() + "' in pipeline: " + name);
            }
        }
    }

    public static PipelineSpec of(String name, List<PipelineStep> steps) {
        return new PipelineSpec(name, null, steps);
    }
}
