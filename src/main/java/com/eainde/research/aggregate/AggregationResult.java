package com.eainde.research.aggregate;

import com.eainde.research.model.Claim;
import com.eainde.research.model.Gap;
import com.eainde.research.model.Source;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the deduplicated claim/source registry handed to theming and composition.
 *
 * @param claims   deduplicated claims in aggregation order
 * @param sources  deduplicated sources in first-seen order
 * @param gaps     every gap recorded by the dispatcher, the aggregator and the workers
 * @param stats    pass counters
 * @param degraded {@code true} when no claim survived (every worker failed or found nothing)
 */
public record AggregationResult(
        List<Claim> claims,
        List<Source> sources,
        List<Gap> gaps,
        AggregationStats stats,
        boolean degraded
) implements Serializable {

    public AggregationResult {
        claims = List.copyOf(claims);
        sources = List.copyOf(sources);
        gaps = List.copyOf(gaps);
    }

    public Optional<Source> source(String url) {
        return sources.stream().filter(s -> s.url().equals(url)).findFirst();
    }
}
