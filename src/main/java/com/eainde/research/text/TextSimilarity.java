package com.eainde.research.text;

/**
 * Normalized textual similarity on a 0–1 scale. Implementations must be symmetric and
 * deterministic.
 */
public interface TextSimilarity {

    double score(String left, String right);
}
