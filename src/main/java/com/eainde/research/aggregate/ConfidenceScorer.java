package com.eainde.research.aggregate;

import com.eainde.research.model.ConfidenceLevel;
import com.eainde.research.model.Source;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a claim's confidence from its final citation set. Pure: the same set always yields
 * the same level.
 *
 * <pre>
 * ≥2 independent sources, each credibility ≥3               → HIGH
 * any source credibility ≥3 (no independent strong pair)    → MEDIUM
 * ≥2 sources, all credibility &lt;3                          → MEDIUM
 * exactly 1 source, credibility ≤2                          → LOW
 * no sources                                                → LOW
 * </pre>
 */
public class ConfidenceScorer {

    static final int STRONG_CREDIBILITY = 3;

    private final SourceIndependence independence;

    public ConfidenceScorer(SourceIndependence independence) {
        this.independence = independence;
    }

    public ConfidenceLevel score(Collection<Source> citations) {
        Map<String, Source> distinct = new LinkedHashMap<>();
        for (Source source : citations) {
            distinct.putIfAbsent(source.url(), source);
        }
        if (distinct.isEmpty()) {
            return ConfidenceLevel.LOW;
        }

        List<Source> strong = new ArrayList<>();
        for (Source source : distinct.values()) {
            if (source.credibility() >= STRONG_CREDIBILITY) strong.add(source);
        }
        for (int i = 0; i < strong.size(); i++) {
            for (int j = i + 1; j < strong.size(); j++) {
                if (independence.independent(strong.get(i), strong.get(j))) {
                    return ConfidenceLevel.HIGH;
                }
            }
        }
        if (!strong.isEmpty() || distinct.size() >= 2) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }
}
