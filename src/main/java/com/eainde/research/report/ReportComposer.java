package com.eainde.research.report;

import com.eainde.research.aggregate.AggregationResult;
import com.eainde.research.model.Claim;
import com.eainde.research.model.ConfidenceLevel;
import com.eainde.research.model.ResearchQuery;
import com.eainde.research.model.Source;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.Theme;
import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes the final {@link Report} from the aggregate and its themes.
 *
 * <h3>Citation numbering:</h3>
 * <pre>
 * tiers:       5–4, then 3, then 2–1
 * within tier: credibility ↓, then registry order
 * numbers:     1..n in that order, assigned once
 * </pre>
 * Every finding refers to sources by these numbers only.
 *
 * <h3>Key findings:</h3>
 * confidence (high first), then citation count ↓, then aggregation order, capped at
 * {@code keyFindingsLimit}.
 */
@Log4j2
public class ReportComposer {

    private static final Comparator<Claim> KEY_FINDING_ORDER = Comparator
            .comparing(Claim::confidence)
            .thenComparing(Comparator.comparingInt((Claim c) -> c.citationUrls().size()).reversed())
            .thenComparingInt(Claim::index);

    private final int keyFindingsLimit;
    private final Clock clock;

    public ReportComposer(int keyFindingsLimit, Clock clock) {
        if (keyFindingsLimit < 1) throw new IllegalArgumentException("keyFindingsLimit must be >= 1");
        this.keyFindingsLimit = keyFindingsLimit;
        this.clock = clock;
    }

    public Report compose(ResearchQuery query,
                          String runId,
                          List<Subtopic> subtopics,
                          AggregationResult aggregate,
                          List<Theme> themes) {
        List<SourceTier> tiers = tierSources(aggregate.sources());
        Map<String, Integer> numbers = new HashMap<>();
        tiers.forEach(tier -> tier.sources().forEach(s -> numbers.put(s.url(), s.number())));

        List<KeyFinding> keyFindings = keyFindings(aggregate.claims(), numbers);
        List<ThemeSection> sections = themes.stream().map(t -> section(t, numbers)).toList();
        ConfidenceStatistics statistics = statistics(aggregate.claims(), aggregate.sources());

        ReportMetadata metadata = new ReportMetadata(query.text(), query.depth(), runId,
                clock.instant().toString(), aggregate.degraded(), subtopics, aggregate.stats());
        ExecutiveSummary summary = summary(query, subtopics, aggregate, themes, statistics);

        log.info("Composed report: {} key findings, {} themes, {} sources, {} gaps{}",
                keyFindings.size(), sections.size(), aggregate.sources().size(),
                aggregate.gaps().size(), aggregate.degraded() ? " (degraded)" : "");
        return new Report(metadata, summary, keyFindings, sections, tiers, statistics, aggregate.gaps());
    }

    static List<SourceTier> tierSources(List<Source> sources) {
        int[][] bands = {{4, 5}, {3, 3}, {1, 2}};
        String[] names = {"high", "medium", "low"};
        List<SourceTier> tiers = new ArrayList<>(bands.length);
        int next = 1;
        for (int b = 0; b < bands.length; b++) {
            int min = bands[b][0];
            int max = bands[b][1];
            List<Source> members = sources.stream()
                    .filter(s -> s.credibility() >= min && s.credibility() <= max)
                    .sorted(Comparator.comparingInt(Source::credibility).reversed()
                            .thenComparingInt(Source::registryIndex))
                    .toList();
            List<CitedSource> cited = new ArrayList<>(members.size());
            for (Source s : members) {
                cited.add(new CitedSource(next++, s.url(), s.title(), s.domain(), s.credibility(),
                        s.relevanceNotes(), s.relatedUrls()));
            }
            tiers.add(new SourceTier(names[b], min, max, cited));
        }
        return tiers;
    }

    private List<KeyFinding> keyFindings(List<Claim> claims, Map<String, Integer> numbers) {
        List<Claim> ranked = claims.stream().sorted(KEY_FINDING_ORDER).limit(keyFindingsLimit).toList();
        List<KeyFinding> findings = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Claim claim = ranked.get(i);
            findings.add(new KeyFinding(i + 1, claim.text(), claim.confidence(),
                    claim.confidence().marker(), citationNumbers(claim, numbers)));
        }
        return findings;
    }

    private static ThemeSection section(Theme theme, Map<String, Integer> numbers) {
        List<ThemedFinding> findings = theme.claims().stream()
                .map(c -> new ThemedFinding(c.text(), c.evidence(), c.confidence(),
                        citationNumbers(c, numbers), c.subtopicIds()))
                .toList();
        return new ThemeSection(theme.title(), theme.highCount(), theme.mediumCount(), theme.lowCount(),
                theme.distinctSources(), findings);
    }

    private static List<Integer> citationNumbers(Claim claim, Map<String, Integer> numbers) {
        return claim.citationUrls().stream()
                .map(numbers::get)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
    }

    static ConfidenceStatistics statistics(List<Claim> claims, List<Source> sources) {
        int total = claims.size();
        Map<ConfidenceLevel, Integer> counts = new HashMap<>();
        claims.forEach(c -> counts.merge(c.confidence(), 1, Integer::sum));

        double average = sources.stream().mapToInt(Source::credibility).average().orElse(0.0);
        return new ConfidenceStatistics(total,
                level(counts.getOrDefault(ConfidenceLevel.HIGH, 0), total),
                level(counts.getOrDefault(ConfidenceLevel.MEDIUM, 0), total),
                level(counts.getOrDefault(ConfidenceLevel.LOW, 0), total),
                round(average, 2),
                sources.size());
    }

    private static LevelStatistic level(int count, int total) {
        double percentage = total == 0 ? 0.0 : round(100.0 * count / total, 1);
        return new LevelStatistic(count, percentage);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static ExecutiveSummary summary(ResearchQuery query,
                                            List<Subtopic> subtopics,
                                            AggregationResult aggregate,
                                            List<Theme> themes,
                                            ConfidenceStatistics statistics) {
        int claims = aggregate.claims().size();
        int sources = aggregate.sources().size();
        int high = statistics.high().count();
        String text;
        if (aggregate.degraded()) {
            text = String.format("No findings could be aggregated for \"%s\" across %d subtopics. "
                            + "%d gaps were recorded; see Research Gaps.",
                    query.text(), subtopics.size(), aggregate.gaps().size());
        } else {
            text = String.format("Research on \"%s\" (%s depth, %d subtopics) produced %d claims from %d unique sources, "
                            + "grouped into %d themes. %d claims are high confidence.",
                    query.text(), query.depth().label(), subtopics.size(), claims, sources, themes.size(), high);
            if (!aggregate.gaps().isEmpty()) {
                text += String.format(" %d research gaps were recorded.", aggregate.gaps().size());
            }
        }
        return new ExecutiveSummary(text, sources, claims, themes.size(), high);
    }
}
