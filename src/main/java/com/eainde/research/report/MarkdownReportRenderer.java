package com.eainde.research.report;

import com.eainde.research.model.Gap;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link Report} as Markdown with the six fixed section headings. Citation numbers
 * are read from the report, so rendering twice yields identical text.
 */
public class MarkdownReportRenderer {

    public static final List<String> SECTION_HEADINGS = List.of(
            "Executive Summary", "Key Findings", "Detailed Analysis",
            "Sources", "Confidence Statistics", "Research Gaps");

    public String render(Report report) {
        StringBuilder md = new StringBuilder();
        ReportMetadata meta = report.metadata();

        md.append("# Research Report: ").append(meta.query()).append("\n\n");
        md.append("_Depth: ").append(meta.depth().label())
                .append(" | Run: ").append(meta.runId())
                .append(" | Generated: ").append(meta.generatedAt()).append("_\n\n");
        if (meta.degraded()) {
            md.append("> **Degraded report:** no findings could be aggregated. See Research Gaps.\n\n");
        }

        heading(md, 0);
        ExecutiveSummary summary = report.executiveSummary();
        md.append(summary.summary()).append("\n\n");
        md.append("- Total sources: ").append(summary.totalSources()).append('\n');
        md.append("- Total claims: ").append(summary.totalClaims()).append("\n\n");

        heading(md, 1);
        if (report.keyFindings().isEmpty()) {
            md.append("_No findings._\n\n");
        }
        for (KeyFinding finding : report.keyFindings()) {
            md.append(finding.rank()).append(". **[").append(finding.marker()).append("]** ")
                    .append(finding.claim()).append(markers(finding.citations())).append('\n');
        }
        if (!report.keyFindings().isEmpty()) md.append('\n');

        heading(md, 2);
        if (report.detailedAnalysis().isEmpty()) {
            md.append("_No themes._\n\n");
        }
        for (ThemeSection section : report.detailedAnalysis()) {
            md.append("### ").append(section.theme()).append("\n\n");
            for (ThemedFinding finding : section.findings()) {
                md.append("- ").append(finding.claim()).append(markers(finding.citations()))
                        .append(" _(").append(finding.confidence().marker()).append(")_\n");
                if (finding.evidence() != null && !finding.evidence().isBlank()) {
                    md.append("  - Evidence: ").append(finding.evidence()).append('\n');
                }
            }
            md.append('\n');
        }

        heading(md, 3);
        for (SourceTier tier : report.sources()) {
            md.append("### ").append(capitalize(tier.tier())).append(" credibility (")
                    .append(tier.minCredibility() == tier.maxCredibility()
                            ? String.valueOf(tier.minCredibility())
                            : tier.maxCredibility() + "-" + tier.minCredibility())
                    .append(")\n\n");
            if (tier.sources().isEmpty()) {
                md.append("_None._\n\n");
                continue;
            }
            for (CitedSource source : tier.sources()) {
                md.append('[').append(source.number()).append("] ").append(source.title())
                        .append(". ").append(source.url())
                        .append(" (credibility ").append(source.credibility()).append(")\n");
            }
            md.append('\n');
        }

        heading(md, 4);
        ConfidenceStatistics stats = report.confidenceStatistics();
        md.append("| Level | Claims | Share |\n|---|---|---|\n");
        row(md, "High", stats.high());
        row(md, "Medium", stats.medium());
        row(md, "Low", stats.low());
        md.append('\n');
        md.append("- Total claims: ").append(stats.totalClaims()).append('\n');
        md.append("- Average source credibility: ")
                .append(String.format(Locale.ROOT, "%.2f", stats.averageSourceCredibility())).append('\n');
        md.append("- Total unique sources: ").append(stats.totalUniqueSources()).append("\n\n");

        heading(md, 5);
        if (report.researchGaps().isEmpty()) {
            md.append("- None recorded.\n");
        }
        for (Gap gap : report.researchGaps()) {
            md.append("- ").append(gap.description()).append('\n');
        }
        return md.toString();
    }

    private static void heading(StringBuilder md, int index) {
        md.append("## ").append(SECTION_HEADINGS.get(index)).append("\n\n");
    }

    private static void row(StringBuilder md, String label, LevelStatistic level) {
        md.append("| ").append(label).append(" | ").append(level.count()).append(" | ")
                .append(String.format(Locale.ROOT, "%.1f%%", level.percentage())).append(" |\n");
    }

    private static String markers(List<Integer> citations) {
        StringBuilder markers = new StringBuilder();
        citations.forEach(n -> markers.append('[').append(n).append(']'));
        return markers.length() == 0 ? "" : " " + markers;
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
