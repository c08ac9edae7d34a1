package com.eainde.research.decompose;

import java.util.List;

/**
 * Catalog of research angles, in the order they are handed out. The first three are
 * mandatory for every decomposition. Angle keywords are disjoint across angles, so two
 * subtopics only share the query's own focus phrase.
 */
enum ResearchAngle {

    CURRENT_STATE("current state", "Current state of %s",
            "Establishes where the field stands today and how widely it is adopted.",
            List.of("current state", "latest developments", "adoption")),

    LIMITATIONS("limitations", "Limitations and open problems of %s",
            "Surfaces known weaknesses so findings are not one-sided.",
            List.of("limitations", "challenges", "failure modes")),

    PRACTICAL_APPLICATIONS("practical applications", "Practical applications of %s",
            "Grounds the research in real deployments and concrete use.",
            List.of("practical applications", "use cases", "deployments")),

    TECHNICAL_FOUNDATIONS("technical foundations", "How %s works",
            "Explains the mechanisms the other facets depend on.",
            List.of("architecture", "underlying mechanisms", "design principles")),

    FUTURE_OUTLOOK("future outlook", "Future outlook for %s",
            "Captures direction of travel and announced plans.",
            List.of("future outlook", "roadmap", "emerging trends")),

    HISTORY("history", "History and evolution of %s",
            "Provides context for why the current state looks the way it does.",
            List.of("history", "origins", "evolution")),

    KEY_PLAYERS("key players", "Key players in %s",
            "Identifies who builds, funds and shapes the field.",
            List.of("key players", "vendors", "leading organizations")),

    ALTERNATIVES("alternatives", "Alternatives to %s",
            "Positions the topic against competing approaches.",
            List.of("alternatives", "comparison", "trade-offs")),

    ECONOMICS("economics", "Economics of %s",
            "Covers cost, market size and business impact.",
            List.of("cost", "market size", "business impact")),

    GOVERNANCE("governance and risk", "Regulation, ethics and risk around %s",
            "Covers regulatory, ethical and security exposure.",
            List.of("regulation", "ethics", "security risks"));

    static final List<ResearchAngle> MANDATORY = List.of(CURRENT_STATE, LIMITATIONS, PRACTICAL_APPLICATIONS);

    private final String label;
    private final String titleTemplate;
    private final String rationale;
    private final List<String> keywords;

    ResearchAngle(String label, String titleTemplate, String rationale, List<String> keywords) {
        this.label = label;
        this.titleTemplate = titleTemplate;
        this.rationale = rationale;
        this.keywords = keywords;
    }

    String label() {
        return label;
    }

    String titleFor(String subject) {
        return String.format(titleTemplate, subject);
    }

    String rationale() {
        return rationale;
    }

    List<String> keywords() {
        return keywords;
    }
}
