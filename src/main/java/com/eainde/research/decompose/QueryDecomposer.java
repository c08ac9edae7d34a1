package com.eainde.research.decompose;

import com.eainde.research.model.Depth;
import com.eainde.research.model.Subtopic;
import com.eainde.research.text.TextTokens;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a query into {@code depth.subtopicCount()} non-overlapping, coverage-complete subtopics.
 *
 * <h3>Algorithm:</h3>
 * <pre>
 * focus    = content words of the query          (empty → InsufficientScope)
 * angles   = first N angles of the catalog       (current state, limitations, applications lead)
 * keywords = [focus phrase] + angle keywords not already implied by the focus
 *            (an angle left with fewer than 2 keywords → InsufficientScope)
 * validate = pairwise keyword overlap ≤ bound    (violation → InsufficientScope)
 * </pre>
 *
 * <p>Every subtopic carries the focus phrase, so the set jointly covers the query; the angle
 * keywords are disjoint across angles, so subtopics only share that phrase.</p>
 */
@Log4j2
public class QueryDecomposer {

    static final int MIN_ANGLE_KEYWORDS = 2;
    static final int MAX_FOCUS_WORDS = 6;

    private final int keywordOverlapBound;

    /**
     * @param keywordOverlapBound maximum number of keywords two subtopics may share (at least 1,
     *                            since every subtopic carries the focus phrase)
     */
    public QueryDecomposer(int keywordOverlapBound) {
        if (keywordOverlapBound < 1) {
            throw new IllegalArgumentException("keywordOverlapBound must be >= 1");
        }
        this.keywordOverlapBound = keywordOverlapBound;
    }

    public List<Subtopic> decompose(String query, Depth depth) {
        try {
            List<Subtopic> subtopics = build(query, depth);
            log.info("Decomposed query into {} subtopics ({})", subtopics.size(), depth.label());
            return subtopics;
        } catch (ScopeViolation violation) {
            Depth suggestion = findWorkingDepth(query, depth.shallower());
            log.warn("Query cannot be split at depth {}: {}", depth.label(), violation.getMessage());
            throw new InsufficientScopeException(violation.getMessage(), depth, suggestion);
        }
    }

    private Depth findWorkingDepth(String query, Depth candidate) {
        for (Depth d = candidate; d != null; d = d.shallower()) {
            try {
                build(query, d);
                return d;
            } catch (ScopeViolation violation) {
                log.debug("Depth {} does not decompose either: {}", d.label(), violation.getMessage());
            }
        }
        return null;
    }

    private List<Subtopic> build(String query, Depth depth) {
        List<String> focusWords = TextTokens.words(query);
        if (focusWords.isEmpty()) {
            throw new ScopeViolation("query '" + query + "' has no searchable terms");
        }
        List<String> focus = focusWords.subList(0, Math.min(MAX_FOCUS_WORDS, focusWords.size()));
        String focusPhrase = String.join(" ", focus);
        Set<String> focusTokens = TextTokens.contentTokens(focusPhrase);
        String subject = subjectOf(query);

        ResearchAngle[] catalog = ResearchAngle.values();
        int count = depth.subtopicCount();
        if (count > catalog.length) {
            throw new ScopeViolation("only " + catalog.length + " research angles are available");
        }

        List<Subtopic> subtopics = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ResearchAngle angle = catalog[i];
            List<String> keywords = new ArrayList<>();
            keywords.add(focusPhrase);
            for (String keyword : angle.keywords()) {
                if (!focusTokens.containsAll(TextTokens.contentTokens(keyword))) {
                    keywords.add(keyword);
                }
            }
            if (keywords.size() - 1 < MIN_ANGLE_KEYWORDS) {
                throw new ScopeViolation("the query already is the '" + angle.label()
                        + "' angle, so that subtopic would duplicate every other one");
            }
            subtopics.add(new Subtopic(i + 1, angle.titleFor(subject), keywords,
                    angle.label(), angle.rationale()));
        }

        validate(subtopics);
        return List.copyOf(subtopics);
    }

    private void validate(List<Subtopic> subtopics) {
        Set<String> angles = new HashSet<>();
        subtopics.forEach(s -> angles.add(s.angle()));
        for (ResearchAngle mandatory : ResearchAngle.MANDATORY) {
            if (!angles.contains(mandatory.label())) {
                throw new ScopeViolation("decomposition lacks the mandatory '" + mandatory.label() + "' angle");
            }
        }
        for (int i = 0; i < subtopics.size(); i++) {
            for (int j = i + 1; j < subtopics.size(); j++) {
                int overlap = keywordOverlap(subtopics.get(i), subtopics.get(j));
                if (overlap > keywordOverlapBound) {
                    throw new ScopeViolation("subtopics '" + subtopics.get(i).title() + "' and '"
                            + subtopics.get(j).title() + "' share " + overlap
                            + " keywords (bound " + keywordOverlapBound + ")");
                }
            }
        }
    }

    /**
     * Number of keywords one subtopic shares with the other: identical keywords, or keywords
     * whose every content token already appears among the other's keywords. Symmetric (max of
     * both directions).
     */
    public static int keywordOverlap(Subtopic a, Subtopic b) {
        return Math.max(directedOverlap(a, b), directedOverlap(b, a));
    }

    private static int directedOverlap(Subtopic from, Subtopic to) {
        Set<String> toKeywords = new HashSet<>();
        Set<String> toTokens = new HashSet<>();
        for (String keyword : to.keywords()) {
            toKeywords.add(keyword.toLowerCase(Locale.ROOT));
            toTokens.addAll(TextTokens.contentTokens(keyword));
        }
        int shared = 0;
        for (String keyword : from.keywords()) {
            Set<String> tokens = TextTokens.contentTokens(keyword);
            if (toKeywords.contains(keyword.toLowerCase(Locale.ROOT))
                    || (!tokens.isEmpty() && toTokens.containsAll(tokens))) {
                shared++;
            }
        }
        return shared;
    }

    private static String subjectOf(String query) {
        String subject = query.trim();
        while (!subject.isEmpty() && "?.!".indexOf(subject.charAt(subject.length() - 1)) >= 0) {
            subject = subject.substring(0, subject.length() - 1).trim();
        }
        return subject;
    }

    /** Internal signal that one decomposition attempt violated an invariant. */
    private static final class ScopeViolation extends RuntimeException {
        ScopeViolation(String message) {
            super(message);
        }
    }
}
