package uk.gegc.examforge.features.distribution.domain.model;

import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Realized distribution of a question list. Every grouping partitions the same list, so each
 * map's values sum to {@code totalQuestions}. Maps iterate in enum declaration order.
 */
public record DistributionSummary(
        int totalQuestions,
        int totalMarks,
        Map<QuestionCategory, Integer> byCategory,
        Map<QuestionCategory, Integer> marksByCategory,
        Map<CognitiveLevel, Integer> byCognitiveLevel,
        Map<Provenance, Integer> byProvenance,
        Map<CognitiveLevel, Map<Provenance, Integer>> byCognitiveLevelAndProvenance
) {
    public static final DistributionSummary EMPTY =
            new DistributionSummary(0, 0, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    public DistributionSummary {
        byCategory = ordered(byCategory);
        marksByCategory = ordered(marksByCategory);
        byCognitiveLevel = ordered(byCognitiveLevel);
        byProvenance = ordered(byProvenance);
        Map<CognitiveLevel, Map<Provenance, Integer>> pairs = new TreeMap<>();
        if (byCognitiveLevelAndProvenance != null) {
            byCognitiveLevelAndProvenance.forEach((level, counts) -> pairs.put(level, ordered(counts)));
        }
        byCognitiveLevelAndProvenance = Collections.unmodifiableMap(pairs);
    }

    private static <K extends Comparable<K>> Map<K, Integer> ordered(Map<K, Integer> source) {
        return source == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
