package uk.gegc.examforge.features.analytics.api.dto;

import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Breakdown of one paper within a summary. Percentages have one decimal.
 */
public record PaperAnalysis(
        UUID paperId,
        int totalMarks,
        int questionCount,
        double averageMarksPerQuestion,
        Instant createdAt,
        Instant updatedAt,
        Map<CognitiveLevel, Double> bloomsPercentages,
        Map<String, Double> difficultyPercentages,
        Map<QuestionCategory, Double> questionTypePercentages,
        Map<Provenance, Double> provenancePercentages,
        List<QuestionBreakdown> questions,
        List<String> recommendations
) {
    public record QuestionBreakdown(
            int number,
            QuestionCategory type,
            CognitiveLevel bloomsLevel,
            String difficulty,
            int marks,
            Provenance provenance,
            String unit
    ) {
    }
}
