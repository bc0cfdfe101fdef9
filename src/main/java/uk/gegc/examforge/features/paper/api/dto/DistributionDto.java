package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

import java.util.Map;

@Schema(description = "Realized distribution of a paper's questions")
public record DistributionDto(
        int totalQuestions,
        int totalMarks,
        Map<QuestionCategory, Integer> byCategory,
        Map<QuestionCategory, Integer> marksByCategory,
        Map<CognitiveLevel, Integer> byCognitiveLevel,
        Map<Provenance, Integer> byProvenance,
        Map<CognitiveLevel, Map<Provenance, Integer>> byCognitiveLevelAndProvenance,
        @Schema(description = "Share of questions per cognitive level, percent with one decimal")
        Map<CognitiveLevel, Double> cognitiveLevelPercentages,
        @Schema(description = "Share of questions per provenance, percent with one decimal")
        Map<Provenance, Double> provenancePercentages
) {
}
