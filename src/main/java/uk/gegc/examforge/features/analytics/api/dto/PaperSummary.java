package uk.gegc.examforge.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Schema(description = "Statistics over a set of approved papers")
public record PaperSummary(
        int totalPapers,
        int totalQuestions,
        @Schema(description = "Mean of the papers' total marks, two decimals")
        double averageMarks,
        @Schema(description = "Papers per department")
        Map<String, Long> departmentDistribution,
        @Schema(description = "Papers per subject")
        Map<String, Long> subjectDistribution,
        @Schema(description = "Questions per category")
        Map<QuestionCategory, Long> questionTypeDistribution,
        @Schema(description = "Questions per Bloom's level")
        Map<CognitiveLevel, Long> bloomsLevelDistribution,
        @Schema(description = "Questions per provenance")
        Map<Provenance, Long> provenanceDistribution,
        @Schema(description = "Questions per difficulty; UNSPECIFIED when the question has none")
        Map<String, Long> difficultyDistribution,
        @Schema(description = "Papers per 10-mark bucket, e.g. \"20-30\"")
        Map<String, Long> markDistribution,
        @Schema(description = "Papers per creation month (yyyy-MM)")
        Map<String, Long> timeTrend,
        List<String> insights,
        List<String> suggestions,
        @Schema(description = "Present when a paper id from the set was requested")
        PaperAnalysis paperAnalysis,
        @Schema(description = "Free-text answer to the custom prompt, when one was given")
        String customAnalysis
) {
    public PaperSummary {
        insights = insights == null ? List.of() : List.copyOf(insights);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public PaperSummary withGeneratedInsights(String analysis, List<String> extraInsights, List<String> extraSuggestions) {
        List<String> mergedInsights = new ArrayList<>(insights);
        mergedInsights.addAll(extraInsights);
        List<String> mergedSuggestions = new ArrayList<>(suggestions);
        mergedSuggestions.addAll(extraSuggestions);
        return new PaperSummary(totalPapers, totalQuestions, averageMarks, departmentDistribution,
                subjectDistribution, questionTypeDistribution, bloomsLevelDistribution, provenanceDistribution,
                difficultyDistribution, markDistribution, timeTrend, mergedInsights, mergedSuggestions,
                paperAnalysis, analysis);
    }
}
