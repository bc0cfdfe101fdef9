package uk.gegc.examforge.features.analytics.application;

import uk.gegc.examforge.features.analytics.api.dto.PaperSummary;

/**
 * Answers a free-form question about a set of papers, given their computed statistics.
 */
public interface InsightGenerator {

    /**
     * @throws uk.gegc.examforge.shared.exception.GenerationException if no answer could be produced
     */
    GeneratedInsights generate(PaperSummary context, String customPrompt);
}
