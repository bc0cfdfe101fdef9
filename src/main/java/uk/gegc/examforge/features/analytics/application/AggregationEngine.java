package uk.gegc.examforge.features.analytics.application;

import uk.gegc.examforge.features.analytics.api.dto.PaperSummary;
import uk.gegc.examforge.features.paper.domain.model.Paper;

import java.util.Collection;
import java.util.UUID;

/**
 * Read-only statistics over papers. The same input always yields the same output, whatever the
 * order of the papers.
 */
public interface AggregationEngine {

    /**
     * @param paperId      optional paper to analyse in detail; ignored if it is not in {@code papers}
     * @param customPrompt optional question for the insight generator; never changes the numbers
     */
    PaperSummary summarize(Collection<Paper> papers, UUID paperId, String customPrompt);

    /**
     * Summarizes the owner's approved papers matching the optional subject and department filters.
     */
    PaperSummary summarizeApproved(String ownerId, String subject, String department, UUID paperId, String customPrompt);
}
