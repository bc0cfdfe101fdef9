package uk.gegc.examforge.features.paper.api.dto;

import uk.gegc.examforge.features.paper.domain.model.ExamType;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * List view of a paper without its questions.
 */
public record PaperSummaryDto(
        UUID id,
        String subject,
        String department,
        String section,
        Integer year,
        ExamType examType,
        int totalMarks,
        int questionCount,
        PaperStatus status,
        int regenerationCount,
        boolean editCopy,
        UUID sourcePaperId,
        ArtifactLinksDto artifacts,
        Instant approvedAt,
        Instant createdAt
) {
}
