package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examforge.features.paper.domain.model.ExamType;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Schema(description = "Full exam paper")
public record PaperDto(
        UUID id,
        String subject,
        String department,
        String section,
        Integer year,
        LocalDate examDate,
        ExamType examType,
        int totalMarks,
        PaperStatus status,
        int regenerationCount,
        @Schema(description = "True when this draft was copied from an approved paper")
        boolean editCopy,
        @Schema(description = "Approved paper this copy was made from")
        UUID sourcePaperId,
        ArtifactLinksDto artifacts,
        Instant approvedAt,
        String generationPrompt,
        List<QuestionDto> questions,
        DistributionDto distribution,
        Instant createdAt,
        Instant updatedAt,
        Long version
) {
}
