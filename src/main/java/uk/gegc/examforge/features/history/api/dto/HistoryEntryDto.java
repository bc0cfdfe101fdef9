package uk.gegc.examforge.features.history.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.history.domain.model.HistoryStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "One generation or regeneration attempt")
public record HistoryEntryDto(
        @Schema(description = "Entry id")
        UUID id,

        @Schema(description = "Initial generation or regeneration of an existing paper")
        HistoryKind kind,

        @Schema(description = "Outcome of the attempt")
        HistoryStatus status,

        @Schema(description = "Request parameters as submitted, JSON encoded")
        String requestParameters,

        @Schema(description = "Instruction text sent to the generation service")
        String prompt,

        @Schema(description = "Free-text feedback supplied for a regeneration")
        String feedbackPrompt,

        @Schema(description = "Paper that was regenerated, for regeneration entries")
        UUID sourcePaperId,

        @Schema(description = "Paper produced or updated by a successful attempt")
        UUID paperId,

        @Schema(description = "Failure reason when status is FAILED")
        String errorMessage,

        Instant createdAt,

        Instant completedAt
) {
}
