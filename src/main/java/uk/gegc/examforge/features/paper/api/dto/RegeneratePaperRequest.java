package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

public record RegeneratePaperRequest(
        @Schema(description = "What to change in the new set of questions", example = "Fewer definition questions")
        @Size(max = 4000, message = "Feedback must be at most 4000 characters long")
        String feedbackPrompt
) {
}
