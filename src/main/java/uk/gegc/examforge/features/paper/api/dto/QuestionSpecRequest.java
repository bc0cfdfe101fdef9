package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

@Schema(description = "Requested questions for one category")
public record QuestionSpecRequest(
        @Schema(description = "Question category", example = "MEDIUM")
        @NotNull(message = "Category is required")
        QuestionCategory category,

        @Schema(description = "Number of questions", example = "4")
        @NotNull(message = "Count is required")
        @Min(value = 0, message = "Count must not be negative")
        @Max(value = 1000, message = "Count must be at most 1000")
        Integer count,

        @Schema(description = "Marks per question; defaults to the category's standard marks", example = "5")
        @Min(value = 0, message = "Marks per question must not be negative")
        @Max(value = 1000, message = "Marks per question must be at most 1000")
        Integer marksEach
) {
}
