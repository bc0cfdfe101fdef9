package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import uk.gegc.examforge.features.paper.domain.model.ExamType;

import java.time.LocalDate;
import java.util.List;

@Schema(description = "Request to generate a new draft exam paper")
public record GeneratePaperRequest(
        @Schema(example = "Operating Systems")
        @NotBlank(message = "Subject must not be blank")
        @Size(max = 200, message = "Subject must be at most 200 characters long")
        String subject,

        @Schema(example = "Computer Science")
        @NotBlank(message = "Department must not be blank")
        @Size(max = 200, message = "Department must be at most 200 characters long")
        String department,

        @Size(max = 100, message = "Section must be at most 100 characters long")
        String section,

        @Schema(description = "Academic year of study", example = "3")
        Integer year,

        LocalDate examDate,

        @Schema(description = "Defaults to FINAL")
        ExamType examType,

        @Schema(description = "Optional topics to focus on")
        @Size(max = 4000, message = "Topic focus must be at most 4000 characters long")
        String topicFocus,

        @NotEmpty(message = "At least one question category is required")
        @Size(max = 4, message = "At most four question categories are allowed")
        List<@Valid QuestionSpecRequest> categories,

        @Schema(description = "Defaults to 30/40/30")
        @Valid
        ProvenanceRequest provenance
) {
}
