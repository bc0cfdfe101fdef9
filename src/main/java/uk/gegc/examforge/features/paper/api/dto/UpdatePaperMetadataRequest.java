package uk.gegc.examforge.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import uk.gegc.examforge.features.paper.domain.model.ExamType;

import java.time.LocalDate;

@Schema(description = "Partial metadata update of a draft paper; omitted fields are left unchanged")
public record UpdatePaperMetadataRequest(
        @Size(max = 200, message = "Subject must be at most 200 characters long")
        String subject,

        @Size(max = 200, message = "Department must be at most 200 characters long")
        String department,

        @Size(max = 100, message = "Section must be at most 100 characters long")
        String section,

        Integer year,

        LocalDate examDate,

        @Schema(description = "Printed total; does not rescale the questions")
        Integer totalMarks,

        ExamType examType
) {
}
