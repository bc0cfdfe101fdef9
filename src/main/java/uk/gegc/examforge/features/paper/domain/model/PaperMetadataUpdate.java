package uk.gegc.examforge.features.paper.domain.model;

import java.time.LocalDate;

/**
 * Partial metadata edit of a draft paper. {@code null} means "leave unchanged".
 */
public record PaperMetadataUpdate(
        String subject,
        String department,
        String section,
        Integer year,
        LocalDate examDate,
        Integer totalMarks,
        ExamType examType
) {
    public boolean isEmpty() {
        return subject == null && department == null && section == null && year == null
                && examDate == null && totalMarks == null && examType == null;
    }
}
