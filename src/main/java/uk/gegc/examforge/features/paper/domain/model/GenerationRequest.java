package uk.gegc.examforge.features.paper.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Everything the generation service needs to produce a paper. Stored on the paper so that
 * regeneration reuses the exact same targets.
 */
public record GenerationRequest(
        String subject,
        String department,
        String section,
        Integer year,
        LocalDate examDate,
        ExamType examType,
        String topicFocus,
        List<QuestionSpec> categories,
        ProvenanceRatio provenance
) {
    public GenerationRequest {
        examType = examType == null ? ExamType.FINAL : examType;
        categories = categories == null ? List.of() : List.copyOf(categories);
        provenance = provenance == null ? ProvenanceRatio.DEFAULT : provenance;
    }

    public int totalMarks() {
        return categories.stream().mapToInt(QuestionSpec::categoryMarks).sum();
    }

    public int totalQuestions() {
        return categories.stream().mapToInt(QuestionSpec::count).sum();
    }

    public Optional<QuestionSpec> specFor(QuestionCategory category) {
        return categories.stream()
                .filter(spec -> spec.category() == category)
                .findFirst();
    }

    public GenerationRequest withMetadata(String subject, String department, String section, Integer year,
                                          LocalDate examDate, ExamType examType) {
        return new GenerationRequest(subject, department, section, year, examDate, examType, topicFocus,
                categories, provenance);
    }
}
