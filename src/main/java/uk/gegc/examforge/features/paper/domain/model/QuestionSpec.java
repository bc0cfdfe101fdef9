package uk.gegc.examforge.features.paper.domain.model;

/**
 * Requested number of questions and marks per question for one category.
 */
public record QuestionSpec(
        QuestionCategory category,
        int count,
        int marksEach
) {
    /**
     * @throws ArithmeticException if the product does not fit in an int
     */
    public int categoryMarks() {
        return Math.multiplyExact(count, marksEach);
    }
}
