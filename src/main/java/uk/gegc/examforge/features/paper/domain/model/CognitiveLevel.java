package uk.gegc.examforge.features.paper.domain.model;

/**
 * Bloom's taxonomy tier assigned to a question.
 */
public enum CognitiveLevel {
    REMEMBER(false),
    UNDERSTAND(false),
    APPLY(false),
    ANALYZE(true),
    EVALUATE(true),
    CREATE(true);

    private final boolean higherOrder;

    CognitiveLevel(boolean higherOrder) {
        this.higherOrder = higherOrder;
    }

    public boolean isHigherOrder() {
        return higherOrder;
    }

    public String getDisplayName() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
