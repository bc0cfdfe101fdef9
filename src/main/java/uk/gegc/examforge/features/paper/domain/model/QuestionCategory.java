package uk.gegc.examforge.features.paper.domain.model;

import java.util.List;

public enum QuestionCategory {
    MCQ("MCQ", 1, List.of(CognitiveLevel.REMEMBER, CognitiveLevel.UNDERSTAND)),
    SHORT("Short Answer", 2, List.of(CognitiveLevel.UNDERSTAND, CognitiveLevel.APPLY)),
    MEDIUM("Medium Answer", 5, List.of(CognitiveLevel.APPLY, CognitiveLevel.ANALYZE)),
    LONG("Long Answer", 10, List.of(CognitiveLevel.ANALYZE, CognitiveLevel.EVALUATE, CognitiveLevel.CREATE));

    private final String displayName;
    private final int defaultMarks;
    private final List<CognitiveLevel> suggestedLevels;

    QuestionCategory(String displayName, int defaultMarks, List<CognitiveLevel> suggestedLevels) {
        this.displayName = displayName;
        this.defaultMarks = defaultMarks;
        this.suggestedLevels = suggestedLevels;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDefaultMarks() {
        return defaultMarks;
    }

    public List<CognitiveLevel> getSuggestedLevels() {
        return suggestedLevels;
    }
}
