package uk.gegc.examforge.features.paper.domain.model;

import java.util.List;

/**
 * A generated question. Immutable once produced; regeneration replaces the whole list.
 */
public record Question(
        String text,
        String answerKey,
        String explanation,
        QuestionCategory category,
        CognitiveLevel cognitiveLevel,
        int marks,
        Provenance provenance,
        String unit,
        List<String> options,
        Difficulty difficulty
) {
    public Question {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
