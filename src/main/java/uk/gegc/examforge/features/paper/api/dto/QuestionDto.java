package uk.gegc.examforge.features.paper.api.dto;

import uk.gegc.examforge.features.paper.domain.model.CognitiveLevel;
import uk.gegc.examforge.features.paper.domain.model.Difficulty;
import uk.gegc.examforge.features.paper.domain.model.Provenance;
import uk.gegc.examforge.features.paper.domain.model.QuestionCategory;

import java.util.List;

public record QuestionDto(
        int number,
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
}
