package uk.gegc.examforge.features.paper.domain.model;

public enum RenderVariant {
    QUESTIONS_ONLY,
    WITH_ANSWERS
}
