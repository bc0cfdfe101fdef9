package uk.gegc.examforge.features.paper.domain.model;

public enum ExamType {
    MID,
    FINAL,
    INTERNAL,
    QUIZ
}
