package uk.gegc.examforge.features.paper.domain.model;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD
}
