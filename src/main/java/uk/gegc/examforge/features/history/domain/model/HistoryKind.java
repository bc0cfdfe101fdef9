package uk.gegc.examforge.features.history.domain.model;

public enum HistoryKind {
    GENERATION,
    REGENERATION
}
