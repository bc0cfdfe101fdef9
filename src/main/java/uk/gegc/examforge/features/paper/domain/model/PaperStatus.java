package uk.gegc.examforge.features.paper.domain.model;

public enum PaperStatus {
    DRAFT,
    APPROVED
}
