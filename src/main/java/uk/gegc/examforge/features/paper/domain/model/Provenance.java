package uk.gegc.examforge.features.paper.domain.model;

/**
 * Where a question came from: prior papers, a creative rework of prior material, or newly written.
 */
public enum Provenance {
    PREVIOUS,
    CREATIVE,
    NEW
}
