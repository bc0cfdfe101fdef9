package uk.gegc.examforge.features.distribution.domain.model;

public record DistributionTargets(
        int totalMarks,
        int totalQuestions
) {
}
