package uk.gegc.examforge.features.paper.domain.model;

public record ProvenanceRatio(
        int previousPercent,
        int creativePercent,
        int newPercent
) {
    public static final ProvenanceRatio DEFAULT = new ProvenanceRatio(30, 40, 30);

    public int sum() {
        return previousPercent + creativePercent + newPercent;
    }

    public int percentFor(Provenance provenance) {
        return switch (provenance) {
            case PREVIOUS -> previousPercent;
            case CREATIVE -> creativePercent;
            case NEW -> newPercent;
        };
    }
}
