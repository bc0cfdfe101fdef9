package uk.gegc.examforge.features.paper.domain.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.examforge.features.distribution.domain.model.DistributionSummary;
import uk.gegc.examforge.shared.persistence.JsonAttributeConverter;

@Converter
public class DistributionSummaryConverter extends JsonAttributeConverter<DistributionSummary> {

    public DistributionSummaryConverter() {
        super(new TypeReference<>() {
        }, () -> DistributionSummary.EMPTY, "distribution summary");
    }
}
