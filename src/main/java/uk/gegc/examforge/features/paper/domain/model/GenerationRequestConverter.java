package uk.gegc.examforge.features.paper.domain.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.examforge.shared.persistence.JsonAttributeConverter;

@Converter
public class GenerationRequestConverter extends JsonAttributeConverter<GenerationRequest> {

    public GenerationRequestConverter() {
        super(new TypeReference<>() {
        }, () -> null, "generation request");
    }
}
