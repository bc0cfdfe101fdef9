package uk.gegc.examforge.features.paper.domain.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.examforge.shared.persistence.JsonAttributeConverter;

import java.util.List;

@Converter
public class QuestionListConverter extends JsonAttributeConverter<List<Question>> {

    public QuestionListConverter() {
        super(new TypeReference<>() {
        }, List::of, "paper questions");
    }
}
