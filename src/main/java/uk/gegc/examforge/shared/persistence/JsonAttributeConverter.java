package uk.gegc.examforge.shared.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import org.springframework.util.StringUtils;

import java.util.function.Supplier;

/**
 * Stores a value object as a JSON document in a TEXT column.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final TypeReference<T> typeRef;
    private final Supplier<T> emptyValue;
    private final String description;

    protected JsonAttributeConverter(TypeReference<T> typeRef, Supplier<T> emptyValue, String description) {
        this.typeRef = typeRef;
        this.emptyValue = emptyValue;
        this.description = description;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + description, e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return emptyValue.get();
        }
        try {
            T parsed = OBJECT_MAPPER.readValue(dbData, typeRef);
            return parsed != null ? parsed : emptyValue.get();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize " + description, e);
        }
    }
}
