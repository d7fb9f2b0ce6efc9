package uk.gegc.edgeprompt.features.material.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class MaterialMetadataConverter implements AttributeConverter<MaterialMetadata, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public String convertToDatabaseColumn(MaterialMetadata attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? new MaterialMetadata() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize material metadata", e);
        }
    }

    @Override
    public MaterialMetadata convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new MaterialMetadata();
        }
        try {
            MaterialMetadata parsed = OBJECT_MAPPER.readValue(dbData, MaterialMetadata.class);
            return parsed != null ? parsed : new MaterialMetadata();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize material metadata", e);
        }
    }
}
