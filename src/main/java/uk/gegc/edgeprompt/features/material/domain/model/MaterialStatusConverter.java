package uk.gegc.edgeprompt.features.material.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists statuses in the lower-case form the {@code materials.status} check constraint expects.
 */
@Converter(autoApply = true)
public class MaterialStatusConverter implements AttributeConverter<MaterialStatus, String> {

    @Override
    public String convertToDatabaseColumn(MaterialStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public MaterialStatus convertToEntityAttribute(String dbData) {
        return MaterialStatus.fromValue(dbData);
    }
}
