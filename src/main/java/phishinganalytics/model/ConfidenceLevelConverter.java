package phishinganalytics.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ConfidenceLevelConverter implements AttributeConverter<ConfidenceLevel, String> {

    @Override
    public String convertToDatabaseColumn(ConfidenceLevel level) {
        return level == null ? null : level.getValue();
    }

    @Override
    public ConfidenceLevel convertToEntityAttribute(String value) {
        return value == null ? null : ConfidenceLevel.fromValue(value);
    }
}
