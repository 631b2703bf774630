package com.example.cameratrap.domain;

import com.example.cameratrap.model.DetectionType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class DetectionTypeConverter implements AttributeConverter<DetectionType, String> {

    @Override
    public String convertToDatabaseColumn(DetectionType attribute) {
        return attribute == null ? null : attribute.label();
    }

    @Override
    public DetectionType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : DetectionType.fromLabel(dbData);
    }
}
