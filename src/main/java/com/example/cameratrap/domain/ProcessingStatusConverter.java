package com.example.cameratrap.domain;

import com.example.cameratrap.model.ProcessingStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ProcessingStatusConverter implements AttributeConverter<ProcessingStatus, String> {

    @Override
    public String convertToDatabaseColumn(ProcessingStatus attribute) {
        return attribute == null ? null : attribute.dbValue();
    }

    @Override
    public ProcessingStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ProcessingStatus.fromDbValue(dbData);
    }
}
