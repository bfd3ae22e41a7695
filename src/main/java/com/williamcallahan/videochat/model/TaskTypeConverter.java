package com.williamcallahan.videochat.model;

import com.williamcallahan.videochat.domain.TaskType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the task type by its lowercase wire value.
 */
@Converter(autoApply = true)
public class TaskTypeConverter implements AttributeConverter<TaskType, String> {

    @Override
    public String convertToDatabaseColumn(TaskType attribute) {
        return attribute == null ? null : attribute.wireValue();
    }

    @Override
    public TaskType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TaskType.fromWireValue(dbData);
    }
}
