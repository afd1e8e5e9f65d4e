package com.eyelevel.documentcompressor.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link JobPriority} as its numeric weight so {@code ORDER BY priority DESC} follows the tiers.
 */
@Converter
public class JobPriorityConverter implements AttributeConverter<JobPriority, Integer> {

    @Override
    public Integer convertToDatabaseColumn(JobPriority priority) {
        return priority == null ? null : priority.getWeight();
    }

    @Override
    public JobPriority convertToEntityAttribute(Integer weight) {
        return weight == null ? null : JobPriority.fromWeight(weight);
    }
}
