package com.example.pawluxe_export.model;

import com.example.pawluxe_export.dto.RenderParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RenderParams} as JSON text so the column works on PostgreSQL and H2 alike.
 */
@Converter
public class RenderParamsConverter implements AttributeConverter<RenderParams, String> {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Override
    public String convertToDatabaseColumn(RenderParams attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Serialize render params failed", e);
        }
    }

    @Override
    public RenderParams convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, RenderParams.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored render params are not readable", e);
        }
    }
}
