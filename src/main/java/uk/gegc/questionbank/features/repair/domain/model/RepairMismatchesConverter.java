package uk.gegc.questionbank.features.repair.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Converter
public class RepairMismatchesConverter implements AttributeConverter<List<RepairMismatch>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<RepairMismatch>> TYPE_REF = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<RepairMismatch> attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize repair mismatches", e);
        }
    }

    @Override
    public List<RepairMismatch> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new ArrayList<>();
        }
        try {
            List<RepairMismatch> parsed = OBJECT_MAPPER.readValue(dbData, TYPE_REF);
            return parsed != null ? parsed : new ArrayList<>();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize repair mismatches", e);
        }
    }
}
