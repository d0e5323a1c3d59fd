package com.revolution.backend.security;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores backup-code hashes as a comma separated column. Hex digests never contain a comma.
 */
@Converter
public class BackupCodeListConverter implements AttributeConverter<List<String>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<String> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        return String.join(SEPARATOR, attribute);
    }

    @Override
    public List<String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        List<String> codes = new ArrayList<>();
        Arrays.stream(dbData.split(SEPARATOR))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .forEach(codes::add);
        return codes;
    }
}
