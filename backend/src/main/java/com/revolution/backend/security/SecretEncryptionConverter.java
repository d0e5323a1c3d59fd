package com.revolution.backend.security;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@Converter
@RequiredArgsConstructor
public class SecretEncryptionConverter implements AttributeConverter<String, String> {

    private final SecretEncryptionService secretEncryptionService;

    @Override
    public String convertToDatabaseColumn(String attribute) {
        return secretEncryptionService.encrypt(attribute);
    }

    @Override
    public String convertToEntityAttribute(String dbData) {
        return secretEncryptionService.decrypt(dbData);
    }
}
