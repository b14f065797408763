package com.example.statements.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores terms as their lower-case code ("net_30") rather than the enum name.
 */
@Converter(autoApply = true)
public class TermsCodeConverter implements AttributeConverter<TermsCode, String> {

    @Override
    public String convertToDatabaseColumn(TermsCode attribute) {
        return attribute != null ? attribute.getCode() : null;
    }

    @Override
    public TermsCode convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return TermsCode.DEFAULT;
        }
        return TermsCode.fromCode(dbData);
    }
}
