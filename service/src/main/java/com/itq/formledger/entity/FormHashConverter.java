package com.itq.formledger.entity;

import com.itq.formledger.domain.FormHash;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class FormHashConverter implements AttributeConverter<FormHash, String> {

    @Override
    public String convertToDatabaseColumn(FormHash hash) {
        return hash == null ? null : hash.toHex();
    }

    @Override
    public FormHash convertToEntityAttribute(String column) {
        return column == null ? null : FormHash.fromHex(column);
    }
}
