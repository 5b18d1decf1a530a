package com.itq.formledger.entity;

import com.itq.formledger.domain.Address;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AddressConverter implements AttributeConverter<Address, String> {

    @Override
    public String convertToDatabaseColumn(Address address) {
        return address == null ? null : address.toHex();
    }

    @Override
    public Address convertToEntityAttribute(String column) {
        return column == null ? null : Address.fromHex(column);
    }
}
