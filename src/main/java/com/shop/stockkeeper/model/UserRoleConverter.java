package com.shop.stockkeeper.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class UserRoleConverter implements AttributeConverter<UserRole, String> {

    @Override
    public String convertToDatabaseColumn(UserRole role) {
        return role == null ? null : role.getCode();
    }

    @Override
    public UserRole convertToEntityAttribute(String code) {
        return code == null ? null : UserRole.fromCode(code);
    }
}
