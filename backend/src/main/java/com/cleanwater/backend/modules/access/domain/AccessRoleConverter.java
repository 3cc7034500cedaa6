package com.cleanwater.backend.modules.access.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AccessRoleConverter implements AttributeConverter<AccessRole, Integer> {

    @Override
    public Integer convertToDatabaseColumn(AccessRole role) {
        return role == null ? null : role.getCode();
    }

    @Override
    public AccessRole convertToEntityAttribute(Integer code) {
        return code == null ? null : AccessRole.fromCode(code);
    }
}
