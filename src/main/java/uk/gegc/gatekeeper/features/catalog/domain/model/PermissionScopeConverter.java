package uk.gegc.gatekeeper.features.catalog.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class PermissionScopeConverter implements AttributeConverter<PermissionScope, String> {

    @Override
    public String convertToDatabaseColumn(PermissionScope scope) {
        return scope == null ? PermissionScope.NONE.getTag() : scope.getTag();
    }

    @Override
    public PermissionScope convertToEntityAttribute(String dbData) {
        return PermissionScope.fromTag(dbData);
    }
}
