package com.example.auditcore.models;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

public class ScopeAttributeConverter implements AttributeConverter<Scope> {

    @Override
    public AttributeValue transformFrom(Scope input) {
        Scope scope = input == null ? Scope.empty() : input;
        return AttributeValue.builder().s(scope.toCanonicalJson()).build();
    }

    @Override
    public Scope transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || attributeValue.s() == null) {
            return Scope.empty();
        }
        return Scope.parse(attributeValue.s());
    }

    @Override
    public EnhancedType<Scope> type() {
        return EnhancedType.of(Scope.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S; // stored as a JSON string
    }
}
