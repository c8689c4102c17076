package com.example.auditcore.models;

import com.fasterxml.jackson.databind.JsonNode;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores ledger payloads as their canonical JSON string, so the bytes at rest are exactly the
 * bytes that were hashed.
 */
public class JsonNodeAttributeConverter implements AttributeConverter<JsonNode> {

    @Override
    public AttributeValue transformFrom(JsonNode input) {
        if (input == null || input.isNull()) {
            return AttributeValue.builder().nul(true).build();
        }
        return AttributeValue.builder().s(CanonicalJson.write(input)).build();
    }

    @Override
    public JsonNode transformTo(AttributeValue attributeValue) {
        if (attributeValue == null) {
            return null;
        }
        if (Boolean.TRUE.equals(attributeValue.nul())) {
            return null;
        }
        String raw = attributeValue.s();
        if (raw == null) {
            return null;
        }
        return CanonicalJson.parse(raw);
    }

    @Override
    public EnhancedType<JsonNode> type() {
        return EnhancedType.of(JsonNode.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S;
    }
}
