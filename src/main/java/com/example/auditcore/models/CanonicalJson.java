package com.example.auditcore.models;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stable JSON serialization used for ledger payloads. Two logically equal documents always
 * produce the same bytes: object keys are sorted, no whitespace is emitted, integral numbers are
 * written as plain integers and decimals as {@code BigDecimal#stripTrailingZeros()} in plain
 * notation. Hashes over ledger payloads are only reproducible because of this.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonFactory FACTORY = MAPPER.getFactory();

    private CanonicalJson() {
    }

    public static String write(JsonNode node) {
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            writeNode(gen, node);
        } catch (IOException | ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Failed to canonicalize JSON document", e);
        }
        return out.toString();
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON document", e);
        }
    }

    public static JsonNode toNode(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    private static void writeNode(JsonGenerator gen, JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            gen.writeNull();
        } else if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            gen.writeStartObject();
            for (String name : names) {
                gen.writeFieldName(name);
                writeNode(gen, node.get(name));
            }
            gen.writeEndObject();
        } else if (node.isArray()) {
            gen.writeStartArray();
            for (JsonNode element : node) {
                writeNode(gen, element);
            }
            gen.writeEndArray();
        } else if (node.isIntegralNumber()) {
            gen.writeNumber(node.bigIntegerValue());
        } else if (node.isNumber()) {
            writeDecimal(gen, node.decimalValue());
        } else if (node.isBoolean()) {
            gen.writeBoolean(node.booleanValue());
        } else {
            gen.writeString(node.asText());
        }
    }

    private static void writeDecimal(JsonGenerator gen, BigDecimal value) throws IOException {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            gen.writeNumber(stripped.toBigIntegerExact());
        } else {
            gen.writeNumber(stripped.toPlainString());
        }
    }
}
