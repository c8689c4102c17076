package com.example.auditcore.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Key-value constraint narrowing a direct grant to a subset of subjects, e.g.
 * {@code {"project_id": "P1"}}. Keys are kept sorted so the canonical form, and therefore the
 * uniqueness key of a grant, does not depend on insertion order.
 */
public final class Scope {

    private static final Pattern KEY = Pattern.compile("[a-z][a-z0-9_]*");
    private static final Scope EMPTY = new Scope(new TreeMap<>());

    private final SortedMap<String, String> entries;

    private Scope(SortedMap<String, String> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public static Scope empty() {
        return EMPTY;
    }

    public static Scope of(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        values.forEach((k, v) -> sorted.put(validKey(k), validValue(k, v)));
        return new Scope(sorted);
    }

    public static Scope of(String key, String value) {
        return of(Map.of(key, value));
    }

    /**
     * Parses a scope document. Absent, null and {@code {}} all mean "unrestricted"; anything but a
     * flat object of non-blank strings is rejected.
     *
     * @throws IllegalArgumentException when the document is not a valid scope
     */
    public static Scope parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("scope must be a JSON object");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || !value.isTextual()) {
                throw new IllegalArgumentException("scope value for '" + field.getKey() + "' must be a string");
            }
            sorted.put(validKey(field.getKey()), validValue(field.getKey(), value.textValue()));
        }
        return sorted.isEmpty() ? EMPTY : new Scope(sorted);
    }

    public static Scope parse(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        return parse(CanonicalJson.parse(json));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * A grant scope is satisfied when every key it constrains is present in the requested scope
     * with an equal value. Keys the grant does not mention never block a match.
     */
    public boolean isSatisfiedBy(Scope requested) {
        Scope request = requested == null ? EMPTY : requested;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (!entry.getValue().equals(request.entries.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    public Map<String, String> asMap() {
        return entries;
    }

    public JsonNode toNode() {
        return CanonicalJson.toNode(entries);
    }

    public String toCanonicalJson() {
        return CanonicalJson.write(toNode());
    }

    private static String validKey(String key) {
        if (key == null || !KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("invalid scope key '" + key + "'");
        }
        return key;
    }

    private static String validValue(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scope value for '" + key + "' must be non-blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scope)) {
            return false;
        }
        return entries.equals(((Scope) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return toCanonicalJson();
    }
}
