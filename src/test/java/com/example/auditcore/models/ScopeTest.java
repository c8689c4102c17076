package com.example.auditcore.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScopeTest {

    @Test
    @DisplayName("absent, null and empty documents are the unrestricted scope")
    void emptyForms() {
        assertTrue(Scope.parse((String) null).isEmpty());
        assertTrue(Scope.parse("null").isEmpty());
        assertTrue(Scope.parse("{}").isEmpty());
        assertEquals(Scope.empty(), Scope.of(Map.of()));
        assertEquals("{}", Scope.empty().toCanonicalJson());
    }

    @Test
    @DisplayName("canonical form ignores insertion order")
    void canonicalForm() {
        Map<String, String> ordered = new LinkedHashMap<>();
        ordered.put("team_id", "T1");
        ordered.put("project_id", "P1");

        Scope scope = Scope.of(ordered);

        assertEquals("{\"project_id\":\"P1\",\"team_id\":\"T1\"}", scope.toCanonicalJson());
        assertEquals(scope, Scope.parse("{\"project_id\":\"P1\",\"team_id\":\"T1\"}"));
    }

    @Test
    @DisplayName("a grant scope is satisfied by any request containing its keys")
    void satisfaction() {
        Scope grant = Scope.of("project_id", "P1");

        assertTrue(grant.isSatisfiedBy(Scope.of("project_id", "P1")));
        assertTrue(grant.isSatisfiedBy(Scope.of(Map.of("project_id", "P1", "team_id", "T9"))));
        assertFalse(grant.isSatisfiedBy(Scope.of("project_id", "P2")));
        assertFalse(grant.isSatisfiedBy(Scope.empty()));
        assertFalse(grant.isSatisfiedBy(null));
        assertTrue(Scope.empty().isSatisfiedBy(Scope.of("project_id", "P2")));
        assertTrue(Scope.empty().isSatisfiedBy(null));
    }

    @Test
    @DisplayName("non-object documents and non-string values are rejected")
    void rejectsShapes() {
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("[\"P1\"]"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("\"P1\""));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("{\"project_id\":1}"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("{\"project_id\":{\"id\":\"P1\"}}"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("{\"project_id\":\" \"}"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("{\"Project\":\"P1\"}"));
    }
}
