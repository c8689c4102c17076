package com.example.auditcore.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auditcore.models.CanonicalJson;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.EventQuery;
import com.example.auditcore.service.AuditCoreException;
import com.example.auditcore.service.AuthorizationEnforcer;
import com.example.auditcore.service.ChainVerification;
import com.example.auditcore.service.EventLedgerService;
import com.example.auditcore.service.IntegrityViolation;
import com.example.auditcore.service.LedgerPurgeService;
import com.example.auditcore.service.PurgeResult;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = LedgerController.class)
@Import({RequestIdFilter.class, ApiExceptionHandler.class})
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventLedgerService ledger;

    @MockBean
    private LedgerPurgeService purgeService;

    @MockBean
    private AuthorizationEnforcer enforcer;

    private static LedgerEvent sampleEvent() {
        return LedgerEvent.builder()
                .chainId("main")
                .sequence(3L)
                .eventId("evt-3")
                .eventName("role.created")
                .occurredAt(1700000000000L)
                .payload(CanonicalJson.parse("{\"operation\":\"role.created\"}"))
                .severity(Severity.IMPORTANT)
                .recordedAt(1700000000001L)
                .prevHash("ab".repeat(32))
                .actorId("admin-1")
                .build();
    }

    @Test
    @DisplayName("GET events maps filters onto the query and caps the limit")
    void listEvents() throws Exception {
        when(ledger.query(any())).thenReturn(Stream.of(sampleEvent()));

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/events")
                        .header("X-Actor-Id", "admin-1")
                        .param("severity", "important")
                        .param("actor_id", "admin-1")
                        .param("limit", "5000"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].event_id", equalTo("evt-3")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].seq", equalTo(3)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].severity", equalTo("important")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].payload.operation", equalTo("role.created")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].subject_id").doesNotExist());

        ArgumentCaptor<EventQuery> captor = ArgumentCaptor.forClass(EventQuery.class);
        verify(ledger).query(captor.capture());
        assertEquals(Severity.IMPORTANT, captor.getValue().severity());
        assertEquals("admin-1", captor.getValue().actorId());
        assertEquals(LedgerController.MAX_LIMIT, captor.getValue().limit());
        verify(enforcer).require("admin-1", AdminPermissions.LEDGER_VIEW);
    }

    @Test
    @DisplayName("GET unknown event returns 404")
    void missingEvent() throws Exception {
        when(ledger.findEvent("nope")).thenThrow(AuditCoreException.eventNotFound("nope"));

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/events/nope").header("X-Actor-Id", "admin-1"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("EVENT_NOT_FOUND")));
    }

    @Test
    @DisplayName("GET verify reports a broken chain in the body")
    void verifyBroken() throws Exception {
        when(ledger.verifyChain(null, null)).thenReturn(ChainVerification.broken("main", 2, 0,
                new IntegrityViolation("evt-3", 3, "stored hash does not match payload", "aa", "bb")));

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/verify").header("X-Actor-Id", "admin-1"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.valid", equalTo(false)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.events_verified", equalTo(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.violation.event_id", equalTo("evt-3")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.violation.reason",
                        equalTo("stored hash does not match payload")));
    }

    @Test
    @DisplayName("GET verify of an intact chain has no violation")
    void verifyValid() throws Exception {
        when(ledger.verifyChain("evt-1", "evt-3")).thenReturn(ChainVerification.valid("main", 3, 1));

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/verify")
                        .header("X-Actor-Id", "admin-1")
                        .param("from", "evt-1")
                        .param("to", "evt-3"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.valid", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.checkpoints_crossed", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.violation").doesNotExist());
    }

    @Test
    @DisplayName("GET stale requires a valid severity")
    void staleBadSeverity() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/stale")
                        .header("X-Actor-Id", "admin-1")
                        .param("severity", "loud"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("BAD_REQUEST")));
    }

    @Test
    @DisplayName("POST purge needs the actor header")
    void purgeNeedsActor() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/ledger/purge"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());

        verify(purgeService, never()).purgeStale(anyString());
    }

    @Test
    @DisplayName("POST purge returns the counts")
    void purge() throws Exception {
        when(purgeService.purgeStale("ops-1")).thenReturn(new PurgeResult(100L, 50L, 4, 1, 0));

        mockMvc.perform(MockMvcRequestBuilders.post("/ledger/purge").header("X-Actor-Id", "ops-1"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.noise_purged", equalTo(4)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.important_purged", equalTo(1)));

        verify(enforcer).require("ops-1", AdminPermissions.LEDGER_PURGE);
    }

    @Test
    @DisplayName("denied callers get 403 without detail")
    void forbidden() throws Exception {
        doThrow(AuditCoreException.forbidden()).when(enforcer).require(eq("mallory"), anyString());

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/checkpoints").header("X-Actor-Id", "mallory"))
                .andExpect(MockMvcResultMatchers.status().isForbidden())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("FORBIDDEN")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("Forbidden")));

        verify(ledger, never()).checkpoints();
    }

    @Test
    @DisplayName("responses carry a request id")
    void requestId() throws Exception {
        when(ledger.checkpoints()).thenReturn(List.of());

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/checkpoints")
                        .header("X-Actor-Id", "admin-1")
                        .header("X-Request-Id", "req-7"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().string("X-Request-Id", "req-7"));
    }

    @Test
    @DisplayName("transient storage failures map to 503")
    void storageUnavailable() throws Exception {
        when(ledger.checkpoints()).thenThrow(AuditCoreException.storageUnavailable("checkpoints", null));

        mockMvc.perform(MockMvcRequestBuilders.get("/ledger/checkpoints").header("X-Actor-Id", "admin-1"))
                .andExpect(MockMvcResultMatchers.status().isServiceUnavailable())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("STORAGE_UNAVAILABLE")));
    }
}
