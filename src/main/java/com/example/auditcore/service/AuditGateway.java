package com.example.auditcore.service;

import com.example.auditcore.access.LedgerAppend;
import com.example.auditcore.models.CanonicalJson;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.AppendEventRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Single entry point through which privileged operations are written to the ledger. Each call
 * appends exactly one event; batched operations are recorded one call per action.
 *
 * <p>Catalog changes do not append on their own: they {@link #prepare} the event and commit it in
 * the same transaction as the change, so a change is never stored without its event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditGateway {

    static final String REQUEST_ID_MDC_KEY = "requestId";
    static final String CLIENT_IP_MDC_KEY = "clientIp";
    static final String USER_AGENT_MDC_KEY = "userAgent";

    private final EventLedgerService ledger;
    private final SeverityClassifier classifier;

    public LedgerEvent record(OperationKind kind, String actorId, String subjectId, Map<String, ?> details) {
        LedgerEvent event = ledger.append(request(kind, actorId, subjectId, details));
        log.info("Recorded {} by {} on {} (seq {})", kind.eventName(), actorId, subjectId, event.getSequence());
        return event;
    }

    public LedgerEvent record(OperationKind kind, String actorId, String subjectId) {
        return record(kind, actorId, subjectId, Map.of());
    }

    /**
     * Builds the event for {@code kind} against the current chain tail without writing it. The
     * caller commits it together with its own writes.
     */
    public LedgerAppend prepare(OperationKind kind, String actorId, String subjectId, Map<String, ?> details) {
        return ledger.prepare(request(kind, actorId, subjectId, details));
    }

    private AppendEventRequest request(OperationKind kind, String actorId, String subjectId, Map<String, ?> details) {
        Objects.requireNonNull(kind, "kind");
        Severity severity = classifier.classify(kind);
        if (severity == Severity.IMPORTANT && (actorId == null || actorId.isBlank())) {
            throw new IllegalArgumentException(kind.eventName() + " requires an acting user");
        }
        return new AppendEventRequest(
                kind.eventName(), actorId, subjectId, envelope(kind, actorId, subjectId, details), severity);
    }

    /**
     * Actor, subject and request context are repeated inside the payload so they are covered by
     * the event hash.
     */
    private JsonNode envelope(OperationKind kind, String actorId, String subjectId, Map<String, ?> details) {
        ObjectNode payload = CanonicalJson.newObject();
        payload.put("operation", kind.eventName());
        payload.put("actor_id", actorId);
        payload.put("subject_id", subjectId);
        payload.set("details", CanonicalJson.toNode(details == null ? Map.of() : details));
        String requestId = MDC.get(REQUEST_ID_MDC_KEY);
        if (requestId != null) {
            payload.put("request_id", requestId);
        }
        ObjectNode context = CanonicalJson.newObject();
        putIfPresent(context, "client_ip", MDC.get(CLIENT_IP_MDC_KEY));
        putIfPresent(context, "user_agent", MDC.get(USER_AGENT_MDC_KEY));
        if (!context.isEmpty()) {
            payload.set("context", context);
        }
        return payload;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    /**
     * Builds an insertion-ordered detail map from alternating keys and values. Null values are
     * kept and serialized as JSON null.
     */
    public static Map<String, Object> details(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("details need key/value pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            details.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return details;
    }
}
