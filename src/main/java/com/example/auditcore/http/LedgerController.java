package com.example.auditcore.http;

import static com.example.auditcore.http.AdminPermissions.ACTOR_HEADER;

import com.example.auditcore.models.ChainCheckpoint;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.EventQuery;
import com.example.auditcore.service.AuthorizationEnforcer;
import com.example.auditcore.service.ChainVerification;
import com.example.auditcore.service.EventLedgerService;
import com.example.auditcore.service.IntegrityViolation;
import com.example.auditcore.service.LedgerPurgeService;
import com.example.auditcore.service.PurgeResult;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the ledger plus the explicit purge. Verification reports a broken chain in
 * the body; it never repairs anything.
 */
@RestController
public class LedgerController {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final EventLedgerService ledger;
    private final LedgerPurgeService purgeService;
    private final AuthorizationEnforcer enforcer;

    public LedgerController(EventLedgerService ledger,
                            LedgerPurgeService purgeService,
                            AuthorizationEnforcer enforcer) {
        this.ledger = ledger;
        this.purgeService = purgeService;
        this.enforcer = enforcer;
    }

    @GetMapping("/ledger/events")
    public ResponseEntity<List<LedgerEventResponse>> listEvents(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam(value = "event_name", required = false) String eventName,
            @RequestParam(value = "severity", required = false) String severity,
            @RequestParam(value = "actor_id", required = false) String filterActorId,
            @RequestParam(value = "subject_id", required = false) String subjectId,
            @RequestParam(value = "from", required = false) Long from,
            @RequestParam(value = "to", required = false) Long to,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        enforcer.require(actorId, AdminPermissions.LEDGER_VIEW);
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        EventQuery query = EventQuery.builder()
                .eventName(eventName)
                .severity(severity == null ? null : Severity.fromString(severity))
                .actorId(filterActorId)
                .subjectId(subjectId)
                .from(from)
                .to(to)
                .limit(effectiveLimit)
                .build();
        try (Stream<LedgerEvent> events = ledger.query(query)) {
            return ResponseEntity.ok(events.map(LedgerController::toResponse).collect(Collectors.toList()));
        }
    }

    @GetMapping("/ledger/events/{eventId}")
    public ResponseEntity<LedgerEventResponse> getEvent(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String eventId
    ) {
        enforcer.require(actorId, AdminPermissions.LEDGER_VIEW);
        return ResponseEntity.ok(toResponse(ledger.findEvent(eventId)));
    }

    @GetMapping("/ledger/verify")
    public ResponseEntity<ChainVerificationResponse> verify(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam(value = "from", required = false) String fromEventId,
            @RequestParam(value = "to", required = false) String toEventId
    ) {
        enforcer.require(actorId, AdminPermissions.LEDGER_VIEW);
        ChainVerification result = ledger.verifyChain(fromEventId, toEventId);
        IntegrityViolation v = result.violation();
        return ResponseEntity.ok(new ChainVerificationResponse(
                result.chainId(),
                result.isValid(),
                result.eventsVerified(),
                result.checkpointsCrossed(),
                v == null ? null : new ChainVerificationResponse.Violation(
                        v.eventId(), v.sequence(), v.reason(), v.expected(), v.actual())
        ));
    }

    @GetMapping("/ledger/stale")
    public ResponseEntity<List<LedgerEventResponse>> stale(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam("severity") String severity,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        enforcer.require(actorId, AdminPermissions.LEDGER_VIEW);
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        try (Stream<LedgerEvent> events = ledger.findStale(Severity.fromString(severity))) {
            return ResponseEntity.ok(events.limit(effectiveLimit)
                    .map(LedgerController::toResponse)
                    .collect(Collectors.toList()));
        }
    }

    @GetMapping("/ledger/checkpoints")
    public ResponseEntity<List<CheckpointResponse>> checkpoints(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId
    ) {
        enforcer.require(actorId, AdminPermissions.LEDGER_VIEW);
        return ResponseEntity.ok(ledger.checkpoints().stream()
                .map(LedgerController::toCheckpointResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/ledger/purge")
    public ResponseEntity<PurgeResponse> purge(@RequestHeader(ACTOR_HEADER) String actorId) {
        enforcer.require(actorId, AdminPermissions.LEDGER_PURGE);
        PurgeResult result = purgeService.purgeStale(actorId);
        return ResponseEntity.ok(new PurgeResponse(
                result.noiseCutoff(),
                result.importantCutoff(),
                result.noisePurged(),
                result.importantPurged(),
                result.failed()
        ));
    }

    static LedgerEventResponse toResponse(LedgerEvent event) {
        return new LedgerEventResponse(
                event.getEventId(),
                event.getSequence(),
                event.getEventName(),
                event.getOccurredAt(),
                event.getRecordedAt(),
                event.getActorId(),
                event.getSubjectId(),
                event.getSeverity(),
                event.getPayload(),
                event.getPrevHash(),
                event.getHash()
        );
    }

    private static CheckpointResponse toCheckpointResponse(ChainCheckpoint checkpoint) {
        return new CheckpointResponse(
                checkpoint.getSequence(),
                checkpoint.getEventId(),
                checkpoint.getHash(),
                checkpoint.getSeverity(),
                checkpoint.getOccurredAt(),
                checkpoint.getPurgedAt()
        );
    }
}
