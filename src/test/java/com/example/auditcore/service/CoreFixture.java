package com.example.auditcore.service;

import com.example.auditcore.config.AuditSeverityProperties;
import com.example.auditcore.config.AuthorizationProperties;
import com.example.auditcore.config.CatalogProperties;
import com.example.auditcore.config.LedgerProperties;
import com.example.auditcore.config.LedgerRetentionProperties;
import com.example.auditcore.models.LedgerEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Services wired against the in-memory storage doubles.
 */
class CoreFixture {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T12:34:56Z"), ZoneOffset.UTC);
    static final String ADMIN = "admin-1";

    final InMemoryEventLedgerAccess ledgerAccess = new InMemoryEventLedgerAccess();
    final InMemoryCatalogAccess catalogAccess = new InMemoryCatalogAccess(ledgerAccess);
    final InMemoryUserAccess userAccess = new InMemoryUserAccess();

    final LedgerProperties ledgerProperties = new LedgerProperties();
    final CatalogProperties catalogProperties = new CatalogProperties();
    final AuthorizationProperties authorizationProperties = new AuthorizationProperties();

    final SeverityClassifier classifier =
            new SeverityClassifier(new AuditSeverityProperties(), new LedgerRetentionProperties());
    final EventLedgerService ledger;
    final AuditGateway gateway;
    final CatalogWriter writer;
    final PermissionCatalogService catalog;
    final GrantService grants;
    final ScopedGrantResolver resolver;
    final AuthorizationEnforcer enforcer;

    CoreFixture() {
        ledgerProperties.getAppend().setBackoff(Duration.ZERO);
        catalogProperties.getWrite().setBackoff(Duration.ZERO);
        ledger = new EventLedgerService(ledgerAccess, ledgerProperties, classifier, CLOCK);
        gateway = new AuditGateway(ledger, classifier);
        writer = new CatalogWriter(catalogAccess, gateway, catalogProperties);
        catalog = new PermissionCatalogService(catalogAccess, writer, CLOCK);
        grants = new GrantService(catalogAccess, userAccess, writer, CLOCK);
        resolver = new ScopedGrantResolver(catalogAccess, userAccess, catalogProperties);
        enforcer = new AuthorizationEnforcer(resolver, gateway, authorizationProperties);
    }

    List<String> eventNames() {
        return ledgerAccess.all(ledger.chainId()).stream()
                .map(LedgerEvent::getEventName)
                .collect(Collectors.toList());
    }

    LedgerEvent lastEvent() {
        List<LedgerEvent> all = ledgerAccess.all(ledger.chainId());
        return all.get(all.size() - 1);
    }
}
