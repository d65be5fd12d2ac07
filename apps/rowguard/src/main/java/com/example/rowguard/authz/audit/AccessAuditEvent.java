package com.example.rowguard.authz.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for route guard decisions.
 */
public record AccessAuditEvent(
        String eventId,
        Instant timestamp,
        Outcome outcome,
        String principal,
        String resourceType,
        String resourceId,
        String condition,
        String reason
) {
    public enum Outcome {
        ALLOW, DENY
    }

    public static AccessAuditEvent of(
            Outcome outcome,
            String principal,
            String resourceType,
            String resourceId,
            String condition,
            String reason) {
        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                outcome,
                principal,
                resourceType,
                resourceId,
                condition,
                reason
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "access_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("principal", principal != null ? principal : ""),
                Map.entry("resource_type", resourceType != null ? resourceType : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : ""),
                Map.entry("condition", condition != null ? condition : ""),
                Map.entry("reason", reason != null ? reason : "")
        );
    }
}
