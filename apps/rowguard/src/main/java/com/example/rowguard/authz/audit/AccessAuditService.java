package com.example.rowguard.authz.audit;

import com.example.rowguard.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Publishes access decisions as JSON lines on the {@code ACCESS_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.access-control.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AccessAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(@NonNull AccessAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.outcome() == AccessAuditEvent.Outcome.ALLOW) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull AccessAuditEvent event) {
        AUDIT_LOG.warn("Access {} - principal={}, resource={}/{}, condition={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.principal()),
                StringSanitizer.forLog(event.resourceType()),
                StringSanitizer.forLog(event.resourceId()),
                StringSanitizer.forLog(event.condition()),
                StringSanitizer.forLog(event.reason()));
    }
}
