package com.example.authz.audit;

import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Publishes authorization decisions as structured JSON on the {@code AUTHZ_AUDIT} logger.
 */
@Service
@ConditionalOnProperty(name = "authz.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private static final int MAX_LOG_VALUE_LENGTH = 64;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuthzAuditService(ObjectMapper objectMapper, Clock authzClock) {
        this.objectMapper = objectMapper;
        this.clock = authzClock;
    }

    public void logDecision(@NonNull EvaluationContext request, @NonNull PolicyDecision decision) {
        logEvent(AuthzAuditEvent.from(request, decision, clock.instant()));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull AuthzAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, resource={}/{}, action={}, policy={}, reason={}",
                event.outcome(),
                forLog(event.userId()),
                forLog(event.resourceType()),
                forLog(event.resourceId()),
                forLog(event.action()),
                forLog(event.policyId()),
                forLog(event.reason()));
    }

    // Strips line breaks so caller-supplied attribute values cannot forge log lines
    @NonNull
    static String forLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), MAX_LOG_VALUE_LENGTH));
    }
}
