package com.example.authz.audit;

import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyDecision;
import com.example.authz.rbac.model.Role;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for an authorization decision.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        PolicyDecision.Source source,
        String policyId,
        String reason,

        // Subject
        String userId,
        List<String> roles,

        // Resource and action
        String resourceType,
        String resourceId,
        String action,

        // Request context
        String clientIp
) {
    public static final String USER_ID_ATTRIBUTE = "id";
    public static final String CORRELATION_ID_ATTRIBUTE = "correlation_id";
    public static final String CLIENT_IP_ATTRIBUTE = "ip";

    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent from(EvaluationContext request, PolicyDecision decision, Instant timestamp) {
        Outcome outcome;
        if (decision.source() == PolicyDecision.Source.ERROR) {
            outcome = Outcome.ERROR;
        } else {
            outcome = decision.isAllowed() ? Outcome.ALLOW : Outcome.DENY;
        }

        String correlationId = asString(request.context().get(CORRELATION_ID_ATTRIBUTE));
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                timestamp,
                correlationId,
                outcome,
                decision.source(),
                decision.policyId(),
                decision.reason(),
                asString(request.user().get(USER_ID_ATTRIBUTE)),
                request.roles().stream().map(Role::getValue).toList(),
                asString(request.resource().get(EvaluationContext.RESOURCE_TYPE_ATTRIBUTE)),
                asString(request.resource().get(EvaluationContext.RESOURCE_ID_ATTRIBUTE)),
                request.action(),
                asString(request.context().get(CLIENT_IP_ATTRIBUTE))
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", orEmpty(correlationId)),
                Map.entry("outcome", outcome.name()),
                Map.entry("source", source != null ? source.name() : ""),
                Map.entry("policy_id", orEmpty(policyId)),
                Map.entry("reason", orEmpty(reason)),
                Map.entry("user_id", orEmpty(userId)),
                Map.entry("roles", roles != null ? roles : List.of()),
                Map.entry("resource_type", orEmpty(resourceType)),
                Map.entry("resource_id", orEmpty(resourceId)),
                Map.entry("action", orEmpty(action)),
                Map.entry("client_ip", orEmpty(clientIp))
        );
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
