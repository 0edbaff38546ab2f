package com.example.authz.service;

import com.example.authz.abac.engine.PolicyEngine;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyDecision;
import com.example.authz.audit.AuthzAuditService;
import com.example.authz.observability.AuthzMetrics;
import com.example.authz.rbac.RoleAuthority;
import com.example.authz.rbac.model.Permission;
import com.example.authz.rbac.model.Role;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Entry point for request-authorization middleware.
 *
 * <p>The caller has already authenticated the subject and gathered the resource
 * attributes; this service runs the engine, records metrics and audits the decision.
 * Evaluation is CPU-only, so results are emitted without switching schedulers.
 */
@Slf4j
@Service
public class AccessDecisionService {

    private final PolicyEngine policyEngine;
    private final RoleAuthority roleAuthority;
    private final AuthzMetrics metrics;

    @Nullable
    private final AuthzAuditService auditService;

    public AccessDecisionService(
            PolicyEngine policyEngine,
            RoleAuthority roleAuthority,
            AuthzMetrics metrics,
            @Nullable AuthzAuditService auditService) {
        this.policyEngine = policyEngine;
        this.roleAuthority = roleAuthority;
        this.metrics = metrics;
        this.auditService = auditService;
    }

    /**
     * Decide a request.
     *
     * @param user     Subject attributes including {@code roles}
     * @param resource Resource attributes
     * @param action   Requested action, e.g. {@code "claim:approve"}
     * @param context  Request context, or null to use the current time
     * @return Mono emitting the decision; never errors
     */
    public Mono<PolicyDecision> authorize(
            Map<String, Object> user,
            Map<String, Object> resource,
            String action,
            @Nullable Map<String, Object> context) {

        return Mono.fromSupplier(() -> decide(user, resource, action, context));
    }

    /**
     * Check if access is allowed (convenience method).
     */
    public Mono<Boolean> isAllowed(
            Map<String, Object> user,
            Map<String, Object> resource,
            String action,
            @Nullable Map<String, Object> context) {
        return authorize(user, resource, action, context).map(PolicyDecision::isAllowed);
    }

    /**
     * Coarse role check for an action on a resource type, without attribute context.
     *
     * @param roles Role strings or {@link Role} values
     */
    public boolean checkPermission(Object roles, String resourceType, String action) {
        return roleAuthority.canAccess(Role.resolveAll(roles), resourceType, action);
    }

    /**
     * Every permission the roles carry, e.g. to tell a client which actions to offer.
     */
    public Set<Permission> permissionsOf(Object roles) {
        return roleAuthority.permissionClosure(Role.resolveAll(roles));
    }

    private PolicyDecision decide(
            Map<String, Object> user,
            Map<String, Object> resource,
            String action,
            @Nullable Map<String, Object> context) {

        Timer.Sample sample = metrics.startEvaluation();
        PolicyDecision decision = policyEngine.decide(user, resource, action, context);
        metrics.recordDecision(decision, sample);

        if (auditService != null) {
            try {
                auditService.logDecision(new EvaluationContext(user, resource, action, context), decision);
            } catch (RuntimeException e) {
                log.error("Failed to audit authorization decision for action={}: {}", action, e.getMessage());
            }
        }

        log.debug("Authorization {} for action={} by {} ({})",
                decision.decision(), action, decision.policyId(), decision.source());
        return decision;
    }
}
