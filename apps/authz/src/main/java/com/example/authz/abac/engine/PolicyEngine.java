package com.example.authz.abac.engine;

import com.example.authz.abac.condition.ConditionSet;
import com.example.authz.abac.exception.DuplicatePolicyException;
import com.example.authz.abac.exception.PolicyNotFoundException;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyDecision;
import com.example.authz.abac.model.PolicyRule;
import com.example.authz.abac.policy.PolicyRuleUpdater;
import com.example.authz.rbac.RoleAuthority;
import com.example.authz.rbac.model.Permission;
import com.example.authz.rbac.model.Role;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-phase access decision: a coarse RBAC gate followed by prioritized ABAC rules.
 *
 * <p>Combining algorithm: first applicable.
 * <ul>
 *   <li>The requested action must name a permission carried by the subject's roles,
 *       otherwise the request is denied without consulting any rule</li>
 *   <li>Rules applicable to the action are evaluated by descending priority, ties in
 *       insertion order; disabled rules are skipped</li>
 *   <li>The first rule whose conditions all hold decides with its effect</li>
 *   <li>If no rule matches, the request is denied</li>
 * </ul>
 *
 * <p>Resource patterns do not filter rules unless {@code enforceResourcePatterns} is set.
 *
 * <p>Rules are held in an immutable, already sorted snapshot that mutations replace
 * wholesale. Evaluation reads the current snapshot without locking; mutations are
 * serialized on the engine monitor.
 */
@Slf4j
public class PolicyEngine {

    public static final String CONTEXT_HOUR = "hour";
    public static final String CONTEXT_DAY_OF_WEEK = "day_of_week";
    public static final String CONTEXT_TIMESTAMP = "timestamp";

    private static final Comparator<PolicyEntry> EVALUATION_ORDER =
            Comparator.comparingInt((PolicyEntry entry) -> entry.rule().priority()).reversed()
                    .thenComparingLong(PolicyEntry::sequence);

    private final RoleAuthority roleAuthority;
    private final Clock clock;
    private final boolean enforceResourcePatterns;
    private final PolicyRuleUpdater ruleUpdater;
    private final AtomicLong sequence = new AtomicLong();

    private volatile List<PolicyEntry> entries = List.of();

    /**
     * A registered rule with its compiled conditions and insertion sequence.
     */
    private record PolicyEntry(PolicyRule rule, ConditionSet conditions, long sequence) {}

    public PolicyEngine(RoleAuthority roleAuthority) {
        this(roleAuthority, Clock.systemUTC(), false, new ObjectMapper());
    }

    public PolicyEngine(RoleAuthority roleAuthority, Clock clock, boolean enforceResourcePatterns,
                        ObjectMapper objectMapper) {
        this.roleAuthority = roleAuthority;
        this.clock = clock;
        this.enforceResourcePatterns = enforceResourcePatterns;
        this.ruleUpdater = new PolicyRuleUpdater(objectMapper);
    }

    /**
     * Evaluate a request. Never throws; every failure mode is a deny.
     *
     * @param user     Subject attributes including {@code roles}
     * @param resource Resource attributes
     * @param action   Requested action, e.g. {@code "claim:view"}
     * @param context  Request context; when null, {@code hour}, {@code day_of_week} and
     *                 {@code timestamp} are taken from the engine clock
     * @return true if access is allowed
     */
    public boolean evaluate(Map<String, Object> user, Map<String, Object> resource,
                            String action, Map<String, Object> context) {
        return decide(user, resource, action, context).isAllowed();
    }

    public PolicyDecision decide(Map<String, Object> user, Map<String, Object> resource,
                                 String action, Map<String, Object> context) {
        Map<String, Object> effectiveContext = context != null ? context : currentTimeContext();
        return decide(new EvaluationContext(user, resource, action, effectiveContext));
    }

    public PolicyDecision decide(EvaluationContext request) {
        if (request == null) {
            log.warn("Policy evaluation requested without a request, denying");
            return PolicyDecision.error("Missing request");
        }
        try {
            return doDecide(request);
        } catch (RuntimeException e) {
            log.error("Policy evaluation failed for action={}, denying: {}", request.action(), e.getMessage(), e);
            return PolicyDecision.error("Evaluation failed: " + e.getClass().getSimpleName());
        }
    }

    private PolicyDecision doDecide(EvaluationContext request) {
        String action = request.action();
        List<Role> roles = request.roles();
        log.debug("Evaluating access: roles={}, action={}, resource={}", roles, action, request.resourceKey());

        // Coarse gate: rules are never consulted for an action the roles do not carry
        Optional<Permission> permission = Permission.fromValue(action);
        if (permission.isEmpty()) {
            log.debug("Action {} is not a known permission - denying", action);
            return PolicyDecision.rbacDeny("Unknown permission: " + action);
        }
        if (!roleAuthority.hasPermission(roles, permission.get())) {
            log.debug("Roles {} do not carry {} - denying", roles, permission.get());
            return PolicyDecision.rbacDeny(
                    String.format("Roles %s do not carry permission %s", roles, permission.get()));
        }

        // Rules are matched against the canonical permission value
        String ruleAction = permission.get().getValue();
        String resourceKey = request.resourceKey();
        for (PolicyEntry entry : entries) {
            PolicyRule rule = entry.rule();
            if (!rule.appliesToAction(ruleAction)) {
                continue;
            }
            if (enforceResourcePatterns && !rule.matchesResource(resourceKey)) {
                continue;
            }
            if (!rule.enabled()) {
                log.trace("Skipping disabled policy {}", rule.id());
                continue;
            }
            if (entry.conditions().matches(request)) {
                PolicyDecision decision = PolicyDecision.fromRule(rule);
                log.debug("Policy {} matched (priority={}) -> {}", rule.id(), rule.priority(), decision.decision());
                return decision;
            }
        }

        log.debug("No policy matched action={} - default deny", action);
        return PolicyDecision.defaultDeny();
    }

    /**
     * Coarse permission check without attribute context.
     */
    public boolean hasPermission(Collection<Role> roles, Permission permission) {
        return roleAuthority.hasPermission(roles, permission);
    }

    /**
     * Register a rule. Evaluation order is re-established immediately.
     *
     * @throws DuplicatePolicyException if a rule with the same id is registered
     */
    public synchronized void addPolicy(PolicyRule rule) {
        if (findEntry(rule.id()).isPresent()) {
            throw new DuplicatePolicyException(rule.id());
        }
        List<PolicyEntry> updated = new ArrayList<>(entries);
        updated.add(newEntry(rule));
        publish(updated);
        log.info("Added policy {} (priority={}, effect={})", rule.id(), rule.priority(), rule.effect());
    }

    /**
     * Remove a rule by id.
     *
     * @return true if a rule was removed, false if the id was unknown
     */
    public synchronized boolean removePolicy(String policyId) {
        List<PolicyEntry> updated = new ArrayList<>(entries);
        boolean removed = updated.removeIf(entry -> entry.rule().id().equals(policyId));
        if (!removed) {
            log.debug("Remove requested for unknown policy {}", policyId);
            return false;
        }
        publish(updated);
        log.info("Removed policy {}", policyId);
        return true;
    }

    /**
     * Change the fields named in {@code fields}; unknown field names are ignored.
     *
     * @return the updated rule
     * @throws PolicyNotFoundException if no rule has the id
     * @throws com.example.authz.abac.exception.InvalidPolicyException if a known field has an unusable value
     */
    public synchronized PolicyRule updatePolicy(String policyId, Map<String, Object> fields) {
        PolicyEntry current = findEntry(policyId)
                .orElseThrow(() -> new PolicyNotFoundException(policyId));

        PolicyRule updatedRule = ruleUpdater.apply(current.rule(), fields);
        ConditionSet conditions = updatedRule.conditions().equals(current.rule().conditions())
                ? current.conditions()
                : ConditionSet.compile(updatedRule.conditions());

        List<PolicyEntry> updated = new ArrayList<>(entries.size());
        for (PolicyEntry entry : entries) {
            updated.add(entry == current
                    ? new PolicyEntry(updatedRule, conditions, current.sequence())
                    : entry);
        }
        publish(updated);
        log.info("Updated policy {} fields={}", policyId, fields != null ? fields.keySet() : Set.of());
        return updatedRule;
    }

    /**
     * Replace the whole rule set atomically, e.g. after reading it from an external store.
     *
     * @throws DuplicatePolicyException if the new set repeats an id
     */
    public synchronized void reload(Collection<PolicyRule> rules) {
        Set<String> ids = new HashSet<>();
        List<PolicyEntry> replacement = new ArrayList<>(rules.size());
        for (PolicyRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new DuplicatePolicyException(rule.id());
            }
            replacement.add(newEntry(rule));
        }
        publish(replacement);
        log.info("Policy engine loaded {} policies", replacement.size());
        replacement.forEach(entry -> log.debug("  - {} (priority={}, effect={}): {}",
                entry.rule().id(), entry.rule().priority(), entry.rule().effect(), entry.rule().name()));
    }

    /**
     * Registered rules in evaluation order.
     */
    public List<PolicyRule> getPolicies() {
        return entries.stream().map(PolicyEntry::rule).toList();
    }

    public Optional<PolicyRule> getPolicy(String policyId) {
        return findEntry(policyId).map(PolicyEntry::rule);
    }

    private Optional<PolicyEntry> findEntry(String policyId) {
        if (policyId == null) {
            return Optional.empty();
        }
        return entries.stream()
                .filter(entry -> entry.rule().id().equals(policyId))
                .findFirst();
    }

    private PolicyEntry newEntry(PolicyRule rule) {
        return new PolicyEntry(rule, ConditionSet.compile(rule.conditions()), sequence.getAndIncrement());
    }

    private void publish(List<PolicyEntry> updated) {
        updated.sort(EVALUATION_ORDER);
        entries = List.copyOf(updated);
    }

    private Map<String, Object> currentTimeContext() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(CONTEXT_TIMESTAMP, Instant.from(now));
        context.put(CONTEXT_HOUR, now.getHour());
        // ISO-8601: Monday = 1 ... Sunday = 7
        context.put(CONTEXT_DAY_OF_WEEK, now.getDayOfWeek().getValue());
        return context;
    }
}
