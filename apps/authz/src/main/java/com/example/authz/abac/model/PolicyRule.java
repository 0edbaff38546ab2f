package com.example.authz.abac.model;

import com.example.authz.abac.condition.AttributeValues;
import com.example.authz.abac.exception.InvalidPolicyException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One ABAC rule: when every condition holds for an applicable action, the rule's
 * effect decides the request.
 *
 * @param id         Unique rule identifier
 * @param name       Human-readable label
 * @param effect     Decision asserted when the rule matches
 * @param conditions Attribute path to expected value, literal, list or operator object; iteration order is kept
 * @param actions    Actions the rule applies to; {@code "*"} applies to every action
 * @param resources  Resource patterns ({@code "*"}, {@code "claim/*"}, {@code "claim/c-1"})
 * @param priority   Higher values are evaluated first
 * @param enabled    Disabled rules are never matched
 */
public record PolicyRule(
        String id,
        String name,
        Effect effect,
        Map<String, Object> conditions,
        Set<String> actions,
        List<String> resources,
        int priority,
        boolean enabled
) {
    public static final String WILDCARD = "*";

    public PolicyRule {
        if (id == null || id.isBlank()) {
            throw new InvalidPolicyException(id, "Policy id is required");
        }
        if (effect == null) {
            throw new InvalidPolicyException(id, "Policy effect is required");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        // Nested operator objects and lists are copied too; values may be null
        conditions = conditions == null ? Map.of() : copyConditions(conditions);
        actions = actions == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        resources = resources == null || resources.isEmpty()
                ? List.of(WILDCARD)
                : List.copyOf(resources);
    }

    private static Map<String, Object> copyConditions(Map<String, Object> conditions) {
        Map<String, Object> copy = new LinkedHashMap<>();
        conditions.forEach((key, value) -> copy.put(key, AttributeValues.immutableCopy(value)));
        return Collections.unmodifiableMap(copy);
    }

    public static PolicyRule allow(String id, int priority, Map<String, Object> conditions, Collection<String> actions) {
        return new PolicyRule(id, id, Effect.ALLOW, conditions, new LinkedHashSet<>(actions), null, priority, true);
    }

    public static PolicyRule deny(String id, int priority, Map<String, Object> conditions, Collection<String> actions) {
        return new PolicyRule(id, id, Effect.DENY, conditions, new LinkedHashSet<>(actions), null, priority, true);
    }

    public boolean isAllow() {
        return effect == Effect.ALLOW;
    }

    /**
     * Check if the rule covers the action, either by name or through the wildcard.
     */
    public boolean appliesToAction(String action) {
        return actions.contains(WILDCARD) || (action != null && actions.contains(action));
    }

    /**
     * Check if any resource pattern matches the resource key. A pattern ending in
     * {@code *} matches by prefix, {@code *} alone matches everything, anything
     * else must match exactly.
     */
    public boolean matchesResource(String resourceKey) {
        for (String pattern : resources) {
            if (WILDCARD.equals(pattern)) {
                return true;
            }
            if (resourceKey == null) {
                continue;
            }
            if (pattern.endsWith(WILDCARD)) {
                if (resourceKey.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.equals(resourceKey)) {
                return true;
            }
        }
        return false;
    }

    public PolicyRule withEnabled(boolean enabled) {
        return new PolicyRule(id, name, effect, conditions, actions, resources, priority, enabled);
    }

    public PolicyRule withPriority(int priority) {
        return new PolicyRule(id, name, effect, conditions, actions, resources, priority, enabled);
    }
}
