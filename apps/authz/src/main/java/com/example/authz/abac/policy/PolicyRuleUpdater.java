package com.example.authz.abac.policy;

import com.example.authz.abac.exception.InvalidPolicyException;
import com.example.authz.abac.model.Effect;
import com.example.authz.abac.model.PolicyRule;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a partial update payload to a policy rule.
 *
 * <p>Recognised fields: {@code name}, {@code effect}, {@code conditions}, {@code actions},
 * {@code resources}, {@code priority}, {@code enabled}. Anything else, including
 * {@code id}, is ignored.
 */
@Slf4j
public class PolicyRuleUpdater {

    private static final TypeReference<LinkedHashMap<String, Object>> CONDITIONS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PolicyRuleUpdater(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PolicyRule apply(PolicyRule rule, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return rule;
        }

        String name = rule.name();
        Effect effect = rule.effect();
        Map<String, Object> conditions = rule.conditions();
        Set<String> actions = rule.actions();
        List<String> resources = rule.resources();
        int priority = rule.priority();
        boolean enabled = rule.enabled();

        for (Map.Entry<String, Object> field : fields.entrySet()) {
            Object value = field.getValue();
            switch (field.getKey()) {
                case "name" -> name = value != null ? value.toString() : null;
                case "effect" -> effect = toEffect(rule.id(), value);
                case "conditions" -> conditions = convert(rule.id(), "conditions", value, CONDITIONS_TYPE);
                case "actions" -> actions = new LinkedHashSet<>(toStringList(rule.id(), "actions", value));
                case "resources" -> resources = toStringList(rule.id(), "resources", value);
                case "priority" -> priority = convert(rule.id(), "priority", value, Integer.class);
                case "enabled" -> enabled = convert(rule.id(), "enabled", value, Boolean.class);
                default -> log.debug("Ignoring unknown field '{}' in update of policy {}", field.getKey(), rule.id());
            }
        }

        return new PolicyRule(rule.id(), name, effect, conditions, actions, resources, priority, enabled);
    }

    private Effect toEffect(String policyId, Object value) {
        return Effect.fromValue(value != null ? value.toString() : null)
                .orElseThrow(() -> new InvalidPolicyException(policyId,
                        "Invalid effect '" + value + "', expected allow or deny"));
    }

    private List<String> toStringList(String policyId, String field, Object value) {
        if (value instanceof String single) {
            return List.of(single);
        }
        if (value instanceof Collection<?>) {
            return convert(policyId, field, value, STRING_LIST_TYPE);
        }
        throw new InvalidPolicyException(policyId, "Field '" + field + "' must be a string or a list");
    }

    private <T> T convert(String policyId, String field, Object value, Class<T> type) {
        if (value == null) {
            throw new InvalidPolicyException(policyId, "Field '" + field + "' cannot be null");
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyException(policyId, "Invalid value for '" + field + "': " + value, e);
        }
    }

    private <T> T convert(String policyId, String field, Object value, TypeReference<T> type) {
        if (value == null) {
            throw new InvalidPolicyException(policyId, "Field '" + field + "' cannot be null");
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyException(policyId, "Invalid value for '" + field + "': " + value, e);
        }
    }
}
