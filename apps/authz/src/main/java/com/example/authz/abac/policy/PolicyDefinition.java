package com.example.authz.abac.policy;

import com.example.authz.abac.exception.InvalidPolicyException;
import com.example.authz.abac.model.Effect;
import com.example.authz.abac.model.PolicyRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a policy rule as it appears in a policy document.
 * Omitted {@code priority} is 0, omitted {@code enabled} is true and omitted
 * {@code resources} is {@code ["*"]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyDefinition(
        @NotBlank String id,
        String name,
        @NotBlank String effect,
        Map<String, Object> conditions,
        List<String> actions,
        List<String> resources,
        Integer priority,
        Boolean enabled
) {
    public PolicyRule toRule() {
        Effect parsedEffect = Effect.fromValue(effect)
                .orElseThrow(() -> new InvalidPolicyException(id,
                        "Invalid effect '" + effect + "', expected allow or deny"));
        return new PolicyRule(
                id,
                name,
                parsedEffect,
                conditions,
                actions != null ? new LinkedHashSet<>(actions) : null,
                resources,
                priority != null ? priority : 0,
                enabled == null || enabled
        );
    }
}
