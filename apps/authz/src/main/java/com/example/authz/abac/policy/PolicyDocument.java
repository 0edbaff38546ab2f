package com.example.authz.abac.policy;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Root of a policy file: {@code policies: [...]}.
 */
public record PolicyDocument(List<@Valid PolicyDefinition> policies) {

    public PolicyDocument {
        if (policies == null) {
            policies = List.of();
        }
    }
}
