package com.example.authz.abac.exception;

import lombok.Getter;

// Raised by administrative operations that target a rule id the engine does not hold.
@Getter
public class PolicyNotFoundException extends RuntimeException {

    private final String policyId;

    public PolicyNotFoundException(String policyId) {
        super("Policy not found: " + policyId);
        this.policyId = policyId;
    }
}
