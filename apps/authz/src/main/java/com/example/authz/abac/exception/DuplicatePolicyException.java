package com.example.authz.abac.exception;

import lombok.Getter;

@Getter
public class DuplicatePolicyException extends RuntimeException {

    private final String policyId;

    public DuplicatePolicyException(String policyId) {
        super("Policy already registered: " + policyId);
        this.policyId = policyId;
    }
}
