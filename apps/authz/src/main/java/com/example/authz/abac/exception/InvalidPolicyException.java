package com.example.authz.abac.exception;

import lombok.Getter;

/**
 * A policy definition or update payload carries a value of the wrong shape.
 */
@Getter
public class InvalidPolicyException extends RuntimeException {

    private final String policyId;

    public InvalidPolicyException(String policyId, String message) {
        super(message + (policyId != null ? " (policy=" + policyId + ")" : ""));
        this.policyId = policyId;
    }

    public InvalidPolicyException(String policyId, String message, Throwable cause) {
        super(message + (policyId != null ? " (policy=" + policyId + ")" : ""), cause);
        this.policyId = policyId;
    }
}
