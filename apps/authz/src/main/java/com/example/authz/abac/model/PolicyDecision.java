package com.example.authz.abac.model;

/**
 * Result of an authorization evaluation.
 */
public record PolicyDecision(
        Decision decision,
        Source source,
        String policyId,
        String reason
) {
    public enum Decision {
        ALLOW,
        DENY
    }

    /**
     * Which stage of the evaluation produced the decision.
     */
    public enum Source {
        RBAC_GATE,  // coarse role check rejected the request
        POLICY,     // an ABAC rule matched
        DEFAULT,    // no rule matched
        ERROR       // evaluation fault, fails closed
    }

    public static final String DEFAULT_DENY = "DEFAULT_DENY";
    public static final String RBAC_DENY = "RBAC_DENY";
    public static final String EVALUATION_ERROR = "EVALUATION_ERROR";

    public static PolicyDecision fromRule(PolicyRule rule) {
        Decision decision = rule.isAllow() ? Decision.ALLOW : Decision.DENY;
        return new PolicyDecision(decision, Source.POLICY, rule.id(),
                String.format("Matched policy '%s' (priority=%d)", rule.name(), rule.priority()));
    }

    public static PolicyDecision rbacDeny(String reason) {
        return new PolicyDecision(Decision.DENY, Source.RBAC_GATE, RBAC_DENY, reason);
    }

    public static PolicyDecision defaultDeny() {
        return new PolicyDecision(Decision.DENY, Source.DEFAULT, DEFAULT_DENY,
                "No policy granted access for this request");
    }

    public static PolicyDecision error(String reason) {
        return new PolicyDecision(Decision.DENY, Source.ERROR, EVALUATION_ERROR, reason);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }
}
