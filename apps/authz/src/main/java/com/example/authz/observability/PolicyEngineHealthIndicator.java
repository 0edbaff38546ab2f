package com.example.authz.observability;

import com.example.authz.abac.engine.PolicyEngine;
import com.example.authz.abac.model.PolicyRule;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports the loaded rule set. An engine without enabled rules denies every request,
 * which is reported as DOWN.
 */
@Component
public class PolicyEngineHealthIndicator implements HealthIndicator {

    private final PolicyEngine policyEngine;

    public PolicyEngineHealthIndicator(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @Override
    public Health health() {
        List<PolicyRule> policies = policyEngine.getPolicies();
        long enabled = policies.stream().filter(PolicyRule::enabled).count();

        Health.Builder builder = enabled > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("policies", policies.size())
                .withDetail("enabledPolicies", enabled)
                .build();
    }
}
