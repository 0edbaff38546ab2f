package com.example.authz.observability;

import com.example.authz.abac.model.PolicyDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Authorization decision metrics. Tags are bounded to decision and source values.
 */
@Component
public class AuthzMetrics {

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter rbacRejected;
    private final Counter defaultDenied;
    private final Counter evaluationErrors;
    private final Timer evaluationTimer;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.decisionAllowed = Counter.builder("authz.decision")
                .tag("result", "allowed")
                .description("Authorization decisions that allowed access")
                .register(registry);

        this.decisionDenied = Counter.builder("authz.decision")
                .tag("result", "denied")
                .description("Authorization decisions that denied access")
                .register(registry);

        this.rbacRejected = Counter.builder("authz.rbac.rejected")
                .description("Requests rejected by the coarse role gate")
                .register(registry);

        this.defaultDenied = Counter.builder("authz.default.denied")
                .description("Requests denied because no policy matched")
                .register(registry);

        this.evaluationErrors = Counter.builder("authz.evaluation.errors")
                .description("Evaluations that failed and were denied")
                .register(registry);

        this.evaluationTimer = Timer.builder("authz.evaluation")
                .description("Time spent evaluating access requests")
                .register(registry);
    }

    public Timer.Sample startEvaluation() {
        return Timer.start();
    }

    public void recordDecision(@NonNull PolicyDecision decision, @NonNull Timer.Sample sample) {
        sample.stop(evaluationTimer);

        if (decision.isAllowed()) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }

        switch (decision.source()) {
            case RBAC_GATE -> rbacRejected.increment();
            case DEFAULT -> defaultDenied.increment();
            case ERROR -> evaluationErrors.increment();
            case POLICY -> {
                // counted by the allowed/denied counters
            }
        }
    }
}
