package com.example.authz.service;

import com.example.authz.abac.engine.PolicyEngine;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyDecision;
import com.example.authz.abac.model.PolicyRule;
import com.example.authz.audit.AuthzAuditService;
import com.example.authz.observability.AuthzMetrics;
import com.example.authz.rbac.RoleAuthority;
import com.example.authz.rbac.model.Permission;
import com.example.authz.rbac.model.Role;
import com.example.authz.util.AccessRequestTestBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.example.authz.util.AccessRequestTestBuilder.aRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessDecisionService")
class AccessDecisionServiceTest {

    @Mock
    private AuthzAuditService auditService;

    private SimpleMeterRegistry registry;
    private RoleAuthority roleAuthority;
    private PolicyEngine policyEngine;
    private AccessDecisionService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        roleAuthority = RoleAuthority.withDefaults();
        policyEngine = new PolicyEngine(roleAuthority,
                Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC), false, new ObjectMapper());
        policyEngine.addPolicy(PolicyRule.allow("us-claims", 100,
                Map.of("resource.region", "us"), List.of("claim:view", "claim:approve")));
        service = new AccessDecisionService(policyEngine, roleAuthority, new AuthzMetrics(registry), auditService);
    }

    private double counter(String name, String... tags) {
        return registry.get(name).tags(tags).counter().count();
    }

    @Nested
    @DisplayName("authorize")
    class Authorize {

        @Test
        @DisplayName("should emit the decision and audit it")
        void shouldEmitAndAudit() {
            AccessRequestTestBuilder request = aRequest();

            StepVerifier.create(service.authorize(request.user(), request.resource(), request.action(), request.context()))
                    .assertNext(decision -> {
                        assertThat(decision.isAllowed()).isTrue();
                        assertThat(decision.policyId()).isEqualTo("us-claims");
                    })
                    .verifyComplete();

            ArgumentCaptor<EvaluationContext> captor = ArgumentCaptor.forClass(EvaluationContext.class);
            verify(auditService).logDecision(captor.capture(), any(PolicyDecision.class));
            assertThat(captor.getValue().action()).isEqualTo("claim:view");
            assertThat(captor.getValue().user()).containsEntry("id", "u1");
        }

        @Test
        @DisplayName("should emit a deny for a region no rule covers")
        void shouldEmitDeny() {
            AccessRequestTestBuilder request = aRequest().withResource("region", "eu");

            StepVerifier.create(service.isAllowed(request.user(), request.resource(), request.action(), request.context()))
                    .expectNext(false)
                    .verifyComplete();

            verify(auditService).logDecision(any(EvaluationContext.class), eq(PolicyDecision.defaultDeny()));
        }

        @Test
        @DisplayName("should still emit the decision when auditing fails")
        void shouldSurviveAuditFailure() {
            doThrow(new IllegalStateException("log sink down"))
                    .when(auditService).logDecision(any(), any());
            AccessRequestTestBuilder request = aRequest();

            StepVerifier.create(service.isAllowed(request.user(), request.resource(), request.action(), request.context()))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should work without an audit service")
        void shouldWorkWithoutAudit() {
            AccessDecisionService unaudited =
                    new AccessDecisionService(policyEngine, roleAuthority, new AuthzMetrics(registry), null);
            AccessRequestTestBuilder request = aRequest().withRoles("viewer").withAction("claim:approve");

            StepVerifier.create(unaudited.authorize(request.user(), request.resource(), request.action(), null))
                    .assertNext(decision -> assertThat(decision.source()).isEqualTo(PolicyDecision.Source.RBAC_GATE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should evaluate lazily on subscription")
        void shouldEvaluateLazily() {
            AccessRequestTestBuilder request = aRequest();

            service.authorize(request.user(), request.resource(), request.action(), request.context());

            assertThat(registry.get("authz.evaluation").timer().count()).isZero();
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("should count decisions by result and source")
        void shouldCountDecisions() {
            AccessRequestTestBuilder allowed = aRequest();
            AccessRequestTestBuilder noRule = aRequest().withResource("region", "eu");
            AccessRequestTestBuilder gated = aRequest().withRoles("viewer").withAction("claim:approve");

            for (AccessRequestTestBuilder request : List.of(allowed, noRule, gated)) {
                service.authorize(request.user(), request.resource(), request.action(), request.context()).block();
            }

            assertThat(counter("authz.decision", "result", "allowed")).isEqualTo(1.0);
            assertThat(counter("authz.decision", "result", "denied")).isEqualTo(2.0);
            assertThat(counter("authz.rbac.rejected")).isEqualTo(1.0);
            assertThat(counter("authz.default.denied")).isEqualTo(1.0);
            assertThat(counter("authz.evaluation.errors")).isZero();
            assertThat(registry.get("authz.evaluation").timer().count()).isEqualTo(3);
        }

        @Test
        @DisplayName("should count evaluation errors")
        void shouldCountErrors() {
            PolicyEngine failingEngine = mock(PolicyEngine.class);
            when(failingEngine.decide(any(), any(), any(), any()))
                    .thenReturn(PolicyDecision.error("Evaluation failed: NullPointerException"));
            AccessDecisionService failing =
                    new AccessDecisionService(failingEngine, roleAuthority, new AuthzMetrics(registry), null);

            StepVerifier.create(failing.isAllowed(Map.of(), Map.of(), "claim:view", null))
                    .expectNext(false)
                    .verifyComplete();

            assertThat(counter("authz.evaluation.errors")).isEqualTo(1.0);
            assertThat(counter("authz.decision", "result", "denied")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("coarse checks")
    class CoarseChecks {

        @Test
        @DisplayName("checkPermission should accept role strings")
        void checkPermissionAcceptsStrings() {
            assertThat(service.checkPermission(List.of("user"), "claim", "edit")).isTrue();
            assertThat(service.checkPermission("viewer", "claim", "edit")).isFalse();
            assertThat(service.checkPermission(List.of(Role.ADMIN), "claim", "approve")).isTrue();
            assertThat(service.checkPermission(List.of("user"), "claim", "fly")).isFalse();
        }

        @Test
        @DisplayName("permissionsOf should include inherited permissions")
        void permissionsOfIncludesInherited() {
            assertThat(service.permissionsOf(List.of("viewer")))
                    .containsExactlyInAnyOrder(Permission.CLAIM_VIEW, Permission.MEMBER_VIEW, Permission.POLICY_VIEW);
            assertThat(service.permissionsOf(List.of("admin"))).contains(Permission.CLAIM_APPROVE);
            assertThat(service.permissionsOf(List.of("nobody"))).isEmpty();
        }
    }
}
