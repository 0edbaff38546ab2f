package com.example.authz.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.authz.abac.model.PolicyDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.example.authz.util.AccessRequestTestBuilder.aRequest;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthzAuditService")
class AuthzAuditServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AuthzAuditService auditService = new AuthzAuditService(objectMapper,
            Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC));

    private Logger auditLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        auditLogger = (Logger) LoggerFactory.getLogger("AUTHZ_AUDIT");
        appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        auditLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("denials should be logged as JSON at WARN")
    void denialsAreWarnings() throws Exception {
        auditService.logDecision(aRequest().withContext("correlation_id", "corr-9").build(),
                PolicyDecision.defaultDeny());

        assertThat(appender.list).hasSize(1);
        ILoggingEvent logged = appender.list.get(0);
        assertThat(logged.getLevel()).isEqualTo(Level.WARN);

        JsonNode json = objectMapper.readTree(logged.getFormattedMessage());
        assertThat(json.get("outcome").asText()).isEqualTo("DENY");
        assertThat(json.get("correlation_id").asText()).isEqualTo("corr-9");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-15T10:00:00Z");
        assertThat(json.get("roles").get(0).asText()).isEqualTo("user");
    }

    @Test
    @DisplayName("evaluation faults should be logged at ERROR")
    void faultsAreErrors() {
        auditService.logDecision(aRequest().build(), PolicyDecision.error("boom"));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.ERROR);
    }

    @Test
    @DisplayName("log values should be stripped of line breaks and truncated")
    void forLogSanitizes() {
        assertThat(AuthzAuditService.forLog("user\r\nFORGED entry\t")).isEqualTo("userFORGED entry");
        assertThat(AuthzAuditService.forLog(null)).isEqualTo("null");
        assertThat(AuthzAuditService.forLog("x".repeat(100))).hasSize(64);
    }
}
