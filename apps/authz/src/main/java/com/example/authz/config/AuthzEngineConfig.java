package com.example.authz.config;

import com.example.authz.abac.engine.PolicyEngine;
import com.example.authz.abac.policy.PolicyDefinitionLoader;
import com.example.authz.rbac.RoleAuthority;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Composition root for the authorization engine. One role authority and one policy
 * engine per application context; the engine starts with the rules of the configured
 * policy document.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthzProperties.class)
public class AuthzEngineConfig {

    @Bean
    public Clock authzClock(AuthzProperties properties) {
        return Clock.system(ZoneId.of(properties.engine().zone()));
    }

    @Bean
    public RoleAuthority roleAuthority() {
        return RoleAuthority.withDefaults();
    }

    @Bean
    public PolicyDefinitionLoader policyDefinitionLoader(Validator validator) {
        return new PolicyDefinitionLoader(validator);
    }

    @Bean
    public PolicyEngine policyEngine(
            RoleAuthority roleAuthority,
            Clock authzClock,
            ObjectMapper objectMapper,
            PolicyDefinitionLoader loader,
            ResourceLoader resourceLoader,
            AuthzProperties properties) {

        PolicyEngine engine = new PolicyEngine(roleAuthority, authzClock,
                properties.engine().enforceResourcePatterns(), objectMapper);

        String location = properties.abac().policyLocation();
        engine.reload(loader.load(resourceLoader.getResource(location)));

        log.info("Policy engine ready: {} policies from {}, enforceResourcePatterns={}, zone={}",
                engine.getPolicies().size(), location,
                properties.engine().enforceResourcePatterns(), properties.engine().zone());
        return engine;
    }
}
