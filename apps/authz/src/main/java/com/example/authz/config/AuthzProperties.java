package com.example.authz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "authz")
public record AuthzProperties(
        EngineProperties engine,
        AbacProperties abac,
        AuditProperties audit
) {
    public AuthzProperties {
        if (engine == null) {
            engine = new EngineProperties(false, null);
        }
        if (abac == null) {
            abac = new AbacProperties(null);
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    /**
     * @param enforceResourcePatterns Also filter rules by resource pattern; off by default
     * @param zone                    Time zone of the synthesized request context
     */
    public record EngineProperties(
            boolean enforceResourcePatterns,
            String zone
    ) {
        public EngineProperties {
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
        }
    }

    /**
     * @param policyLocation Spring resource location of the initial policy document
     */
    public record AbacProperties(
            String policyLocation
    ) {
        public AbacProperties {
            if (policyLocation == null || policyLocation.isBlank()) {
                policyLocation = "classpath:config/abac-policies.yml";
            }
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}
}
