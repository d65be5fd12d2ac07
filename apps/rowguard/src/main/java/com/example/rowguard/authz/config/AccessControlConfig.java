package com.example.rowguard.authz.config;

import com.example.rowguard.authz.engine.AccessPolicies;
import com.example.rowguard.authz.model.AccessRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the access policy from {@code app.access-control.policy}, falling back to the default
 * owner-attribute policy when none is configured.
 */
@Slf4j
@Configuration
public class AccessControlConfig {

    @Bean
    public List<AccessRule> accessPolicy(AccessControlProperties properties) {
        if (properties.policy().isEmpty()) {
            log.info("No access policy configured, using the default owner-attribute policy");
            return AccessPolicies.defaultPolicy();
        }

        List<AccessRule> policy = properties.policy().stream()
                .map(AccessControlProperties.RuleDefinition::toAccessRule)
                .toList();

        log.info("Loaded {} access rules from configuration", policy.size());
        for (int i = 0; i < policy.size(); i++) {
            AccessRule rule = policy.get(i);
            log.debug("  - rule {} ({}): {}", i, rule.isPermit() ? "permit" : "forbid",
                    rule.description() != null ? rule.description() : "");
        }
        return policy;
    }
}
