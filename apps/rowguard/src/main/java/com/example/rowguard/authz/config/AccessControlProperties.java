package com.example.rowguard.authz.config;

import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Action;
import com.example.rowguard.authz.model.Scope;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Access control settings.
 *
 * <pre>
 * app:
 *   access-control:
 *     sql-optimization-enabled: true
 *     policy:
 *       - permit:
 *           actions: [read]
 *         when: ["user with admin in roles"]
 *         description: admins read everything
 * </pre>
 *
 * An empty {@code policy} selects the default owner-attribute policy.
 */
@ConfigurationProperties(prefix = "app.access-control")
public record AccessControlProperties(
        Boolean sqlOptimizationEnabled,
        List<RuleDefinition> policy,
        AuditProperties audit,
        HeaderAuthProperties headerAuth
) {
    public AccessControlProperties {
        if (sqlOptimizationEnabled == null) {
            sqlOptimizationEnabled = true;
        }
        if (policy == null) {
            policy = List.of();
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (headerAuth == null) {
            headerAuth = new HeaderAuthProperties(false, null, null);
        }
    }

    public record RuleDefinition(
            ScopeDefinition permit,
            ScopeDefinition forbid,
            List<String> when,
            List<String> unless,
            String description
    ) {
        public AccessRule toAccessRule() {
            return new AccessRule(
                    permit != null ? permit.toScope() : null,
                    forbid != null ? forbid.toScope() : null,
                    when,
                    unless,
                    description);
        }
    }

    public record ScopeDefinition(
            List<String> actions,
            String principal,
            String resource
    ) {
        public Scope toScope() {
            Set<Action> parsed = EnumSet.noneOf(Action.class);
            if (actions != null) {
                actions.forEach(action -> parsed.add(Action.fromValue(action)));
            }
            return new Scope(parsed, principal, resource);
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}

    public record HeaderAuthProperties(
            boolean enabled,
            String principalHeader,
            String attributesHeader
    ) {
        public HeaderAuthProperties {
            if (principalHeader == null || principalHeader.isBlank()) {
                principalHeader = "X-Authenticated-Principal";
            }
            if (attributesHeader == null || attributesHeader.isBlank()) {
                attributesHeader = "X-Authenticated-Attributes";
            }
        }
    }
}
