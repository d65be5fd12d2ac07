package com.example.rowguard.config.properties;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param dialect SQL dialect of the configured data source: {@code sqlite} or {@code postgres}
 */
@Validated
@ConfigurationProperties(prefix = "app.sqlstore")
public record SqlStoreProperties(
        @Pattern(regexp = "(?i)sqlite|postgres|postgresql", message = "must be sqlite or postgres")
        String dialect
) {
    public SqlStoreProperties {
        if (dialect == null || dialect.isBlank()) {
            dialect = "sqlite";
        }
    }
}
