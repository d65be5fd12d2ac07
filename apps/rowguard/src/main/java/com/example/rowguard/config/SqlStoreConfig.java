package com.example.rowguard.config;

import com.example.rowguard.authz.config.AccessControlProperties;
import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.config.properties.SqlStoreProperties;
import com.example.rowguard.observability.metrics.AccessMetrics;
import com.example.rowguard.sqlstore.JdbcSqlStore;
import com.example.rowguard.sqlstore.SqlStore;
import com.example.rowguard.sqlstore.authorized.AccessControlWhereClauseBuilder;
import com.example.rowguard.sqlstore.authorized.AuthorizedSqlStore;
import com.example.rowguard.sqlstore.authorized.ReactiveAuthorizedSqlStore;
import com.example.rowguard.sqlstore.dialect.PostgresDialect;
import com.example.rowguard.sqlstore.dialect.SqlDialect;
import com.example.rowguard.sqlstore.dialect.SqliteDialect;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Locale;

@Slf4j
@Configuration
public class SqlStoreConfig {

    @Bean
    public SqlDialect sqlDialect(SqlStoreProperties properties) {
        String dialect = properties.dialect().trim().toLowerCase(Locale.ROOT);
        log.info("Using SQL dialect {}", dialect);
        return switch (dialect) {
            case SqliteDialect.NAME -> new SqliteDialect();
            case PostgresDialect.NAME, "postgresql" -> new PostgresDialect();
            default -> throw new IllegalArgumentException("Unsupported SQL dialect '" + properties.dialect() + "'");
        };
    }

    @Bean
    public SqlStore sqlStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SqlDialect dialect) {
        return new JdbcSqlStore(jdbcTemplate, objectMapper, dialect);
    }

    @Bean
    public AccessControlWhereClauseBuilder accessControlWhereClauseBuilder(
            SqlDialect dialect,
            AccessControlProperties properties) {
        return new AccessControlWhereClauseBuilder(dialect, properties.sqlOptimizationEnabled());
    }

    @Bean
    public AuthorizedSqlStore authorizedSqlStore(
            SqlStore sqlStore,
            AccessControlWhereClauseBuilder whereClauseBuilder,
            List<AccessRule> accessPolicy,
            AccessMetrics metrics) {
        return new AuthorizedSqlStore(sqlStore, whereClauseBuilder, accessPolicy, metrics);
    }

    @Bean
    public ReactiveAuthorizedSqlStore reactiveAuthorizedSqlStore(AuthorizedSqlStore authorizedSqlStore) {
        return new ReactiveAuthorizedSqlStore(authorizedSqlStore);
    }
}
