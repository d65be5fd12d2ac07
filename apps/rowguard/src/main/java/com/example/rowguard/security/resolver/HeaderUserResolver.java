package com.example.rowguard.security.resolver;

import com.example.rowguard.authz.config.AccessControlProperties;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.common.util.StringSanitizer;
import com.example.rowguard.security.exception.AuthenticationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Trusts identity headers set by an authenticating gateway.
 *
 * <pre>
 * X-Authenticated-Principal: alice
 * X-Authenticated-Attributes: {"roles": ["admin"], "teams": ["ml"]}
 * </pre>
 *
 * Only enable behind a gateway that strips these headers from client requests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.access-control.header-auth.enabled", havingValue = "true")
public class HeaderUserResolver implements AuthenticatedUserResolver {

    private static final int MAX_ATTRIBUTES_LENGTH = 8192;
    private static final TypeReference<Map<String, List<String>>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String principalHeader;
    private final String attributesHeader;

    public HeaderUserResolver(ObjectMapper objectMapper, AccessControlProperties properties) {
        this.objectMapper = objectMapper;
        this.principalHeader = properties.headerAuth().principalHeader();
        this.attributesHeader = properties.headerAuth().attributesHeader();
    }

    @Override
    public Mono<User> resolve(ServerWebExchange exchange) {
        HttpHeaders headers = exchange.getRequest().getHeaders();

        String principal = StringSanitizer.headerValue(headers.getFirst(principalHeader));
        if (principal == null) {
            return Mono.empty();
        }

        String attributesJson = headers.getFirst(attributesHeader);
        if (attributesJson == null || attributesJson.isBlank()) {
            return Mono.just(User.anonymousPrincipal(principal));
        }
        if (attributesJson.length() > MAX_ATTRIBUTES_LENGTH) {
            return Mono.error(new AuthenticationException("Header " + attributesHeader + " is too large"));
        }

        try {
            Map<String, List<String>> attributes = objectMapper.readValue(attributesJson, ATTRIBUTES_TYPE);
            log.debug("Resolved principal {} from headers", StringSanitizer.forLog(principal));
            return Mono.just(new User(principal, attributes));
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed {} header for principal {}", attributesHeader,
                    StringSanitizer.forLog(principal));
            return Mono.error(new AuthenticationException("Malformed " + attributesHeader + " header", e));
        }
    }
}
