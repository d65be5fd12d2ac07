package com.example.rowguard.security.filter;

import com.example.rowguard.common.util.StringSanitizer;
import com.example.rowguard.security.context.UserContextHolder;
import com.example.rowguard.security.exception.AuthenticationException;
import com.example.rowguard.security.resolver.AuthenticatedUserResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Resolves the requesting user once per request and writes it into the Reactor context for
 * {@link UserContextHolder}. Anonymous requests pass through without a user; requests whose
 * credentials cannot be resolved get {@code 401}.
 */
@Slf4j
@Component
public class UserContextWebFilter implements WebFilter, Ordered {

    public static final int ORDER = -100;

    @Nullable
    private final AuthenticatedUserResolver userResolver;

    public UserContextWebFilter(ObjectProvider<AuthenticatedUserResolver> userResolver) {
        this.userResolver = userResolver.getIfAvailable();
        if (this.userResolver == null) {
            log.info("No AuthenticatedUserResolver configured, all requests are anonymous");
        }
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (userResolver == null) {
            return chain.filter(exchange);
        }
        return userResolver.resolve(exchange)
                .map(user -> Mono.defer(() -> chain.filter(exchange))
                        .contextWrite(UserContextHolder.withUser(user)))
                .defaultIfEmpty(Mono.defer(() -> chain.filter(exchange)))
                .onErrorResume(AuthenticationException.class, e -> Mono.just(reject(exchange, e)))
                .flatMap(Function.identity());
    }

    private static Mono<Void> reject(ServerWebExchange exchange, AuthenticationException e) {
        log.warn("Rejected request to {}: {}", StringSanitizer.forLog(exchange.getRequest().getPath().value()),
                StringSanitizer.forLog(e.getMessage()));
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        return exchange.getResponse().setComplete();
    }
}
