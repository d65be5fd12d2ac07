package com.example.rowguard.security.resolver;

import com.example.rowguard.authz.model.User;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Produces the authenticated {@link User} of a request.
 *
 * <p>Token validation and identity-provider exchanges happen behind this interface. Completes
 * empty for anonymous requests and errors with
 * {@link com.example.rowguard.security.exception.AuthenticationException} for rejected
 * credentials.
 */
@FunctionalInterface
public interface AuthenticatedUserResolver {

    Mono<User> resolve(ServerWebExchange exchange);
}
