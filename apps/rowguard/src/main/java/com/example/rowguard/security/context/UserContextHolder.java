package com.example.rowguard.security.context;

import com.example.rowguard.authz.model.User;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.Optional;
import java.util.function.Function;

/**
 * Request-scoped access to the authenticated {@link User} through the Reactor {@link Context}.
 *
 * <p>The user travels with the subscription, so concurrent requests never see each other's
 * identity.
 */
public final class UserContextHolder {

    private static final String USER_KEY = User.class.getName();

    private UserContextHolder() {
        // Utility class
    }

    /**
     * The current user, or an empty Mono for anonymous requests.
     */
    public static Mono<User> getUserIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(USER_KEY)) {
                return Mono.just(ctx.get(USER_KEY));
            }
            return Mono.empty();
        });
    }

    /**
     * The current user as an {@link Optional}; always emits exactly one value.
     */
    public static Mono<Optional<User>> getOptionalUser() {
        return getUserIfPresent()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    public static Function<Context, Context> withUser(User user) {
        return context -> context.put(USER_KEY, user);
    }
}
