package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.security.context.UserContextHolder;
import com.example.rowguard.sqlstore.ColumnDefinition;
import com.example.rowguard.sqlstore.FetchQuery;
import com.example.rowguard.sqlstore.PaginatedResult;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Reactive front for {@link AuthorizedSqlStore}.
 *
 * <p>The requesting user is read from the subscriber context (see {@link UserContextHolder});
 * JDBC work runs on the bounded elastic scheduler.
 */
@RequiredArgsConstructor
public class ReactiveAuthorizedSqlStore {

    private final AuthorizedSqlStore delegate;

    public Mono<Void> createTableWithAccessControl(String table, Map<String, ColumnDefinition> schema) {
        return Mono.fromRunnable(() -> delegate.createTableWithAccessControl(table, schema))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public Mono<Void> insert(String table, Map<String, Object> data) {
        return withUser(user -> blocking(() -> {
            delegate.insert(user, table, data);
            return Boolean.TRUE;
        })).then();
    }

    public Mono<PaginatedResult> fetchAll(String table, FetchQuery query) {
        return withUser(user -> blocking(() -> delegate.fetchAll(user, table, query)));
    }

    public Mono<PaginatedResult> fetchAll(String table, List<AccessRule> policy, FetchQuery query) {
        return withUser(user -> blocking(() -> delegate.fetchAll(user, table, policy, query)));
    }

    /**
     * Emits the first readable row, or completes empty.
     */
    public Mono<Map<String, Object>> fetchOne(String table, FetchQuery query) {
        return withUser(user -> blocking(() -> delegate.fetchOne(user, table, query)));
    }

    public Mono<Map<String, Object>> fetchOne(String table, List<AccessRule> policy, FetchQuery query) {
        return withUser(user -> blocking(() -> delegate.fetchOne(user, table, policy, query)));
    }

    public Mono<Integer> update(String table, Map<String, Object> data, Map<String, Object> where) {
        return withUser(user -> blocking(() -> delegate.update(user, table, data, where)));
    }

    public Mono<Integer> delete(String table, Map<String, Object> where) {
        return withUser(user -> blocking(() -> delegate.delete(user, table, where)));
    }

    private static <T> Mono<T> withUser(Function<User, Mono<T>> operation) {
        return UserContextHolder.getOptionalUser()
                .flatMap(user -> operation.apply(user.orElse(null)));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
