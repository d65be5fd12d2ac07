package com.example.rowguard.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Access control metrics.
 *
 * <p>A growing {@code sqlstore.rows.dropped} count means the SQL pre-filter returns rows the
 * policy later rejects, which is expected only for custom policies.
 */
@Component
public class AccessMetrics {

    private static final String OUTCOME_ALLOWED = "allowed";
    private static final String OUTCOME_DENIED = "denied";

    private final Counter routeAllowed;
    private final Counter routeDenied;

    private final Counter prefilterOptimized;
    private final Counter prefilterConservative;

    private final DistributionSummary rowsFetched;
    private final Counter rowsDropped;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.routeAllowed = Counter.builder("access.route.decision")
                .tag("outcome", OUTCOME_ALLOWED)
                .description("Route guard decisions that allowed the call")
                .register(registry);

        this.routeDenied = Counter.builder("access.route.decision")
                .tag("outcome", OUTCOME_DENIED)
                .description("Route guard decisions that denied the call")
                .register(registry);

        this.prefilterOptimized = Counter.builder("sqlstore.prefilter")
                .tag("mode", "optimized")
                .description("Reads filtered by the attribute-aware SQL predicate")
                .register(registry);

        this.prefilterConservative = Counter.builder("sqlstore.prefilter")
                .tag("mode", "conservative")
                .description("Reads filtered by the conservative SQL predicate")
                .register(registry);

        this.rowsFetched = DistributionSummary.builder("sqlstore.rows.fetched")
                .description("Rows returned by the SQL pre-filter per read")
                .baseUnit("rows")
                .register(registry);

        this.rowsDropped = Counter.builder("sqlstore.rows.dropped")
                .description("Rows removed by the policy evaluator after the SQL pre-filter")
                .register(registry);
    }

    public void recordRouteDecision(boolean allowed) {
        (allowed ? routeAllowed : routeDenied).increment();
    }

    public void recordPrefilter(boolean optimized) {
        (optimized ? prefilterOptimized : prefilterConservative).increment();
    }

    public void recordRowFiltering(int fetched, int dropped) {
        rowsFetched.record(fetched);
        if (dropped > 0) {
            rowsDropped.increment(dropped);
        }
    }
}
