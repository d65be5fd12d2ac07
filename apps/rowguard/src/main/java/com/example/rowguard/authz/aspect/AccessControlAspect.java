package com.example.rowguard.authz.aspect;

import com.example.rowguard.authz.annotation.RequiresAccess;
import com.example.rowguard.authz.audit.AccessAuditEvent;
import com.example.rowguard.authz.audit.AccessAuditService;
import com.example.rowguard.authz.exception.AccessDeniedException;
import com.example.rowguard.authz.guard.RouteAccessGuard;
import com.example.rowguard.authz.model.ApiResource;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.common.util.StringSanitizer;
import com.example.rowguard.observability.metrics.AccessMetrics;
import com.example.rowguard.security.context.UserContextHolder;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;

/**
 * Aspect that enforces {@link RequiresAccess} annotations through {@link RouteAccessGuard}.
 */
@Aspect
@Component
@Order(1)
public class AccessControlAspect {

    private static final Logger log = LoggerFactory.getLogger(AccessControlAspect.class);

    private final AccessMetrics metrics;

    @Nullable
    private final AccessAuditService auditService;

    public AccessControlAspect(AccessMetrics metrics, @Nullable AccessAuditService auditService) {
        this.metrics = metrics;
        this.auditService = auditService;
    }

    @Around("@annotation(requiresAccess)")
    public Object checkAccess(ProceedingJoinPoint joinPoint, RequiresAccess requiresAccess) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        String route = method.getDeclaringClass().getSimpleName() + "." + method.getName();
        String condition = requiresAccess.value();
        Class<?> returnType = method.getReturnType();

        User argumentUser = extractUser(joinPoint.getArgs());
        boolean reactive = Mono.class.isAssignableFrom(returnType) || Flux.class.isAssignableFrom(returnType);

        if (argumentUser != null || !reactive) {
            if (!decide(condition, route, argumentUser)) {
                throw denied(route, argumentUser);
            }
            return joinPoint.proceed();
        }

        Mono<Void> guard = UserContextHolder.getOptionalUser()
                .flatMap(user -> decide(condition, route, user.orElse(null))
                        ? Mono.<Void>empty()
                        : Mono.error(denied(route, user.orElse(null))));

        if (Flux.class.isAssignableFrom(returnType)) {
            return guard.thenMany(Flux.defer(() -> proceedReactive(joinPoint)));
        }
        return guard.then(Mono.defer(() -> Mono.from(proceedReactive(joinPoint))));
    }

    private boolean decide(String condition, String route, @Nullable User user) {
        boolean allowed = RouteAccessGuard.isAllowed(condition, route, user);
        metrics.recordRouteDecision(allowed);

        if (allowed) {
            log.debug("Access granted to {} for principal {}", route,
                    StringSanitizer.forLog(user != null ? user.principal() : null));
        } else {
            log.warn("Access denied to {} for principal {}", route,
                    StringSanitizer.forLog(user != null ? user.principal() : null));
        }

        if (auditService != null) {
            auditService.logDecision(AccessAuditEvent.of(
                    allowed ? AccessAuditEvent.Outcome.ALLOW : AccessAuditEvent.Outcome.DENY,
                    user != null ? user.principal() : null,
                    ApiResource.TYPE,
                    route,
                    condition,
                    reasonFor(allowed, user)));
        }
        return allowed;
    }

    private static String reasonFor(boolean allowed, @Nullable User user) {
        if (allowed) {
            return "Condition satisfied";
        }
        return user == null ? "No authenticated user" : "Condition not satisfied";
    }

    private static AccessDeniedException denied(String route, @Nullable User user) {
        return new AccessDeniedException(
                "Access denied to " + route,
                user != null ? user.principal() : null,
                route);
    }

    @Nullable
    private static User extractUser(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof User user) {
                return user;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Publisher<Object> proceedReactive(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result == null) {
                return Mono.empty();
            }
            return (Publisher<Object>) result;
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }
}
