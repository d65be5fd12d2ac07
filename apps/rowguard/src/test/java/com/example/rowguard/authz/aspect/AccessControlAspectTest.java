package com.example.rowguard.authz.aspect;

import com.example.rowguard.authz.annotation.RequiresAccess;
import com.example.rowguard.authz.audit.AccessAuditEvent;
import com.example.rowguard.authz.audit.AccessAuditService;
import com.example.rowguard.authz.exception.AccessDeniedException;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.observability.metrics.AccessMetrics;
import com.example.rowguard.security.context.UserContextHolder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static com.example.rowguard.util.UserTestBuilder.aViewer;
import static com.example.rowguard.util.UserTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessControlAspect")
class AccessControlAspectTest {

    @Mock
    private AccessAuditService auditService;

    private SimpleMeterRegistry registry;
    private ReportService target;
    private ReportService reports;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        target = new ReportService();

        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.addAspect(new AccessControlAspect(new AccessMetrics(registry), auditService));
        reports = factory.getProxy();
    }

    private double decisions(String outcome) {
        return registry.get("access.route.decision").tag("outcome", outcome).counter().count();
    }

    @Nested
    @DisplayName("when the user is a method argument")
    class UserArgument {

        @Test
        @DisplayName("should invoke the method when the condition holds")
        void shouldInvokeWhenAllowed() {
            assertThat(reports.export(anAdmin(), "q3")).isEqualTo("report-q3");
            assertThat(decisions("allowed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should throw AccessDeniedException and skip the method when the condition fails")
        void shouldThrowWhenDenied() {
            assertThatThrownBy(() -> reports.export(aViewer(), "q3"))
                    .isInstanceOf(AccessDeniedException.class)
                    .hasMessage("Access denied to ReportService.export");

            assertThat(target.invocations.get()).isZero();
            assertThat(decisions("denied")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should deny owner-based conditions on routes")
        void shouldDenyOwnerConditions() {
            assertThatThrownBy(() -> reports.ownerOnly(anAdmin()))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("should write the decision to the audit log")
        void shouldAudit() {
            assertThatThrownBy(() -> reports.export(aViewer(), "q3"))
                    .isInstanceOf(AccessDeniedException.class);

            ArgumentCaptor<AccessAuditEvent> captor = ArgumentCaptor.forClass(AccessAuditEvent.class);
            verify(auditService).logDecision(captor.capture());
            AccessAuditEvent event = captor.getValue();
            assertThat(event.outcome()).isEqualTo(AccessAuditEvent.Outcome.DENY);
            assertThat(event.principal()).isEqualTo("viewer-user");
            assertThat(event.resourceId()).isEqualTo("ReportService.export");
            assertThat(event.condition()).isEqualTo("user with admin in roles");
        }
    }

    @Nested
    @DisplayName("when the user comes from the reactive context")
    class ReactiveContext {

        @Test
        @DisplayName("should emit the result of a Mono method for an allowed user")
        void shouldAllowMono() {
            StepVerifier.create(reports.purge("docs")
                            .contextWrite(UserContextHolder.withUser(anAdmin())))
                    .expectNext("purged docs")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should error a Mono method for a denied user without subscribing to it")
        void shouldDenyMono() {
            StepVerifier.create(reports.purge("docs")
                            .contextWrite(UserContextHolder.withUser(aViewer())))
                    .expectError(AccessDeniedException.class)
                    .verify();

            assertThat(target.invocations.get()).isZero();
        }

        @Test
        @DisplayName("should error when no user is in the context")
        void shouldDenyAnonymous() {
            StepVerifier.create(reports.purge("docs"))
                    .expectError(AccessDeniedException.class)
                    .verify();
        }

        @Test
        @DisplayName("should guard Flux methods")
        void shouldGuardFlux() {
            StepVerifier.create(reports.tables()
                            .contextWrite(UserContextHolder.withUser(anAdmin())))
                    .expectNext("docs", "notes")
                    .verifyComplete();

            StepVerifier.create(reports.tables()
                            .contextWrite(UserContextHolder.withUser(aViewer())))
                    .expectError(AccessDeniedException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("when the method is blocking and has no user argument")
    class NoUser {

        @Test
        @DisplayName("should deny")
        void shouldDeny() {
            assertThatThrownBy(() -> reports.stats())
                    .isInstanceOf(AccessDeniedException.class);
        }
    }

    static class ReportService {

        final AtomicInteger invocations = new AtomicInteger();

        @RequiresAccess("user with admin in roles")
        public String export(User user, String reportId) {
            invocations.incrementAndGet();
            return "report-" + reportId;
        }

        @RequiresAccess("user is owner")
        public String ownerOnly(User user) {
            invocations.incrementAndGet();
            return "owned";
        }

        @RequiresAccess("user with admin in roles")
        public Mono<String> purge(String table) {
            invocations.incrementAndGet();
            return Mono.just("purged " + table);
        }

        @RequiresAccess("user with admin in roles")
        public Flux<String> tables() {
            invocations.incrementAndGet();
            return Flux.just("docs", "notes");
        }

        @RequiresAccess("user with viewer not in roles")
        public int stats() {
            invocations.incrementAndGet();
            return 42;
        }
    }
}
