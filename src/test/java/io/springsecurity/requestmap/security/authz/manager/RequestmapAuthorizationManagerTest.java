package io.springsecurity.requestmap.security.authz.manager;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import io.springsecurity.requestmap.security.authz.expression.AccessExpressionEvaluator;
import io.springsecurity.requestmap.security.authz.monitoring.PolicyDecisionMetrics;
import io.springsecurity.requestmap.security.authz.resolver.PolicyResolver;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import io.springsecurity.requestmap.security.exception.NoRuleConfiguredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.Set;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequestmapAuthorizationManagerTest {

    @Mock
    private PolicyResolver policyResolver;

    @Mock
    private AccessExpressionEvaluator accessExpressionEvaluator;

    private SimpleMeterRegistry meterRegistry;
    private RequestmapAuthorizationManager manager;
    private final Supplier<Authentication> authentication = () -> new TestingAuthenticationToken("user", "pw", "ROLE_USER");

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        manager = new RequestmapAuthorizationManager(policyResolver, accessExpressionEvaluator,
                new PolicyDecisionMetrics(meterRegistry));
    }

    @Test
    @DisplayName("매칭된 규칙의 조건을 평가기에 위임한다 (컨텍스트 경로 제외)")
    void matchedRuleIsEvaluated() {
        AccessRequirement requirement = AccessRequirement.authorities(Set.of("ROLE_ADMIN"));
        when(policyResolver.resolve(HttpMethod.GET, "/admin/users"))
                .thenReturn(PolicyDecision.matched(requirement, null));
        when(accessExpressionEvaluator.isGranted(eq(requirement), any(), any())).thenReturn(false);

        AuthorizationDecision decision = manager.check(authentication, context("GET", "/app", "/app/admin/users"));

        assertThat(decision.isGranted()).isFalse();
        assertThat(meterRegistry.get("requestmap.policy.decision").tag("outcome", "MATCHED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("DENIED_NO_RULE 은 평가 없이 거부된다")
    void deniedNoRuleIsDenied() {
        when(policyResolver.resolve(HttpMethod.GET, "/user/list")).thenReturn(PolicyDecision.deniedNoRule());

        AuthorizationDecision decision = manager.check(authentication, context("GET", "", "/user/list"));

        assertThat(decision.isGranted()).isFalse();
        verifyNoInteractions(accessExpressionEvaluator);
    }

    @Test
    @DisplayName("CONFIGURATION_ERROR_NO_RULE 은 거부가 아닌 NoRuleConfiguredException 으로 드러난다")
    void configurationErrorIsDistinctFailure() {
        when(policyResolver.resolve(HttpMethod.POST, "/thing/register")).thenReturn(PolicyDecision.configurationErrorNoRule());

        assertThatThrownBy(() -> manager.check(authentication, context("POST", "", "/thing/register")))
                .isInstanceOf(NoRuleConfiguredException.class)
                .hasMessageContaining("POST /thing/register");
        verifyNoInteractions(accessExpressionEvaluator);
    }

    @Test
    @DisplayName("잠금 정책이 공개를 허용한 경우 평가기가 조건 없음으로 허용한다")
    void publicAccessFromLockdown() {
        when(policyResolver.resolve(HttpMethod.GET, "/open")).thenReturn(PolicyDecision.matched(AccessRequirement.none(), null));
        when(accessExpressionEvaluator.isGranted(eq(AccessRequirement.none()), any(), any())).thenReturn(true);

        assertThat(manager.check(authentication, context("GET", "", "/open")).isGranted()).isTrue();
        verify(accessExpressionEvaluator).isGranted(eq(AccessRequirement.none()), any(), any());
    }

    private RequestAuthorizationContext context(String method, String contextPath, String requestUri) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, requestUri);
        request.setContextPath(contextPath);
        return new RequestAuthorizationContext(request);
    }
}
