package io.springsecurity.requestmap.security.authz.manager;

import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import io.springsecurity.requestmap.security.authz.expression.AccessExpressionEvaluator;
import io.springsecurity.requestmap.security.authz.monitoring.PolicyDecisionMetrics;
import io.springsecurity.requestmap.security.authz.resolver.PolicyResolver;
import io.springsecurity.requestmap.security.exception.NoRuleConfiguredException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.web.util.UrlPathHelper;

import java.util.function.Supplier;

/**
 * 필터 체인의 anyRequest() 에 연결되는 인가 관리자.
 * <ul>
 *     <li>MATCHED: 규칙의 접근 조건을 평가</li>
 *     <li>DENIED_NO_RULE: 거부 (익명이면 인증 진입점, 아니면 403)</li>
 *     <li>CONFIGURATION_ERROR_NO_RULE: {@link NoRuleConfiguredException} (500)</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class RequestmapAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final PolicyResolver policyResolver;
    private final AccessExpressionEvaluator accessExpressionEvaluator;
    private final PolicyDecisionMetrics metrics;
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        HttpServletRequest request = context.getRequest();
        String path = urlPathHelper.getPathWithinApplication(request);
        PolicyDecision decision = policyResolver.resolve(HttpMethod.valueOf(request.getMethod()), path);

        switch (decision.getOutcome()) {
            case MATCHED -> {
                boolean granted = accessExpressionEvaluator.isGranted(decision.getAccessRequirement(), authentication, context);
                metrics.record(decision, granted);
                return new AuthorizationDecision(granted);
            }
            case DENIED_NO_RULE -> {
                metrics.record(decision, false);
                return new AuthorizationDecision(false);
            }
            default -> {
                metrics.record(decision, false);
                log.error("No authorization rule for {} {} and public invocations are rejected", request.getMethod(), path);
                throw new NoRuleConfiguredException(request.getMethod(), path);
            }
        }
    }
}
