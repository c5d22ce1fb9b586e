package io.springsecurity.requestmap.security.authz.expression;

import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.function.Supplier;

/**
 * 접근 조건을 호출자의 인증 상태에 대해 평가하는 협력자.
 * 예약 토큰의 표현식 변환은 이 계층에서만 일어납니다.
 */
public interface AccessExpressionEvaluator {

    boolean isGranted(AccessRequirement requirement, Supplier<Authentication> authentication,
                      RequestAuthorizationContext context);
}
