package io.springsecurity.requestmap.security.authz.rule;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * 권한 집합에 쓸 수 있는 예약 토큰과 그에 대응하는 SpEL 표현식.
 * 규칙에는 토큰 그대로 저장되고 변환은 평가기(AccessExpressionEvaluator)에서만 일어납니다.
 */
@Getter
@RequiredArgsConstructor
public enum ReservedAccessToken {

    ANY_AUTHENTICATED_ANONYMOUS("permitAll"),
    ANY_AUTHENTICATED_REMEMBERED("isAuthenticated() or isRememberMe()"),
    ANY_AUTHENTICATED_FULL("isFullyAuthenticated()");

    private final String equivalentExpression;

    public static Optional<ReservedAccessToken> fromToken(String token) {
        return Arrays.stream(values())
                .filter(reserved -> reserved.name().equals(token))
                .findFirst();
    }
}
