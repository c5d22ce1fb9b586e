package io.springsecurity.requestmap.security.authz.rule;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.springframework.http.HttpMethod;

/**
 * 정규화된 인가 규칙 (URL 패턴, 선택적 HTTP 메서드, 접근 조건).
 * 발행된 이후에는 변경되지 않습니다.
 */
@Getter
@Builder
@EqualsAndHashCode
public final class RequestRule {

    @NonNull
    private final String pattern;

    /** null 이면 모든 메서드에 적용 */
    private final HttpMethod httpMethod;

    @NonNull
    private final AccessRequirement accessRequirement;

    @NonNull
    private final RuleOrigin origin;

    /** 소스 내 선언 순서 */
    private final int declarationIndex;

    public boolean isCaseNormalized() {
        return origin.isLowercasePatterns();
    }

    public boolean appliesTo(HttpMethod method) {
        return httpMethod == null || httpMethod.equals(method);
    }

    public String describe() {
        return String.format("%s rule #%d [%s %s]", origin, declarationIndex,
                httpMethod == null ? "*" : httpMethod.name(), pattern);
    }

    @Override
    public String toString() {
        return describe() + " -> " + accessRequirement;
    }
}
