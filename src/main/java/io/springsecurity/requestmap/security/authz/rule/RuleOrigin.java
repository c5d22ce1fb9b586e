package io.springsecurity.requestmap.security.authz.rule;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 규칙이 어느 소스에서 왔는지. 명시도가 같은 규칙 사이에서는 rank 가 낮은 소스가 우선합니다.
 */
@Getter
@RequiredArgsConstructor
public enum RuleOrigin {

    STATIC_DECLARATION(0, false),
    CONFIGURATION_MAP(1, true),
    DYNAMIC_STORE(2, true);

    private final int rank;

    /** 패턴을 소문자로 정규화하는 소스인지 여부 */
    private final boolean lowercasePatterns;
}
