package io.springsecurity.requestmap.security.exception;

import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import lombok.Getter;

/**
 * 규칙 저장소에 접근할 수 없어 규칙 목록을 만들 수 없을 때 던져지는 예외.
 * 이전 스냅샷이나 빈 목록으로 대체하지 않습니다. fail-open / fail-closed 판단은 호출자의 몫입니다.
 */
@Getter
public class RuleSourceUnavailableException extends RuntimeException {

    private final RuleOrigin origin;

    public RuleSourceUnavailableException(RuleOrigin origin, String message, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }
}
