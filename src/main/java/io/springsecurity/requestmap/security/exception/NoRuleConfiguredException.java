package io.springsecurity.requestmap.security.exception;

import lombok.Getter;

/**
 * 요청에 맞는 규칙이 없고 rejectPublicInvocations 가 켜져 있을 때 던져지는 예외.
 * 인가 거부(403)가 아니라 설정 누락을 뜻하므로 서버 오류(500)로 처리되어야 합니다.
 */
@Getter
public class NoRuleConfiguredException extends RuntimeException {

    private final String method;
    private final String path;

    public NoRuleConfiguredException(String method, String path) {
        super(String.format("No authorization rule configured for %s %s and public invocations are rejected", method, path));
        this.method = method;
        this.path = path;
    }
}
