package io.springsecurity.requestmap.security.exception;

/**
 * 인가 규칙 구성이 잘못되었을 때 던져지는 예외.
 * 기동 시점(규칙 로딩, 소스 선택)에 발생하며 애플리케이션 기동을 중단시킵니다.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
