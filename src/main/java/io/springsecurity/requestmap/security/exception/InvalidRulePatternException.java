package io.springsecurity.requestmap.security.exception;

import lombok.Getter;

/**
 * 규칙의 URL 패턴이 Ant 스타일 문법을 따르지 않을 때 던져지는 예외.
 */
@Getter
public class InvalidRulePatternException extends RuleConfigurationException {

    private final String pattern;

    public InvalidRulePatternException(String pattern, String ruleDescription, String reason) {
        super(String.format("Invalid URL pattern '%s' in %s: %s", pattern, ruleDescription, reason));
        this.pattern = pattern;
    }
}
