package io.springsecurity.requestmap.security.authz.matcher;

import io.springsecurity.requestmap.security.exception.InvalidRulePatternException;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StringUtils;

/**
 * Ant 스타일 glob 패턴 매칭과 명시도 계산.
 * <p>
 * '?' 는 구분자가 아닌 한 글자, '*' 는 한 세그먼트 안의 0개 이상 글자, '**' 는 0개 이상의 세그먼트에 대응합니다.
 * 매칭은 대소문자를 구분하며, 소문자 정규화가 필요한 규칙이라면 호출자가 요청 경로를 미리 소문자로 바꿔야 합니다.
 */
public class AntPathRuleMatcher {

    private static final String SEPARATOR = "/";

    private final AntPathMatcher delegate;

    public AntPathRuleMatcher() {
        this.delegate = new AntPathMatcher(SEPARATOR);
        this.delegate.setCaseSensitive(true);
        this.delegate.setTrimTokens(false);
        this.delegate.setCachePatterns(true);
    }

    public boolean match(String pattern, String requestPath) {
        if (requestPath == null) {
            return false;
        }
        return delegate.match(pattern, requestPath);
    }

    public RuleSpecificity specificity(String pattern) {
        int literalPrefix = 0;
        while (literalPrefix < pattern.length() && !isWildcard(pattern.charAt(literalPrefix))) {
            literalPrefix++;
        }

        int wildcardSegments = 0;
        for (String segment : StringUtils.tokenizeToStringArray(pattern, SEPARATOR)) {
            if (hasWildcard(segment)) {
                wildcardSegments++;
            }
        }
        return new RuleSpecificity(literalPrefix, wildcardSegments);
    }

    /**
     * 로딩 시점 문법 검사. 잘못된 패턴은 어떤 규칙인지 밝혀 즉시 실패시킵니다.
     */
    public void validate(String pattern, String ruleDescription) {
        if (!StringUtils.hasText(pattern)) {
            throw new InvalidRulePatternException(String.valueOf(pattern), ruleDescription, "pattern must not be empty");
        }
        if (!pattern.startsWith(SEPARATOR)) {
            throw new InvalidRulePatternException(pattern, ruleDescription, "pattern must start with '/'");
        }
        for (char c : pattern.toCharArray()) {
            if (Character.isWhitespace(c)) {
                throw new InvalidRulePatternException(pattern, ruleDescription, "pattern must not contain whitespace");
            }
        }
        for (String segment : pattern.split(SEPARATOR, -1)) {
            if (segment.contains("**") && !segment.equals("**")) {
                throw new InvalidRulePatternException(pattern, ruleDescription,
                        "'**' must occupy a whole path segment but found '" + segment + "'");
            }
        }
        int depth = 0;
        for (char c : pattern.toCharArray()) {
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    break;
                }
            }
        }
        if (depth != 0) {
            throw new InvalidRulePatternException(pattern, ruleDescription, "unbalanced '{' '}' in pattern");
        }
    }

    private static boolean hasWildcard(String segment) {
        for (char c : segment.toCharArray()) {
            if (isWildcard(c)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWildcard(char c) {
        return c == '*' || c == '?' || c == '{';
    }
}
