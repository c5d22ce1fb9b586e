package io.springsecurity.requestmap.security.authz.rule;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.util.Assert;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 규칙이 요구하는 접근 조건.
 * 권한 토큰 집합이거나, 외부 평가기에 위임되는 불리언 표현식이거나, 조건 없음(공개) 중 하나입니다.
 */
@Getter
@EqualsAndHashCode
public final class AccessRequirement {

    public enum Kind {
        AUTHORITIES,
        EXPRESSION,
        NONE
    }

    private static final AccessRequirement NONE = new AccessRequirement(Kind.NONE, Collections.emptySet(), null);

    private final Kind kind;
    private final Set<String> authorities;
    private final String expression;

    private AccessRequirement(Kind kind, Set<String> authorities, String expression) {
        this.kind = kind;
        this.authorities = authorities;
        this.expression = expression;
    }

    public static AccessRequirement authorities(Set<String> authorities) {
        Assert.notEmpty(authorities, "authorities must not be empty");
        return new AccessRequirement(Kind.AUTHORITIES, Collections.unmodifiableSet(new LinkedHashSet<>(authorities)), null);
    }

    public static AccessRequirement expression(String expression) {
        Assert.hasText(expression, "expression must not be empty");
        return new AccessRequirement(Kind.EXPRESSION, Collections.emptySet(), expression.trim());
    }

    public static AccessRequirement none() {
        return NONE;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case AUTHORITIES -> authorities.toString();
            case EXPRESSION -> expression;
            case NONE -> "<none>";
        };
    }
}
