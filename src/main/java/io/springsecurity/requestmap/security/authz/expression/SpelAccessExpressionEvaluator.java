package io.springsecurity.requestmap.security.authz.expression;

import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import io.springsecurity.requestmap.security.authz.rule.ReservedAccessToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ParseException;
import org.springframework.security.access.expression.ExpressionUtils;
import org.springframework.security.access.expression.SecurityExpressionHandler;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.expression.DefaultHttpSecurityExpressionHandler;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Spring Security 웹 SpEL 로 접근 조건을 평가합니다.
 * <p>
 * 권한 집합은 항목 중 하나라도 만족하면 허용(OR)되며, 예약 토큰은 대응 표현식으로, 나머지는 hasAuthority(..) 로 변환됩니다.
 * 파싱된 표현식은 문자열 단위로 재사용합니다.
 */
@Slf4j
public class SpelAccessExpressionEvaluator implements AccessExpressionEvaluator {

    private final SecurityExpressionHandler<RequestAuthorizationContext> expressionHandler;
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    public SpelAccessExpressionEvaluator() {
        this(new DefaultHttpSecurityExpressionHandler());
    }

    public SpelAccessExpressionEvaluator(SecurityExpressionHandler<RequestAuthorizationContext> expressionHandler) {
        this.expressionHandler = expressionHandler;
    }

    @Override
    public boolean isGranted(AccessRequirement requirement, Supplier<Authentication> authentication,
                             RequestAuthorizationContext context) {
        if (requirement.isNone()) {
            return true;
        }
        String expressionString = toExpression(requirement);
        Expression expression = expressionCache.computeIfAbsent(expressionString, this::parse);
        EvaluationContext evaluationContext = expressionHandler.createEvaluationContext(authentication, context);
        boolean granted = ExpressionUtils.evaluateAsBoolean(expression, evaluationContext);
        log.trace("Evaluated '{}' -> {}", expressionString, granted);
        return granted;
    }

    public static String toExpression(AccessRequirement requirement) {
        return switch (requirement.getKind()) {
            case EXPRESSION -> requirement.getExpression();
            case NONE -> "permitAll";
            case AUTHORITIES -> requirement.getAuthorities().stream()
                    .map(SpelAccessExpressionEvaluator::tokenToExpression)
                    .collect(Collectors.joining(" or "));
        };
    }

    private static String tokenToExpression(String token) {
        return ReservedAccessToken.fromToken(token)
                .map(reserved -> "(" + reserved.getEquivalentExpression() + ")")
                .orElseGet(() -> "hasAuthority('" + token.replace("'", "''") + "')");
    }

    private Expression parse(String expressionString) {
        try {
            return expressionHandler.getExpressionParser().parseExpression(expressionString);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Failed to parse access expression: " + expressionString, e);
        }
    }
}
