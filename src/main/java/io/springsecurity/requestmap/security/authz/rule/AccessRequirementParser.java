package io.springsecurity.requestmap.security.authz.rule;

import io.springsecurity.requestmap.security.exception.RuleConfigurationException;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 설정/저장소에 적힌 access 값을 {@link AccessRequirement} 로 정규화합니다.
 * <ul>
 *     <li>권한 이름과 예약 토큰 목록 → 권한 집합</li>
 *     <li>단일 표현식 ("isAuthenticated()", "permitAll" 등) → 표현식</li>
 * </ul>
 * 표현식과 다른 항목을 섞는 것은 허용되지 않습니다.
 */
public final class AccessRequirementParser {

    private static final Set<String> BARE_EXPRESSIONS = Set.of("permitAll", "denyAll");

    private AccessRequirementParser() {
    }

    public static AccessRequirement parse(List<String> access, String ruleDescription) {
        List<String> entries = new ArrayList<>();
        if (access != null) {
            for (String entry : access) {
                if (StringUtils.hasText(entry)) {
                    entries.add(entry.trim());
                }
            }
        }
        if (entries.isEmpty()) {
            throw new RuleConfigurationException("No access requirement declared for " + ruleDescription);
        }

        boolean hasExpression = entries.stream().anyMatch(AccessRequirementParser::isExpression);
        if (hasExpression) {
            if (entries.size() > 1) {
                throw new RuleConfigurationException(String.format(
                        "Cannot combine an access expression with other entries %s in %s; combine them into one expression",
                        entries, ruleDescription));
            }
            return AccessRequirement.expression(entries.get(0));
        }
        Set<String> authorities = new LinkedHashSet<>(entries);
        return AccessRequirement.authorities(authorities);
    }

    /**
     * 저장소에 콤마로 이어 저장된 값을 파싱합니다. 괄호나 따옴표 안의 콤마는 구분자로 보지 않습니다.
     */
    public static AccessRequirement parseConfigAttribute(String configAttribute, String ruleDescription) {
        return parse(splitConfigAttribute(configAttribute), ruleDescription);
    }

    static List<String> splitConfigAttribute(String configAttribute) {
        List<String> parts = new ArrayList<>();
        if (!StringUtils.hasText(configAttribute)) {
            return parts;
        }
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (char c : configAttribute.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString().trim());
        parts.removeIf(part -> part.isEmpty());
        return parts;
    }

    static boolean isExpression(String entry) {
        if (BARE_EXPRESSIONS.contains(entry)) {
            return true;
        }
        for (char c : entry.toCharArray()) {
            if (c == '(' || Character.isWhitespace(c)) {
                return true;
            }
        }
        return false;
    }
}
