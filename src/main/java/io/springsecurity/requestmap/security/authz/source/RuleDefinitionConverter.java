package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirementParser;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import io.springsecurity.requestmap.security.exception.RuleConfigurationException;
import io.springsecurity.requestmap.security.properties.RuleDefinition;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 선언된 규칙(설정 항목, 저장소 행)을 검증하고 {@link RequestRule} 로 정규화합니다.
 */
public class RuleDefinitionConverter {

    private final AntPathRuleMatcher matcher;

    public RuleDefinitionConverter(AntPathRuleMatcher matcher) {
        this.matcher = matcher;
    }

    public List<RequestRule> convertAll(List<RuleDefinition> definitions, RuleOrigin origin, int firstIndex) {
        List<RequestRule> rules = new ArrayList<>();
        if (definitions == null) {
            return rules;
        }
        int index = firstIndex;
        for (RuleDefinition definition : definitions) {
            AccessRequirement requirement = AccessRequirementParser.parse(definition.getAccess(),
                    describe(origin, index, definition.getPattern()));
            rules.add(convert(definition.getPattern(), definition.getHttpMethod(), requirement, origin, index));
            index++;
        }
        return rules;
    }

    public RequestRule convert(String pattern, String httpMethod, AccessRequirement requirement,
                               RuleOrigin origin, int index) {
        String description = describe(origin, index, pattern);
        matcher.validate(pattern, description);

        String normalizedPattern = origin.isLowercasePatterns() ? pattern.toLowerCase(Locale.ROOT) : pattern;
        return RequestRule.builder()
                .pattern(normalizedPattern)
                .httpMethod(parseHttpMethod(httpMethod, description))
                .accessRequirement(requirement)
                .origin(origin)
                .declarationIndex(index)
                .build();
    }

    public static HttpMethod parseHttpMethod(String httpMethod, String description) {
        if (!StringUtils.hasText(httpMethod)) {
            return null;
        }
        String name = httpMethod.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(HttpMethod.values())
                .filter(method -> method.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new RuleConfigurationException(
                        String.format("Unknown HTTP method '%s' in %s", httpMethod, description)));
    }

    static String describe(RuleOrigin origin, int index, String pattern) {
        return String.format("%s rule #%d (%s)", origin, index, pattern);
    }
}
