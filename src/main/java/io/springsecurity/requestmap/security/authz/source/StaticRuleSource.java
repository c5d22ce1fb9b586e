package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import io.springsecurity.requestmap.security.properties.RuleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 정적으로 선언된 규칙. 선언(어노테이션)에서 파생된 규칙과 항상 적용되는 예외 규칙(정적 리소스, 로그인, 에러 페이지 등)을 담습니다.
 * 패턴의 대소문자는 그대로 유지되며, 기동 이후에는 바뀌지 않습니다.
 */
@Slf4j
public class StaticRuleSource implements RuleSource {

    private final List<RequestRule> rules;
    private final boolean primary;

    public StaticRuleSource(List<RuleDefinition> definitions, RuleDefinitionConverter converter, boolean primary) {
        this.rules = List.copyOf(converter.convertAll(definitions, RuleOrigin.STATIC_DECLARATION, 0));
        this.primary = primary;
        log.debug("Loaded {} static declaration rules (primary={})", rules.size(), primary);
    }

    @Override
    public List<RequestRule> listRules() {
        return rules;
    }

    @Override
    public boolean supportsLiveInvalidation() {
        return false;
    }

    @Override
    public RuleOrigin getOrigin() {
        return RuleOrigin.STATIC_DECLARATION;
    }

    @Override
    public boolean isPrimary() {
        return primary;
    }
}
