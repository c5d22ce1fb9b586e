package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import io.springsecurity.requestmap.security.properties.RuleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 설정 파일(interceptUrlMap / staticRules)에 선언된 규칙. 패턴은 소문자로 정규화됩니다.
 * 잘못된 항목은 생성 시점에 바로 예외를 던집니다.
 */
@Slf4j
public class ConfigMapRuleSource implements RuleSource {

    private final List<RequestRule> rules;

    public ConfigMapRuleSource(List<RuleDefinition> definitions, RuleDefinitionConverter converter) {
        this.rules = List.copyOf(converter.convertAll(definitions, RuleOrigin.CONFIGURATION_MAP, 0));
        log.debug("Loaded {} configuration map rules", rules.size());
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
        return RuleOrigin.CONFIGURATION_MAP;
    }

    @Override
    public boolean isPrimary() {
        return true;
    }
}
