package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.security.properties.RuleDefinition;

import java.util.List;

/**
 * 컨트롤러 선언(어노테이션 등)에서 파생된 규칙을 넘겨주는 협력자.
 * 선언을 해석하는 일은 구현체의 몫이며, 코어는 결과 목록만 사용합니다.
 */
@FunctionalInterface
public interface DeclaredRuleProvider {

    List<RuleDefinition> declaredRules();
}
