package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;

import java.util.List;

/**
 * 인가 규칙 공급자. 규칙 컴파일러와 리졸버는 이 인터페이스에만 의존합니다.
 */
public interface RuleSource {

    /**
     * 선언 순서대로 정렬된 규칙 목록.
     * @throws io.springsecurity.requestmap.security.exception.RuleSourceUnavailableException 저장소에 접근할 수 없는 경우
     */
    List<RequestRule> listRules();

    /**
     * 실행 중 규칙이 바뀔 수 있어 캐시 무효화가 의미 있는 소스인지 여부.
     */
    boolean supportsLiveInvalidation();

    RuleOrigin getOrigin();

    /**
     * securityConfigType 으로 선택된 주 소스인지 여부. 항상 켜져 있는 보조 소스는 false.
     */
    boolean isPrimary();
}
