package io.springsecurity.requestmap.security.authz.resolver;

import io.springsecurity.requestmap.security.authz.cache.CompiledRuleCache;
import io.springsecurity.requestmap.security.authz.cache.CompiledRuleSet;
import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import io.springsecurity.requestmap.security.authz.lockdown.LockdownEnforcer;
import io.springsecurity.requestmap.security.authz.lockdown.LockdownPolicy;
import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * 요청 (메서드, 경로) 에 대한 정책 판정의 진입점.
 * 캐시된 규칙 목록에서 첫 매칭 규칙을 찾고, 없으면 잠금 정책에 판정을 맡깁니다.
 * I/O 를 직접 수행하지 않으며, 캐시가 비어 있거나 무효화된 경우에만 규칙 소스를 읽습니다.
 */
@Slf4j
public class PolicyResolver {

    private final CompiledRuleCache ruleCache;
    private final AntPathRuleMatcher matcher;
    private final LockdownPolicy defaultLockdownPolicy;

    public PolicyResolver(CompiledRuleCache ruleCache, AntPathRuleMatcher matcher, LockdownPolicy defaultLockdownPolicy) {
        this.ruleCache = ruleCache;
        this.matcher = matcher;
        this.defaultLockdownPolicy = defaultLockdownPolicy;
    }

    public PolicyDecision resolve(HttpMethod method, String path) {
        return resolve(method, path, defaultLockdownPolicy);
    }

    /**
     * @throws io.springsecurity.requestmap.security.exception.RuleSourceUnavailableException 재빌드 중 저장소에 접근할 수 없는 경우
     */
    public PolicyDecision resolve(HttpMethod method, String path, LockdownPolicy lockdownPolicy) {
        Assert.notNull(method, "method must not be null");
        Assert.notNull(path, "path must not be null");
        Assert.notNull(lockdownPolicy, "lockdownPolicy must not be null");

        CompiledRuleSet rules = ruleCache.current();
        Optional<RequestRule> match = rules.findFirstMatch(method, path, matcher);
        if (match.isPresent()) {
            RequestRule rule = match.get();
            log.trace("{} {} matched {}", method, path, rule);
            return PolicyDecision.matched(rule.getAccessRequirement(), rule);
        }

        PolicyDecision decision = LockdownEnforcer.onNoMatch(lockdownPolicy);
        log.debug("No rule matched {} {}; lockdown decision {}", method, path, decision);
        return decision;
    }

    /**
     * 저장소 변경이 커밋된 뒤 호출합니다. 이후의 resolve 호출은 변경된 규칙을 봅니다.
     */
    public void clearCachedRules() {
        ruleCache.invalidate();
    }
}
