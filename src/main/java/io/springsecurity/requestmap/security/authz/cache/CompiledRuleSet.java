package io.springsecurity.requestmap.security.authz.cache;

import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import lombok.Getter;
import org.springframework.http.HttpMethod;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 명시도 순으로 정렬된 불변 규칙 목록. 한 번 발행되면 변경되지 않고, 재빌드 시 새 인스턴스로 교체됩니다.
 */
@Getter
public final class CompiledRuleSet {

    private final List<RequestRule> rules;
    private final long generation;
    private final Instant builtAt;

    public CompiledRuleSet(List<RequestRule> rules, long generation, Instant builtAt) {
        this.rules = List.copyOf(rules);
        this.generation = generation;
        this.builtAt = builtAt;
    }

    /**
     * 정렬 순서대로 훑어 처음 매칭되는 규칙을 반환합니다 (first-match-wins).
     * 소문자 정규화된 규칙은 소문자로 바꾼 경로와 비교합니다.
     */
    public Optional<RequestRule> findFirstMatch(HttpMethod method, String path, AntPathRuleMatcher matcher) {
        String lowercasePath = null;
        for (RequestRule rule : rules) {
            if (!rule.appliesTo(method)) {
                continue;
            }
            String candidate = path;
            if (rule.isCaseNormalized()) {
                if (lowercasePath == null) {
                    lowercasePath = path.toLowerCase(Locale.ROOT);
                }
                candidate = lowercasePath;
            }
            if (matcher.match(rule.getPattern(), candidate)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }
}
