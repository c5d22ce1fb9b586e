package io.springsecurity.requestmap.security.authz.cache;

import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.matcher.RuleSpecificity;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.source.RuleSource;
import io.springsecurity.requestmap.security.exception.RuleConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 활성 규칙 소스들을 하나의 정렬된 규칙 목록으로 합칩니다.
 * 같은 소스 출력에 대해 항상 같은 결과를 내며, 빌드 사이에 상태를 남기지 않습니다.
 */
@Slf4j
public class RuleCompiler {

    private static final Comparator<SortableRule> ORDER = Comparator
            .comparing(SortableRule::specificity)
            .thenComparingInt(SortableRule::originRank);

    private final List<RuleSource> sources;
    private final AntPathRuleMatcher matcher;

    public RuleCompiler(List<RuleSource> sources, AntPathRuleMatcher matcher) {
        long primaries = sources.stream().filter(RuleSource::isPrimary).count();
        if (primaries != 1) {
            throw new RuleConfigurationException(String.format(
                    "Exactly one primary rule source must be enabled but found %d: %s", primaries,
                    sources.stream().filter(RuleSource::isPrimary).map(RuleSource::getOrigin).toList()));
        }
        this.sources = List.copyOf(sources);
        this.matcher = matcher;
    }

    public CompiledRuleSet compile(long generation) {
        List<SortableRule> collected = new ArrayList<>();
        for (RuleSource source : sources) {
            for (RequestRule rule : source.listRules()) {
                matcher.validate(rule.getPattern(), rule.describe());
                collected.add(new SortableRule(rule, matcher.specificity(rule.getPattern()), rule.getOrigin().getRank()));
            }
        }

        // List.sort 는 안정 정렬이므로 키가 같으면 소스 선언 순서가 유지된다
        collected.sort(ORDER);

        List<RequestRule> ordered = collected.stream().map(SortableRule::rule).toList();
        if (log.isDebugEnabled()) {
            ordered.forEach(rule -> log.debug("Compiled rule {}", rule));
        }
        return new CompiledRuleSet(ordered, generation, Instant.now());
    }

    public boolean hasLiveSources() {
        return sources.stream().anyMatch(RuleSource::supportsLiveInvalidation);
    }

    private record SortableRule(RequestRule rule, RuleSpecificity specificity, int originRank) {
    }
}
