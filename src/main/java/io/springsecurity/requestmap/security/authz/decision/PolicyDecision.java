package io.springsecurity.requestmap.security.authz.decision;

import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;

/**
 * 요청 한 건에 대한 정책 판정 결과. 요청마다 새로 만들어지며 상태를 갖지 않습니다.
 */
@Getter
@EqualsAndHashCode
public final class PolicyDecision {

    public enum Outcome {
        MATCHED,
        DENIED_NO_RULE,
        CONFIGURATION_ERROR_NO_RULE
    }

    private static final PolicyDecision DENIED_NO_RULE = new PolicyDecision(Outcome.DENIED_NO_RULE, null, null);
    private static final PolicyDecision CONFIGURATION_ERROR_NO_RULE =
            new PolicyDecision(Outcome.CONFIGURATION_ERROR_NO_RULE, null, null);

    private final Outcome outcome;
    private final AccessRequirement accessRequirement;
    private final RequestRule matchedRule;

    private PolicyDecision(Outcome outcome, AccessRequirement accessRequirement, RequestRule matchedRule) {
        this.outcome = outcome;
        this.accessRequirement = accessRequirement;
        this.matchedRule = matchedRule;
    }

    /**
     * @param matchedRule 매칭된 규칙. 잠금 정책이 공개 접근을 허용한 경우 null
     */
    public static PolicyDecision matched(AccessRequirement accessRequirement, RequestRule matchedRule) {
        return new PolicyDecision(Outcome.MATCHED, accessRequirement, matchedRule);
    }

    public static PolicyDecision deniedNoRule() {
        return DENIED_NO_RULE;
    }

    public static PolicyDecision configurationErrorNoRule() {
        return CONFIGURATION_ERROR_NO_RULE;
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }

    public Optional<RequestRule> getMatchedRuleIfAny() {
        return Optional.ofNullable(matchedRule);
    }

    @Override
    public String toString() {
        if (outcome != Outcome.MATCHED) {
            return outcome.name();
        }
        return "MATCHED(" + accessRequirement + ")";
    }
}
