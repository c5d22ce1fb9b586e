package io.springsecurity.requestmap.security.authz.lockdown;

import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;

/**
 * 매칭되는 규칙이 없을 때의 결과를 결정합니다. 두 스위치만의 순수 함수입니다.
 */
public final class LockdownEnforcer {

    private LockdownEnforcer() {
    }

    public static PolicyDecision onNoMatch(LockdownPolicy policy) {
        if (policy.rejectIfNoRule()) {
            return PolicyDecision.deniedNoRule();
        }
        if (policy.rejectPublicInvocations()) {
            return PolicyDecision.configurationErrorNoRule();
        }
        return PolicyDecision.matched(AccessRequirement.none(), null);
    }
}
