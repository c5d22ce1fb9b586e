package io.springsecurity.requestmap.security.authz.lockdown;

/**
 * 규칙이 없는 요청을 어떻게 처리할지 정하는 두 스위치.
 * rejectIfNoRule 이 true 이면 rejectPublicInvocations 는 어떤 경우에도 참조되지 않습니다.
 */
public record LockdownPolicy(boolean rejectIfNoRule, boolean rejectPublicInvocations) {

    public static LockdownPolicy defaults() {
        return new LockdownPolicy(true, true);
    }
}
