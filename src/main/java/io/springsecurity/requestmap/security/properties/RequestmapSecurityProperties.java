package io.springsecurity.requestmap.security.properties;

import io.springsecurity.requestmap.security.authz.lockdown.LockdownPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "security.requestmap")
public class RequestmapSecurityProperties {

    private SecurityConfigType securityConfigType = SecurityConfigType.ANNOTATION;

    /** 규칙이 없는 요청을 거부 (켜져 있으면 rejectPublicInvocations 는 무시됨) */
    private boolean rejectIfNoRule = true;

    /** 규칙이 없는 요청을 설정 오류로 처리 */
    private boolean rejectPublicInvocations = true;

    private List<RuleDefinition> staticRules = new ArrayList<>();

    private List<RuleDefinition> interceptUrlMap = new ArrayList<>();

    public LockdownPolicy toLockdownPolicy() {
        return new LockdownPolicy(rejectIfNoRule, rejectPublicInvocations);
    }
}
