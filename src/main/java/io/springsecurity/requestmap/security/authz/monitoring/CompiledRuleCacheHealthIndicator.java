package io.springsecurity.requestmap.security.authz.monitoring;

import io.springsecurity.requestmap.security.authz.cache.CompiledRuleCache;
import io.springsecurity.requestmap.security.authz.cache.CompiledRuleSet;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * 규칙 캐시 상태. 마지막 재빌드가 실패했다면 DOWN 으로 보고합니다.
 */
@RequiredArgsConstructor
public class CompiledRuleCacheHealthIndicator implements HealthIndicator {

    private final CompiledRuleCache ruleCache;

    @Override
    public Health health() {
        CompiledRuleSet snapshot = ruleCache.peek();
        Health.Builder builder = ruleCache.getLastFailure() == null ? Health.up() : Health.down();
        builder.withDetail("stale", ruleCache.isStale())
                .withDetail("rebuilds", ruleCache.getRebuildCount())
                .withDetail("liveInvalidation", ruleCache.isLiveInvalidationSupported());
        if (snapshot != null) {
            builder.withDetail("rules", snapshot.size())
                    .withDetail("generation", snapshot.getGeneration())
                    .withDetail("builtAt", snapshot.getBuiltAt().toString());
        }
        if (ruleCache.getLastFailure() != null) {
            builder.withDetail("lastFailure", ruleCache.getLastFailure().getMessage())
                    .withDetail("lastFailureAt", String.valueOf(ruleCache.getLastFailureAt()));
        }
        return builder.build();
    }
}
