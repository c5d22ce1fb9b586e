package io.springsecurity.requestmap.security.authz.monitoring;

import io.springsecurity.requestmap.security.authz.cache.CompiledRuleCache;
import io.springsecurity.requestmap.security.authz.cache.RuleCompiler;
import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import io.springsecurity.requestmap.security.authz.support.InMemoryRuleSource;
import io.springsecurity.requestmap.security.exception.RuleSourceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompiledRuleCacheHealthIndicatorTest {

    @Test
    @DisplayName("재빌드가 실패하면 DOWN, 다시 성공하면 UP")
    void reportsRebuildFailures() {
        InMemoryRuleSource store = new InMemoryRuleSource(RuleOrigin.DYNAMIC_STORE, true).add("/reports/**", "ROLE_AUDITOR");
        CompiledRuleCache cache = new CompiledRuleCache(new RuleCompiler(List.of(store), new AntPathRuleMatcher()));
        CompiledRuleCacheHealthIndicator indicator = new CompiledRuleCacheHealthIndicator(cache);

        cache.current();
        Health healthy = indicator.health();
        assertThat(healthy.getStatus()).isEqualTo(Status.UP);
        assertThat(healthy.getDetails()).containsEntry("rules", 1).containsEntry("stale", false)
                .containsEntry("liveInvalidation", true);

        store.failWith(() -> new RuleSourceUnavailableException(RuleOrigin.DYNAMIC_STORE, "store down", null));
        cache.invalidate();
        assertThatThrownBy(cache::current).isInstanceOf(RuleSourceUnavailableException.class);

        Health unhealthy = indicator.health();
        assertThat(unhealthy.getStatus()).isEqualTo(Status.DOWN);
        assertThat(unhealthy.getDetails()).containsEntry("lastFailure", "store down").containsEntry("stale", true);
    }
}
