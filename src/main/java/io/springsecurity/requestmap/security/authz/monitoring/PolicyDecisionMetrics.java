package io.springsecurity.requestmap.security.authz.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 정책 판정 결과별 카운터.
 */
@RequiredArgsConstructor
public class PolicyDecisionMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public void record(PolicyDecision decision, boolean granted) {
        String key = decision.getOutcome().name() + ":" + granted;
        counters.computeIfAbsent(key, k -> Counter.builder("requestmap.policy.decision")
                        .description("Request authorization decisions by outcome")
                        .tag("outcome", decision.getOutcome().name())
                        .tag("granted", String.valueOf(granted))
                        .register(meterRegistry))
                .increment();
    }
}
