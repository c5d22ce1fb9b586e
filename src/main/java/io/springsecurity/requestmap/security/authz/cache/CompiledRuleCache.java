package io.springsecurity.requestmap.security.authz.cache;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 컴파일된 규칙 목록의 캐시.
 * <p>
 * 스냅샷은 AtomicReference 로 한 번에 교체되므로 읽는 쪽은 동기화 없이 참조를 얻어 끝까지 사용합니다.
 * {@link #invalidate()} 는 세대 번호만 올리고, 재빌드는 다음 {@link #current()} 호출자가 락 하나 아래에서 수행합니다.
 * 유효한 스냅샷을 읽는 호출은 재빌드 중에도 락을 잡지 않습니다.
 */
@Slf4j
public class CompiledRuleCache {

    private final RuleCompiler compiler;
    private final Timer compileTimer;

    private final AtomicReference<CompiledRuleSet> snapshot = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong rebuildCount = new AtomicLong();
    private final ReentrantLock rebuildLock = new ReentrantLock();

    private volatile RuntimeException lastFailure;
    private volatile Instant lastFailureAt;

    public CompiledRuleCache(RuleCompiler compiler) {
        this(compiler, null);
    }

    public CompiledRuleCache(RuleCompiler compiler, MeterRegistry meterRegistry) {
        this.compiler = compiler;
        this.compileTimer = meterRegistry == null ? null : Timer.builder("requestmap.rules.compile")
                .description("Time spent compiling the request rule list")
                .register(meterRegistry);
    }

    public CompiledRuleSet current() {
        CompiledRuleSet cached = snapshot.get();
        if (cached != null && cached.getGeneration() == generation.get()) {
            return cached;
        }

        rebuildLock.lock();
        try {
            // 락을 기다리는 동안 다른 호출자가 이미 재빌드했을 수 있다
            long wanted = generation.get();
            cached = snapshot.get();
            if (cached != null && cached.getGeneration() == wanted) {
                return cached;
            }
            return rebuild(wanted);
        } finally {
            rebuildLock.unlock();
        }
    }

    public void invalidate() {
        long next = generation.incrementAndGet();
        log.info("Compiled rule cache invalidated (generation {})", next);
    }

    public boolean isStale() {
        CompiledRuleSet cached = snapshot.get();
        return cached == null || cached.getGeneration() != generation.get();
    }

    /**
     * 저장소처럼 실행 중에 바뀌는 소스가 있으면 true. 이 경우에만 외부 무효화가 의미가 있다.
     */
    public boolean isLiveInvalidationSupported() {
        return compiler.hasLiveSources();
    }

    public long getRebuildCount() {
        return rebuildCount.get();
    }

    public CompiledRuleSet peek() {
        return snapshot.get();
    }

    public RuntimeException getLastFailure() {
        return lastFailure;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    private CompiledRuleSet rebuild(long wanted) {
        log.info("Compiling request rules (generation {})...", wanted);
        long started = System.nanoTime();
        CompiledRuleSet rebuilt;
        try {
            rebuilt = compileTimer == null ? compiler.compile(wanted) : compileTimer.recordCallable(() -> compiler.compile(wanted));
        } catch (RuntimeException e) {
            lastFailure = e;
            lastFailureAt = Instant.now();
            log.error("Failed to compile request rules (generation {}): {}", wanted, e.getMessage());
            throw e;
        } catch (Exception e) {
            IllegalStateException wrapped = new IllegalStateException("Failed to compile request rules", e);
            lastFailure = wrapped;
            lastFailureAt = Instant.now();
            throw wrapped;
        }
        snapshot.set(rebuilt);
        rebuildCount.incrementAndGet();
        lastFailure = null;
        lastFailureAt = null;
        log.info("Compiled {} request rules in {} ms (generation {})", rebuilt.size(),
                (System.nanoTime() - started) / 1_000_000, wanted);
        return rebuilt;
    }
}
