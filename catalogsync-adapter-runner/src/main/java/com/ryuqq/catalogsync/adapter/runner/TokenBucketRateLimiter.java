package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.core.protection.RateLimiter;
import com.ryuqq.catalogsync.core.protection.RateLimiterConfig;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token Bucket 기반 {@link RateLimiter}.
 *
 * <p>토큰은 permitsPerSecond 속도로 충전되며 maxBurstSize까지 쌓입니다.
 * {@link #acquire()}는 토큰을 예약한 뒤 락 밖에서 대기하므로, 대기 중인 워커가
 * 다른 워커의 예약을 막지 않고 예약 순서대로 호출이 나갑니다.</p>
 *
 * <p><strong>동시성:</strong> 버킷 상태 변경은 모두 이 객체의 모니터 안에서 일어납니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final RateLimiterConfig config;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, System::nanoTime, Sleeper.SYSTEM);
    }

    /**
     * 시계와 대기 방식을 주입하는 생성자.
     *
     * @param config 설정
     * @param nanoClock 단조 증가 나노초 시계
     * @param sleeper 대기 구현
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, LongSupplier nanoClock, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoClock == null || sleeper == null) {
            throw new IllegalArgumentException("nanoClock and sleeper cannot be null");
        }
        this.config = config;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = config.maxBurstSize();
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    @Override
    public void acquire() throws InterruptedException {
        long waitNanos = reserve();
        sleepNanos(waitNanos);
    }

    /**
     * 토큰 하나 예약.
     *
     * @return 토큰이 준비될 때까지의 대기 시간 (나노초)
     */
    private synchronized long reserve() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0;
        }
        long waitNanos = (long) Math.ceil((1.0 - tokens) * NANOS_PER_SECOND / config.permitsPerSecond());
        // 음수 잔고 = 뒤에 예약된 호출 수
        tokens -= 1.0;
        return waitNanos;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(config.maxBurstSize(), tokens + elapsed * config.permitsPerSecond() / NANOS_PER_SECOND);
            lastRefillNanos = now;
        }
    }

    private void sleepNanos(long waitNanos) throws InterruptedException {
        if (waitNanos > 0) {
            sleeper.sleep(TimeUnit.NANOSECONDS.toMillis(waitNanos + 999_999));
        }
    }
}
