package com.ryuqq.catalogsync.adapter.runner;

import java.util.function.DoubleSupplier;

/**
 * 원격 호출 재시도 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = baseDelay * 2^(attempt-1)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=2: 2000-2200ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 * </ul>
 *
 * <p>플랫폼이 Retry-After 같은 대기 시간을 알려준 경우에는 이 계산 대신
 * 그 값이 사용됩니다 ({@link RetryExecutor}).</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본값: baseDelay=1000ms, maxDelay=300000ms, jitterFactor=0.1
     */
    public BackoffCalculator() {
        this(1000, 300000, 0.1);
    }

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, Math::random);
    }

    /**
     * 난수 공급자를 주입하는 생성자.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * n번째 시도가 실패한 뒤의 대기 시간.
     *
     * @param attempt 실패한 시도 번호 (1부터)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        // 2^62 이상은 overflow, 그 전에 maxDelay로 수렴
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
