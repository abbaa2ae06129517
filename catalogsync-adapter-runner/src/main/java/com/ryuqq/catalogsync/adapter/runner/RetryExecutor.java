package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.outcome.Fail;
import com.ryuqq.catalogsync.core.outcome.Outcome;
import com.ryuqq.catalogsync.core.outcome.Retry;
import com.ryuqq.catalogsync.core.protection.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 원격 호출 한 건을 Rate Limit과 재시도 규칙 아래에서 실행.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>매 시도 전에 공유 {@link RateLimiter}에서 토큰 획득</li>
 *   <li>{@code Ok}, {@code Fail}: 그대로 반환 (Fail은 재시도하지 않음)</li>
 *   <li>{@code Retry}: 대기 후 재시도. 대기 시간 힌트가 있으면 그 값, 없으면 백오프 계산값</li>
 *   <li>maxAttempts 소진: {@code Fail(TRANSIENT_REMOTE)}</li>
 *   <li>재시도 전에 실행이 취소됐으면: {@code Fail(CANCELLED)}</li>
 * </ul>
 *
 * <p>반환값은 항상 {@code Ok} 또는 {@code Fail}입니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RateLimiter rateLimiter;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final BooleanSupplier cancelled;

    public RetryExecutor(RateLimiter rateLimiter,
                         BackoffCalculator backoffCalculator,
                         Sleeper sleeper,
                         int maxAttempts,
                         BooleanSupplier cancelled) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (cancelled == null) {
            throw new IllegalArgumentException("cancelled cannot be null");
        }
        this.rateLimiter = rateLimiter;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
        this.cancelled = cancelled;
    }

    /**
     * 원격 호출 실행.
     *
     * @param operation 로그용 호출 이름 (예: "upsert 280-ctw-cushion-grp-1")
     * @param call 원격 호출
     * @param <T> 결과 값 타입
     * @return {@code Ok} 또는 {@code Fail}
     */
    public <T> Outcome<T> execute(String operation, Supplier<Outcome<T>> call) {
        for (int attempt = 1; ; attempt++) {
            if (attempt > 1 && cancelled.getAsBoolean()) {
                return Fail.of(ErrorKind.CANCELLED, operation + " cancelled before attempt " + attempt);
            }
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Fail.of(ErrorKind.CANCELLED, operation + " interrupted while waiting for rate limit");
            }

            Outcome<T> outcome = call.get();
            if (outcome == null) {
                throw new IllegalStateException(operation + " returned null outcome");
            }
            if (!(outcome instanceof Retry<T> retry)) {
                return outcome;
            }

            if (attempt >= maxAttempts) {
                log.warn("{} gave up after {} attempts: {}", operation, attempt, retry.reason());
                return Fail.of(ErrorKind.TRANSIENT_REMOTE,
                    operation + " failed after " + attempt + " attempts: " + retry.reason());
            }

            long delayMs = retry.hasWaitHint() ? retry.waitHintMillis() : backoffCalculator.calculate(attempt);
            log.warn("{} attempt {} failed ({}), retrying in {} ms", operation, attempt, retry.reason(), delayMs);
            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Fail.of(ErrorKind.CANCELLED, operation + " interrupted during retry backoff");
            }
        }
    }
}
