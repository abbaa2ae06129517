package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TokenBucketRateLimiter 유닛 테스트.
 *
 * <p>가짜 시계를 사용하며, 가짜 Sleeper는 대기한 만큼 시계를 진행시킵니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class TokenBucketRateLimiterTest {

    private final AtomicLong clock = new AtomicLong(0);
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper sleeper = millis -> {
        sleeps.add(millis);
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    };

    private final Queue<Long> reservedWaits = new ConcurrentLinkedQueue<>();

    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new TokenBucketRateLimiter(new RateLimiterConfig(2.0, 2), clock::get, sleeper);
    }

    // ============================================================
    // acquire
    // ============================================================

    @Test
    void acquire_버스트_범위_안에서는_대기하지_않음() throws InterruptedException {
        // when
        limiter.acquire();
        limiter.acquire();

        // then
        assertThat(sleeps).isEmpty();
    }

    @Test
    void acquire_토큰_소진_후_충전_시간만큼_대기() throws InterruptedException {
        // given
        limiter.acquire();
        limiter.acquire();

        // when
        limiter.acquire();

        // then: 초당 2개 → 토큰 하나에 500ms
        assertThat(sleeps).containsExactly(500L);
    }

    @Test
    void acquire_연속_호출은_예약_순서대로_간격이_벌어짐() throws InterruptedException {
        // given
        RateLimiterConfig config = new RateLimiterConfig(1.0, 1);
        List<Long> waits = new ArrayList<>();
        // 대기해도 시계를 움직이지 않는 Sleeper: 예약 누적만 관찰
        TokenBucketRateLimiter frozen = new TokenBucketRateLimiter(config, clock::get, waits::add);

        // when
        frozen.acquire();
        frozen.acquire();
        frozen.acquire();

        // then
        assertThat(waits).containsExactly(1000L, 2000L);
    }

    @Test
    void acquire_시간이_지나면_버스트_크기까지만_충전() throws InterruptedException {
        // given
        limiter.acquire();
        limiter.acquire();
        clock.addAndGet(TimeUnit.SECONDS.toNanos(10));

        // when
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        // then
        assertThat(sleeps).containsExactly(500L);
    }

    // ============================================================
    // 여러 스레드에서 동시 획득
    // ============================================================

    @Test
    void acquire_여러_스레드가_동시에_예약해도_대기_시간이_겹치지_않음() throws Exception {
        // given: 시계를 멈춘 채 예약만 누적
        TokenBucketRateLimiter frozen = new TokenBucketRateLimiter(new RateLimiterConfig(1.0, 1), clock::get,
            reservedWaits::add);
        int threads = 8;
        int acquiresPerThread = 5;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int j = 0; j < acquiresPerThread; j++) {
                    frozen.acquire();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then: 첫 토큰은 버스트, 나머지 39개는 1초 간격으로 하나씩 예약됨
        List<Long> expected = new ArrayList<>();
        for (long k = 1; k < threads * acquiresPerThread; k++) {
            expected.add(k * 1000);
        }
        assertThat(reservedWaits).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    void acquire_실제_시계에서_여러_스레드의_총_처리량은_설정_속도를_넘지_않음() throws Exception {
        // given: 초당 100개, 버스트 1 → 40번 획득에 최소 390ms
        TokenBucketRateLimiter real = new TokenBucketRateLimiter(new RateLimiterConfig(100.0, 1));
        int threads = 8;
        int total = 40;
        AtomicInteger acquired = new AtomicInteger();
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(total);

        // when
        for (int i = 0; i < total; i++) {
            executorService.submit(() -> {
                try {
                    start.await();
                    real.acquire();
                    acquired.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        long startedAt = System.nanoTime();
        start.countDown();
        boolean completed = done.await(10, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        executorService.shutdown();

        // then
        assertThat(completed).isTrue();
        assertThat(acquired.get()).isEqualTo(total);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(350L);
    }

    @Test
    void constructor_null_config는_예외() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }
}
