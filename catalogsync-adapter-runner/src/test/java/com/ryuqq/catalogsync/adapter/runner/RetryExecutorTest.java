package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.outcome.Fail;
import com.ryuqq.catalogsync.core.outcome.Ok;
import com.ryuqq.catalogsync.core.outcome.Outcome;
import com.ryuqq.catalogsync.core.outcome.Retry;
import com.ryuqq.catalogsync.core.protection.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RetryExecutor 유닛 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    @Mock
    private RateLimiter rateLimiter;

    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final BackoffCalculator backoff = new BackoffCalculator(1000, 300000, 0.1, () -> 0.0);

    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RetryExecutor(rateLimiter, backoff, sleeps::add, 3, cancelled::get);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ============================================================
    // 1. 즉시 반환
    // ============================================================

    @Test
    void execute_Ok는_그대로_반환() throws InterruptedException {
        // when
        Outcome<String> outcome = executor.execute("upsert ring", () -> Ok.of("gid://catalog/Product/1"));

        // then
        assertThat(outcome).isEqualTo(Ok.of("gid://catalog/Product/1"));
        assertThat(sleeps).isEmpty();
        verify(rateLimiter, times(1)).acquire();
    }

    @Test
    void execute_Fail은_재시도하지_않음() {
        // given
        Script<String> script = new Script<>(Fail.of(ErrorKind.REMOTE_REJECTION, "Invalid handle"));

        // when
        Outcome<String> outcome = executor.execute("upsert ring", script);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail<String>) outcome).errorKind()).isEqualTo(ErrorKind.REMOTE_REJECTION);
        assertThat(script.calls).isEqualTo(1);
    }

    // ============================================================
    // 2. Retry 처리
    // ============================================================

    @Test
    void execute_대기_힌트가_있으면_그_시간만큼_대기() throws InterruptedException {
        // given
        Script<String> script = new Script<>(Retry.after("429 Too Many Requests", 2000), Ok.of("done"));

        // when
        Outcome<String> outcome = executor.execute("upsert ring", script);

        // then
        assertThat(outcome).isEqualTo(Ok.of("done"));
        assertThat(sleeps).containsExactly(2000L);
        verify(rateLimiter, times(2)).acquire();
    }

    @Test
    void execute_힌트가_없으면_백오프_계산값으로_대기() {
        // given
        Script<String> script = new Script<>(Retry.of("503"), Retry.of("503"), Ok.of("done"));

        // when
        Outcome<String> outcome = executor.execute("upsert ring", script);

        // then
        assertThat(outcome).isEqualTo(Ok.of("done"));
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    void execute_maxAttempts_소진_시_TRANSIENT_REMOTE() {
        // given
        Script<String> script = new Script<>(Retry.of("503"), Retry.of("503"), Retry.of("503"), Ok.of("late"));

        // when
        Outcome<String> outcome = executor.execute("upsert ring", script);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail<String> fail = (Fail<String>) outcome;
        assertThat(fail.errorKind()).isEqualTo(ErrorKind.TRANSIENT_REMOTE);
        assertThat(fail.message()).contains("after 3 attempts");
        assertThat(script.calls).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    // ============================================================
    // 3. 취소 / 인터럽트
    // ============================================================

    @Test
    void execute_재시도_전에_취소되면_CANCELLED() {
        // given
        Script<String> script = new Script<>(Retry.of("503"), Ok.of("done"));
        script.afterCall = () -> cancelled.set(true);

        // when
        Outcome<String> outcome = executor.execute("upsert ring", script);

        // then
        assertThat(((Fail<String>) outcome).errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(script.calls).isEqualTo(1);
    }

    @Test
    void execute_rate_limit_대기_중_인터럽트되면_CANCELLED() throws InterruptedException {
        // given
        doThrow(new InterruptedException()).when(rateLimiter).acquire();

        // when
        Outcome<String> outcome = executor.execute("upsert ring", () -> Ok.of("never"));

        // then
        assertThat(((Fail<String>) outcome).errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void execute_null_outcome은_예외() {
        assertThatThrownBy(() -> executor.execute("upsert ring", () -> null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("returned null outcome");
    }

    @Test
    void constructor_maxAttempts가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new RetryExecutor(rateLimiter, backoff, sleeps::add, 0, cancelled::get))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * 미리 정한 순서대로 결과를 돌려주는 원격 호출.
     */
    private static final class Script<T> implements Supplier<Outcome<T>> {

        private final Deque<Outcome<T>> responses = new ArrayDeque<>();
        private Runnable afterCall = () -> { };
        private int calls;

        @SafeVarargs
        Script(Outcome<T>... responses) {
            this.responses.addAll(List.of(responses));
        }

        @Override
        public Outcome<T> get() {
            calls++;
            Outcome<T> next = responses.poll();
            afterCall.run();
            return next;
        }
    }
}
