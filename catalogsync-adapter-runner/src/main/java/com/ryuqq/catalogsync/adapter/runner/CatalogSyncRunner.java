package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.application.pipeline.GroupPipeline;
import com.ryuqq.catalogsync.application.pipeline.PreparedGroup;
import com.ryuqq.catalogsync.application.sync.CatalogSync;
import com.ryuqq.catalogsync.application.sync.GroupResult;
import com.ryuqq.catalogsync.application.sync.RunSummary;
import com.ryuqq.catalogsync.core.error.CatalogValidationException;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.error.GroupNotFoundException;
import com.ryuqq.catalogsync.core.fingerprint.CanonicalForm;
import com.ryuqq.catalogsync.core.fingerprint.RemoteState;
import com.ryuqq.catalogsync.core.fingerprint.StateComparator;
import com.ryuqq.catalogsync.core.fingerprint.SyncDecision;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.outcome.Fail;
import com.ryuqq.catalogsync.core.outcome.Ok;
import com.ryuqq.catalogsync.core.outcome.Outcome;
import com.ryuqq.catalogsync.core.protection.RateLimiter;
import com.ryuqq.catalogsync.core.spi.CatalogPlatform;
import com.ryuqq.catalogsync.core.spi.GroupSource;
import com.ryuqq.catalogsync.core.spi.UpsertRequest;
import com.ryuqq.catalogsync.core.spi.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * {@link CatalogSync} 구현체.
 *
 * <p>그룹을 고정 크기 워커 풀에서 동시에 처리하고, 그룹 안의 단계는 순차로 실행합니다.</p>
 *
 * <p><strong>처리 흐름 (그룹 하나):</strong></p>
 * <pre>
 * PENDING
 *   ↓ (취소됐으면 FAILED/CANCELLED)
 * VALIDATING: prepare(조회 → 분류 → 생성 → 검증 → 지문) → findRemoteState → decide
 *   ├─ NO_OP  → SKIPPED
 *   └─ CREATE/UPDATE
 *        ↓
 * DISPATCHING
 *   ├─ 개별 모드 (그룹 수 &lt; bulkThreshold): 그룹마다 원자적 upsert 한 번
 *   └─ 벌크 모드 (그룹 수 ≥ bulkThreshold): 모든 그룹을 벌크 작업 하나로
 *        ↓
 * SUCCEEDED | PARTIAL_FAILURE | FAILED
 * </pre>
 *
 * <p><strong>오류 격리:</strong> 그룹 경계에서 모든 예외를 잡아 해당 그룹만 FAILED로 보고합니다.
 * 실행이 끝나면 요청한 모든 그룹이 결과에 포함됩니다.</p>
 *
 * <p><strong>취소:</strong> {@link #cancel()} 이후 새 디스패치를 시작하지 않습니다.
 * 이미 보낸 호출은 완료되며, 워커 풀은 인터럽트 없이 종료됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class CatalogSyncRunner implements CatalogSync {

    private static final Logger log = LoggerFactory.getLogger(CatalogSyncRunner.class);

    private final GroupSource groupSource;
    private final GroupPipeline pipeline;
    private final CatalogPlatform platform;
    private final SyncRunnerConfig config;
    private final StateComparator comparator;
    private final RetryExecutor retryExecutor;
    private final BulkDispatcher bulkDispatcher;
    private final LongSupplier nanoClock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * 생성자 (기본 BackoffCalculator, 실제 시간 사용).
     *
     * @param groupSource 그룹 조회
     * @param pipeline 그룹 준비 파이프라인
     * @param platform 카탈로그 플랫폼
     * @param rateLimiter 모든 워커가 공유하는 Rate Limiter
     * @param config 설정
     */
    public CatalogSyncRunner(GroupSource groupSource,
                             GroupPipeline pipeline,
                             CatalogPlatform platform,
                             RateLimiter rateLimiter,
                             SyncRunnerConfig config) {
        this(groupSource, pipeline, platform, rateLimiter, config, new BackoffCalculator(), Sleeper.SYSTEM, System::nanoTime);
    }

    /**
     * 생성자 (백오프, 대기, 시계 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CatalogSyncRunner(GroupSource groupSource,
                             GroupPipeline pipeline,
                             CatalogPlatform platform,
                             RateLimiter rateLimiter,
                             SyncRunnerConfig config,
                             BackoffCalculator backoffCalculator,
                             Sleeper sleeper,
                             LongSupplier nanoClock) {
        if (groupSource == null) {
            throw new IllegalArgumentException("groupSource cannot be null");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null || sleeper == null || nanoClock == null) {
            throw new IllegalArgumentException("backoffCalculator, sleeper and nanoClock cannot be null");
        }

        this.groupSource = groupSource;
        this.pipeline = pipeline;
        this.platform = platform;
        this.config = config;
        this.nanoClock = nanoClock;
        this.comparator = new StateComparator();
        this.retryExecutor = new RetryExecutor(rateLimiter, backoffCalculator, sleeper, config.maxAttempts(), cancelled::get);
        this.bulkDispatcher = new BulkDispatcher(platform, retryExecutor, new CanonicalForm(), config, sleeper, nanoClock);
    }

    @Override
    public RunSummary sync(List<GroupId> groupIds) {
        if (groupIds == null) {
            throw new IllegalArgumentException("groupIds cannot be null");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A sync run is already in progress");
        }
        try {
            cancelled.set(false);
            return run(new ArrayList<>(new LinkedHashSet<>(groupIds)));
        } finally {
            running.set(false);
        }
    }

    @Override
    public RunSummary syncAll() {
        return sync(groupSource.fetchAllGroupIds());
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Sync run cancelled, no new dispatches will start");
        }
    }

    private RunSummary run(List<GroupId> groupIds) {
        long startNanos = nanoClock.getAsLong();
        boolean bulk = groupIds.size() >= config.bulkThreshold();
        log.info("Starting sync of {} groups ({} mode, concurrency {})",
            groupIds.size(), bulk ? "bulk" : "individual", config.concurrency());

        List<GroupSyncContext> contexts = new ArrayList<>(groupIds.size());
        for (GroupId groupId : groupIds) {
            contexts.add(new GroupSyncContext(groupId));
        }

        if (!contexts.isEmpty()) {
            ExecutorService workers = Executors.newFixedThreadPool(Math.min(config.concurrency(), contexts.size()));
            try {
                if (bulk) {
                    runInParallel(workers, contexts, this::validateAndDecide);
                    dispatchBulk(contexts);
                } else {
                    runInParallel(workers, contexts, this::processIndividually);
                }
            } finally {
                shutdown(workers);
            }
        }

        List<GroupResult> results = new ArrayList<>(contexts.size());
        for (GroupSyncContext context : contexts) {
            GroupResult result = context.result();
            if (result == null) {
                result = GroupResult.failed(context.groupId(), ErrorKind.UNEXPECTED,
                    "Group ended in " + context.state() + " without a result");
            }
            results.add(result);
        }
        RunSummary summary = new RunSummary(results, TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - startNanos));
        log.info(summary.describe());
        return summary;
    }

    /**
     * 개별 모드: 검증 → 결정 → 원자적 upsert.
     */
    private void processIndividually(GroupSyncContext context) {
        validateAndDecide(context);
        if (context.state().isTerminal()) {
            return;
        }
        if (cancelled.get()) {
            context.fail(ErrorKind.CANCELLED, "Run cancelled before dispatch");
            return;
        }

        PreparedGroup prepared = context.prepared();
        context.startDispatching();
        Outcome<UpsertResult> outcome = retryExecutor.execute(
            "upsert " + prepared.handle(),
            () -> platform.upsert(new UpsertRequest(prepared.entity(), prepared.fingerprint())));
        if (outcome instanceof Ok<UpsertResult> ok) {
            GroupResult result = context.complete(
                DispatchResults.interpret(prepared.entity(), context.decision(), ok.value()));
            log.info("Group {} {} (platformId={})",
                context.groupId().getValue(), result.outcome(), result.platformId());
        } else {
            Fail<UpsertResult> fail = (Fail<UpsertResult>) outcome;
            context.fail(fail.errorKind(), fail.message());
            log.warn("Group {} upsert failed: {} {}", context.groupId().getValue(), fail.errorKind(), fail.message());
        }
    }

    /**
     * PENDING → VALIDATING → (SKIPPED | FAILED | 디스패치 대기).
     *
     * <p>디스패치 대기이면 VALIDATING 상태로 prepared와 decision을 채워 둡니다.</p>
     */
    private void validateAndDecide(GroupSyncContext context) {
        GroupId groupId = context.groupId();
        if (cancelled.get()) {
            context.fail(ErrorKind.CANCELLED, "Run cancelled before group was processed");
            return;
        }
        context.startValidating();

        PreparedGroup prepared = pipeline.prepare(groupId);
        Outcome<RemoteState> remote = retryExecutor.execute(
            "state lookup " + prepared.handle(), () -> platform.findRemoteState(prepared.handle()));
        if (remote instanceof Fail<RemoteState> fail) {
            context.validated(prepared, null);
            context.fail(fail.errorKind(), fail.message());
            return;
        }
        RemoteState remoteState = ((Ok<RemoteState>) remote).value();
        SyncDecision decision = comparator.decide(prepared.entity(), prepared.fingerprint(), remoteState);
        context.validated(prepared, decision);

        if (!decision.requiresMutation()) {
            context.skip(remoteState.platformId());
            log.debug("Group {} unchanged, skipping", groupId.getValue());
        }
    }

    private void dispatchBulk(List<GroupSyncContext> contexts) {
        List<GroupSyncContext> pending = new ArrayList<>();
        for (GroupSyncContext context : contexts) {
            if (!context.state().isTerminal()) {
                pending.add(context);
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        if (cancelled.get()) {
            for (GroupSyncContext context : pending) {
                context.fail(ErrorKind.CANCELLED, "Run cancelled before bulk dispatch");
            }
            return;
        }
        try {
            bulkDispatcher.dispatch(pending);
        } catch (RuntimeException e) {
            log.error("Bulk dispatch of {} groups failed unexpectedly", pending.size(), e);
            for (GroupSyncContext context : pending) {
                if (!context.state().isTerminal()) {
                    context.fail(ErrorKind.UNEXPECTED, describe(e));
                }
            }
        }
    }

    /**
     * 그룹마다 작업을 워커 풀에 제출하고 모두 끝날 때까지 대기.
     *
     * <p>작업에서 새어 나온 예외는 그 그룹의 실패로 기록합니다.</p>
     */
    private void runInParallel(ExecutorService workers, List<GroupSyncContext> contexts, GroupTask task) {
        List<Future<?>> futures = new ArrayList<>(contexts.size());
        for (GroupSyncContext context : contexts) {
            futures.add(workers.submit(() -> runGuarded(context, task)));
        }
        for (int i = 0; i < futures.size(); i++) {
            GroupSyncContext context = contexts.get(i);
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                failIfOpen(context, ErrorKind.CANCELLED, "Interrupted while waiting for group");
            } catch (ExecutionException e) {
                failIfOpen(context, ErrorKind.UNEXPECTED, describe(e.getCause()));
            }
        }
    }

    private void runGuarded(GroupSyncContext context, GroupTask task) {
        try {
            task.run(context);
        } catch (GroupNotFoundException e) {
            log.warn("Group {} not found", context.groupId().getValue());
            failIfOpen(context, ErrorKind.NOT_FOUND, e.getMessage());
        } catch (CatalogValidationException e) {
            log.warn("Group {} failed validation ({}): {}", context.groupId().getValue(), e.getErrorKind(), e.getDetails());
            failIfOpen(context, e.getErrorKind(), e.getDetails());
        } catch (RuntimeException e) {
            log.error("Group {} failed unexpectedly", context.groupId().getValue(), e);
            failIfOpen(context, ErrorKind.UNEXPECTED, describe(e));
        }
    }

    private static void failIfOpen(GroupSyncContext context, ErrorKind errorKind, String detail) {
        failIfOpen(context, errorKind, List.of(detail));
    }

    private static void failIfOpen(GroupSyncContext context, ErrorKind errorKind, List<String> details) {
        if (!context.state().isTerminal()) {
            context.fail(errorKind, details);
        }
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }

    /**
     * 워커 풀 graceful shutdown. 진행 중인 호출은 인터럽트하지 않고 기다립니다.
     */
    private void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("Workers did not finish within {} s, forcing shutdown", config.shutdownTimeoutSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface GroupTask {
        void run(GroupSyncContext context);
    }
}
