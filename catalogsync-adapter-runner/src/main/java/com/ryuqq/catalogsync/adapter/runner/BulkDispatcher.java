package com.ryuqq.catalogsync.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.catalogsync.application.pipeline.PreparedGroup;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.fingerprint.CanonicalForm;
import com.ryuqq.catalogsync.core.outcome.Fail;
import com.ryuqq.catalogsync.core.outcome.Ok;
import com.ryuqq.catalogsync.core.outcome.Outcome;
import com.ryuqq.catalogsync.core.spi.BulkOperation;
import com.ryuqq.catalogsync.core.spi.BulkStatus;
import com.ryuqq.catalogsync.core.spi.CatalogPlatform;
import com.ryuqq.catalogsync.core.spi.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 변경이 필요한 그룹들을 하나의 벌크 작업으로 디스패치.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 엔티티마다 정규 JSON 한 줄 (+ fingerprint, operation)
 * 2. submitBulk(lines) → BulkOperation       (한 번만 제출)
 * 3. while (경과 시간 &lt; bulkTimeout):
 *      pollBulk(operation)
 *      - RUNNING   → sleep(bulkPollInterval)
 *      - COMPLETED → 핸들별 결과 해석
 *      - FAILED    → 모든 그룹 FAILED
 * 4. 제한 시간 초과 → 모든 그룹 FAILED / BULK_TIMEOUT
 * </pre>
 *
 * <p>제출과 폴링도 원격 호출이므로 {@link RetryExecutor}를 거칩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
final class BulkDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BulkDispatcher.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CatalogPlatform platform;
    private final RetryExecutor retryExecutor;
    private final CanonicalForm canonicalForm;
    private final SyncRunnerConfig config;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    BulkDispatcher(CatalogPlatform platform,
                   RetryExecutor retryExecutor,
                   CanonicalForm canonicalForm,
                   SyncRunnerConfig config,
                   Sleeper sleeper,
                   LongSupplier nanoClock) {
        this.platform = platform;
        this.retryExecutor = retryExecutor;
        this.canonicalForm = canonicalForm;
        this.config = config;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    /**
     * 벌크 디스패치. 반환 시 모든 컨텍스트는 종료 상태입니다.
     *
     * @param contexts VALIDATING 상태이고 변경이 필요한 그룹
     */
    void dispatch(List<GroupSyncContext> contexts) {
        if (contexts.isEmpty()) {
            return;
        }
        List<String> lines = new ArrayList<>(contexts.size());
        for (GroupSyncContext context : contexts) {
            context.startDispatching();
            lines.add(serialize(context));
        }

        Outcome<BulkOperation> submitted = retryExecutor.execute(
            "bulk submit (" + lines.size() + " entities)", () -> platform.submitBulk(lines));
        if (submitted instanceof Fail<BulkOperation> fail) {
            failAll(contexts, fail.errorKind(), fail.message());
            return;
        }
        BulkOperation operation = ((Ok<BulkOperation>) submitted).value();
        log.info("Submitted bulk operation {} with {} entities", operation.operationId(), lines.size());

        BulkStatus status = awaitCompletion(operation, contexts);
        if (status == null) {
            return;
        }
        if (status.state() == BulkStatus.State.FAILED) {
            failAll(contexts, ErrorKind.REMOTE_REJECTION,
                "Bulk operation " + operation.operationId() + " failed: " + status.errorMessage());
            return;
        }

        log.info("Bulk operation {} completed with {} results", operation.operationId(), status.results().size());
        for (GroupSyncContext context : contexts) {
            PreparedGroup prepared = context.prepared();
            UpsertResult result = status.results().get(prepared.handle());
            if (result == null) {
                context.fail(ErrorKind.REMOTE_REJECTION,
                    "Bulk operation " + operation.operationId() + " returned no result for " + prepared.handle());
            } else {
                context.complete(DispatchResults.interpret(prepared.entity(), context.decision(), result));
            }
        }
    }

    /**
     * 종료 상태가 될 때까지 폴링.
     *
     * @return 종료된 상태, 실패/시간 초과로 그룹을 이미 확정했으면 null
     */
    private BulkStatus awaitCompletion(BulkOperation operation, List<GroupSyncContext> contexts) {
        long deadline = nanoClock.getAsLong() + TimeUnit.MILLISECONDS.toNanos(config.bulkTimeoutMs());
        while (true) {
            Outcome<BulkStatus> polled = retryExecutor.execute(
                "bulk poll " + operation.operationId(), () -> platform.pollBulk(operation));
            if (polled instanceof Fail<BulkStatus> fail) {
                failAll(contexts, fail.errorKind(), fail.message());
                return null;
            }
            BulkStatus status = ((Ok<BulkStatus>) polled).value();
            if (!status.isRunning()) {
                return status;
            }
            if (nanoClock.getAsLong() - deadline >= 0) {
                log.warn("Bulk operation {} still running after {} ms", operation.operationId(), config.bulkTimeoutMs());
                failAll(contexts, ErrorKind.BULK_TIMEOUT,
                    "Bulk operation " + operation.operationId() + " did not finish within " + config.bulkTimeoutMs() + " ms");
                return null;
            }
            try {
                sleeper.sleep(config.bulkPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failAll(contexts, ErrorKind.CANCELLED,
                    "Interrupted while polling bulk operation " + operation.operationId());
                return null;
            }
        }
    }

    private String serialize(GroupSyncContext context) {
        PreparedGroup prepared = context.prepared();
        ObjectNode tree = canonicalForm.toTree(prepared.entity());
        tree.put("fingerprint", prepared.fingerprint().getValue());
        tree.put("operation", context.decision().name());
        try {
            return MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + prepared.handle(), e);
        }
    }

    private static void failAll(List<GroupSyncContext> contexts, ErrorKind errorKind, String message) {
        for (GroupSyncContext context : contexts) {
            context.fail(errorKind, message);
        }
    }
}
