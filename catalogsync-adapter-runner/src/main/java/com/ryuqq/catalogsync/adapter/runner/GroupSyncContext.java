package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.application.pipeline.PreparedGroup;
import com.ryuqq.catalogsync.application.sync.GroupOutcome;
import com.ryuqq.catalogsync.application.sync.GroupResult;
import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.fingerprint.SyncDecision;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.statemachine.StateTransition;
import com.ryuqq.catalogsync.core.statemachine.SyncState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 그룹 하나의 실행 중 상태.
 *
 * <p>한 번에 한 워커만 접근합니다. 모든 상태 변경은 {@link StateTransition}을 거치며,
 * 종료 상태에 도달할 때 {@link GroupResult}가 확정됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
final class GroupSyncContext {

    private static final Logger log = LoggerFactory.getLogger(GroupSyncContext.class);

    private final GroupId groupId;
    private SyncState state = SyncState.PENDING;
    private PreparedGroup prepared;
    private SyncDecision decision;
    private GroupResult result;

    GroupSyncContext(GroupId groupId) {
        this.groupId = groupId;
    }

    GroupId groupId() {
        return groupId;
    }

    SyncState state() {
        return state;
    }

    PreparedGroup prepared() {
        return prepared;
    }

    SyncDecision decision() {
        return decision;
    }

    GroupResult result() {
        return result;
    }

    void startValidating() {
        moveTo(SyncState.VALIDATING);
    }

    void validated(PreparedGroup prepared, SyncDecision decision) {
        this.prepared = prepared;
        this.decision = decision;
    }

    void startDispatching() {
        moveTo(SyncState.DISPATCHING);
    }

    /**
     * 원격이 이미 최신. VALIDATING → SKIPPED.
     */
    GroupResult skip(String platformId) {
        moveTo(SyncState.SKIPPED);
        result = GroupResult.succeeded(GroupOutcome.NO_OP, platformId, prepared.entity());
        return result;
    }

    /**
     * 디스패치 결과 확정. 결과 종류에 맞는 종료 상태로 이동합니다.
     */
    GroupResult complete(GroupResult dispatched) {
        switch (dispatched.outcome()) {
            case CREATED:
            case UPDATED:
                moveTo(SyncState.SUCCEEDED);
                break;
            case PARTIAL_FAILURE:
                moveTo(SyncState.PARTIAL_FAILURE);
                break;
            default:
                moveTo(SyncState.FAILED);
                break;
        }
        result = dispatched;
        return result;
    }

    GroupResult fail(ErrorKind errorKind, List<String> details) {
        moveTo(SyncState.FAILED);
        CatalogEntity entity = prepared == null ? null : prepared.entity();
        result = GroupResult.failed(groupId, errorKind, details, entity);
        return result;
    }

    GroupResult fail(ErrorKind errorKind, String detail) {
        return fail(errorKind, List.of(detail));
    }

    private void moveTo(SyncState next) {
        SyncState previous = state;
        state = StateTransition.transition(state, next);
        log.debug("Group {} {} → {}", groupId.getValue(), previous, next);
    }
}
