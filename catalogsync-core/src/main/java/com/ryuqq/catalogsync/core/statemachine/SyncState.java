package com.ryuqq.catalogsync.core.statemachine;

/**
 * 그룹 하나의 동기화 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► FAILED (실행 취소)
 *    ▼
 * VALIDATING
 *    │
 *    ├─► SKIPPED (원격이 이미 최신)
 *    ├─► FAILED (검증 실패, 그룹 없음)
 *    ▼
 * DISPATCHING
 *    │
 *    ├─► SUCCEEDED
 *    ├─► PARTIAL_FAILURE (엔티티는 생성됐으나 일부 필드 거부)
 *    └─► FAILED
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum SyncState {

    PENDING,

    /**
     * 조회, 분류, 생성, 구조 검증, 원격 상태 비교.
     */
    VALIDATING,

    SKIPPED,

    DISPATCHING,

    SUCCEEDED,

    PARTIAL_FAILURE,

    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SKIPPED, SUCCEEDED, PARTIAL_FAILURE, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SKIPPED || this == SUCCEEDED || this == PARTIAL_FAILURE || this == FAILED;
    }
}
