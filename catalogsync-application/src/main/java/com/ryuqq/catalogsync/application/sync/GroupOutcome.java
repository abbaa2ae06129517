package com.ryuqq.catalogsync.application.sync;

/**
 * 그룹 하나의 최종 결과.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum GroupOutcome {

    CREATED,
    UPDATED,

    /**
     * 원격이 이미 최신이라 변경 요청 없음.
     */
    NO_OP,

    /**
     * 엔티티는 존재하지만 일부 필드가 거부됨. 같은 패스에서 복구하지 않음.
     */
    PARTIAL_FAILURE,

    FAILED;

    public boolean isSuccess() {
        return this == CREATED || this == UPDATED || this == NO_OP;
    }
}
