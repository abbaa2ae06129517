package com.ryuqq.catalogsync.core.fingerprint;

/**
 * 디스패치 결정.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum SyncDecision {

    CREATE,
    UPDATE,

    /**
     * 원격 상태가 이미 최신. 변경 요청을 보내지 않음.
     */
    NO_OP;

    public boolean requiresMutation() {
        return this != NO_OP;
    }
}
