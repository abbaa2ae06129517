package com.ryuqq.catalogsync.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 벌크 작업 폴링 결과.
 *
 * <p>COMPLETED일 때 results에 핸들별 결과가 들어 있습니다. 결과가 없는 핸들은
 * 플랫폼이 처리하지 못한 것으로 간주합니다.</p>
 *
 * @param state 작업 상태
 * @param results 핸들 → upsert 결과
 * @param errorMessage FAILED일 때 사유 (null 가능)
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record BulkStatus(State state, Map<String, UpsertResult> results, String errorMessage) {

    public enum State {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public BulkStatus {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        results = results == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static BulkStatus running() {
        return new BulkStatus(State.RUNNING, Map.of(), null);
    }

    public static BulkStatus completed(Map<String, UpsertResult> results) {
        return new BulkStatus(State.COMPLETED, results, null);
    }

    public static BulkStatus failed(String errorMessage) {
        return new BulkStatus(State.FAILED, Map.of(), errorMessage);
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }
}
