package com.ryuqq.catalogsync.core.spi;

import java.util.List;

/**
 * 제출된 벌크 작업의 핸들.
 *
 * @param operationId 플랫폼 작업 ID
 * @param handles 작업에 포함된 엔티티 핸들 (제출 순서)
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record BulkOperation(String operationId, List<String> handles) {

    public BulkOperation {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId cannot be null or blank");
        }
        handles = handles == null ? List.of() : List.copyOf(handles);
    }
}
