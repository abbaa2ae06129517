package com.ryuqq.catalogsync.core.spi;

import java.util.List;

/**
 * upsert 결과.
 *
 * <p>fieldErrors가 비어 있지 않아도 platformId가 있으면 엔티티는 생성/갱신된 것이며
 * 부분 실패로 취급됩니다. platformId가 없으면 전체 거부입니다.</p>
 *
 * @param platformId 플랫폼 엔티티 ID (거부 시 null)
 * @param variantIds 생성된 변형 ID
 * @param fieldErrors 거부된 필드
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record UpsertResult(String platformId, List<String> variantIds, List<FieldError> fieldErrors) {

    public UpsertResult {
        variantIds = variantIds == null ? List.of() : List.copyOf(variantIds);
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    public static UpsertResult success(String platformId, List<String> variantIds) {
        return new UpsertResult(platformId, variantIds, List.of());
    }

    public static UpsertResult rejected(List<FieldError> fieldErrors) {
        return new UpsertResult(null, List.of(), fieldErrors);
    }

    public boolean hasFieldErrors() {
        return !fieldErrors.isEmpty();
    }
}
