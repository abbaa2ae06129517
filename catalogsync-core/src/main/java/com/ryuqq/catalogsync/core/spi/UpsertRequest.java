package com.ryuqq.catalogsync.core.spi;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.fingerprint.SyncFingerprint;

/**
 * 원자적 upsert 요청: 상품, 옵션, 변형, 메타필드, 미디어를 한 번에 전달합니다.
 *
 * <p>핸들이 멱등 키입니다. 같은 요청을 재시도해도 원격 엔티티는 하나입니다.
 * fingerprint는 원격에 함께 기록되어 다음 실행의 NO_OP 판정에 쓰입니다.</p>
 *
 * @param entity 카탈로그 엔티티
 * @param fingerprint 엔티티 지문
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record UpsertRequest(CatalogEntity entity, SyncFingerprint fingerprint) {

    public UpsertRequest {
        if (entity == null || fingerprint == null) {
            throw new IllegalArgumentException("entity and fingerprint cannot be null");
        }
    }

    public String handle() {
        return entity.handle();
    }
}
