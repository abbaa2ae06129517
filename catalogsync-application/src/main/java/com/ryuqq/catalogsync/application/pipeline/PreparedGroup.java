package com.ryuqq.catalogsync.application.pipeline;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.fingerprint.SyncFingerprint;
import com.ryuqq.catalogsync.core.model.Group;

/**
 * 검증을 통과해 디스패치 결정만 남은 그룹.
 *
 * @param group 원본 그룹
 * @param entity 생성된 카탈로그 엔티티
 * @param fingerprint 엔티티 지문
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record PreparedGroup(Group group, CatalogEntity entity, SyncFingerprint fingerprint) {

    public PreparedGroup {
        if (group == null || entity == null || fingerprint == null) {
            throw new IllegalArgumentException("group, entity and fingerprint cannot be null");
        }
    }

    public String handle() {
        return entity.handle();
    }
}
