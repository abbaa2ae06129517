package com.ryuqq.catalogsync.core.fingerprint;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.model.MediaRef;

/**
 * 로컬 엔티티와 원격 상태를 비교해 변경 필요 여부 결정.
 *
 * <ul>
 *   <li>원격 platformId 없음 → CREATE</li>
 *   <li>지문 동일 + 로컬 미디어가 모두 원격에 존재 → NO_OP</li>
 *   <li>그 외 → UPDATE</li>
 * </ul>
 *
 * <p>변경 요청을 보낼지 판단하는 유일한 관문입니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class StateComparator {

    public SyncDecision decide(CatalogEntity entity, SyncFingerprint fingerprint, RemoteState remote) {
        if (entity == null || fingerprint == null || remote == null) {
            throw new IllegalArgumentException("entity, fingerprint and remote cannot be null");
        }
        if (!remote.exists()) {
            return SyncDecision.CREATE;
        }
        if (fingerprint.equals(remote.lastFingerprint()) && mediaPresent(entity, remote)) {
            return SyncDecision.NO_OP;
        }
        return SyncDecision.UPDATE;
    }

    private static boolean mediaPresent(CatalogEntity entity, RemoteState remote) {
        for (MediaRef ref : entity.media()) {
            if (!remote.existingMediaUris().contains(ref.uri())) {
                return false;
            }
        }
        return true;
    }
}
