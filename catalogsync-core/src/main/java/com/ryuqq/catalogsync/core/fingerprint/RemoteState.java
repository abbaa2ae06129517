package com.ryuqq.catalogsync.core.fingerprint;

import java.util.Set;

/**
 * 플랫폼에 기록된 엔티티 상태.
 *
 * <p>그룹마다 디스패치 결정 직전에 조회하며, 한 패스를 넘어 캐시하지 않습니다.</p>
 *
 * @param platformId 플랫폼 엔티티 ID (없으면 null)
 * @param lastFingerprint 마지막으로 기록된 지문 (없으면 null)
 * @param existingMediaUris 이미 첨부된 미디어 URI
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record RemoteState(String platformId, SyncFingerprint lastFingerprint, Set<String> existingMediaUris) {

    public RemoteState {
        existingMediaUris = existingMediaUris == null ? Set.of() : Set.copyOf(existingMediaUris);
    }

    /**
     * 플랫폼에 아직 없는 엔티티.
     */
    public static RemoteState none() {
        return new RemoteState(null, null, Set.of());
    }

    public boolean exists() {
        return platformId != null;
    }
}
