package com.ryuqq.catalogsync.core.model;

/**
 * 이미지 서브시스템이 검증을 마친 미디어 참조.
 *
 * <p>코어는 내용을 해석하지 않고, 받은 순서 그대로 카탈로그 엔티티에 첨부합니다.</p>
 *
 * @param uri 미디어 위치 (예: 업로드된 이미지 URL)
 * @param altText 대체 텍스트 (선택, null 가능)
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record MediaRef(String uri, String altText) {

    public MediaRef {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
    }

    public static MediaRef of(String uri) {
        return new MediaRef(uri, null);
    }
}
