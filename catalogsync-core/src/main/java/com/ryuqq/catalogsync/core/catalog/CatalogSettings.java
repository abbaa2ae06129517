package com.ryuqq.catalogsync.core.catalog;

/**
 * 카탈로그 엔티티 생성 설정.
 *
 * @param vendor 판매자 표시명
 * @param status 상품 상태 (예: ACTIVE, DRAFT)
 * @param maxTitleLength 제목 최대 길이
 * @param maxHandleLength 핸들 최대 길이
 * @param maxOptions 플랫폼이 허용하는 옵션 차원 수
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record CatalogSettings(
    String vendor,
    String status,
    int maxTitleLength,
    int maxHandleLength,
    int maxOptions
) {

    /**
     * 기본값: vendor "Charles Colvard", ACTIVE, 제목/핸들 255자, 옵션 3개.
     */
    public CatalogSettings() {
        this("Charles Colvard", "ACTIVE", 255, 255, 3);
    }

    public CatalogSettings {
        if (vendor == null || vendor.isBlank()) {
            throw new IllegalArgumentException("vendor cannot be null or blank");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status cannot be null or blank");
        }
        if (maxTitleLength <= 0) {
            throw new IllegalArgumentException("maxTitleLength must be positive");
        }
        if (maxHandleLength <= 0) {
            throw new IllegalArgumentException("maxHandleLength must be positive");
        }
        if (maxOptions <= 0) {
            throw new IllegalArgumentException("maxOptions must be positive");
        }
    }

    public CatalogSettings withVendor(String vendor) {
        return new CatalogSettings(vendor, status, maxTitleLength, maxHandleLength, maxOptions);
    }

    public CatalogSettings withStatus(String status) {
        return new CatalogSettings(vendor, status, maxTitleLength, maxHandleLength, maxOptions);
    }

    public CatalogSettings withMaxHandleLength(int maxHandleLength) {
        return new CatalogSettings(vendor, status, maxTitleLength, maxHandleLength, maxOptions);
    }

    public CatalogSettings withMaxOptions(int maxOptions) {
        return new CatalogSettings(vendor, status, maxTitleLength, maxHandleLength, maxOptions);
    }
}
