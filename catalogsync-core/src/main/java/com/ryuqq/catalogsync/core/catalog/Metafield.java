package com.ryuqq.catalogsync.core.catalog;

/**
 * 플랫폼 메타필드 한 건.
 *
 * @param namespace 네임스페이스
 * @param key 키
 * @param type 값 타입 코드 (예: "single_line_text_field")
 * @param value 문자열로 직렬화된 값
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record Metafield(String namespace, String key, String type, String value) {

    /**
     * 상품 단위 메타필드 네임스페이스.
     */
    public static final String PRODUCT_NAMESPACE = "custom.product_attributes";

    /**
     * 변형 단위 메타필드 네임스페이스.
     */
    public static final String VARIANT_NAMESPACE = "custom.variant_attributes";

    /**
     * 네 필드가 모두 채워져 있는지. 구조 검증에서 사용합니다.
     */
    public boolean isComplete() {
        return notBlank(namespace) && notBlank(key) && notBlank(type) && notBlank(value);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
