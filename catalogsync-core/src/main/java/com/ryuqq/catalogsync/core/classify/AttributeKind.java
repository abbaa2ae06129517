package com.ryuqq.catalogsync.core.classify;

/**
 * 그룹 안에서 속성 값의 분포.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum AttributeKind {

    /**
     * 모든 행이 같은 값. 제목과 상품 메타필드로 이동.
     */
    CONSTANT,

    /**
     * 2개 이상의 값. 옵션 차원 또는 변형 메타필드가 됨.
     */
    VARIANT
}
