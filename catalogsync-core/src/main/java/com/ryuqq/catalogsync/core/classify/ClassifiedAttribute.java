package com.ryuqq.catalogsync.core.classify;

import com.ryuqq.catalogsync.core.normalize.CanonicalValue;

import java.util.List;

/**
 * 분류된 속성.
 *
 * <p>values는 정규 순서로 정렬된 서로 다른 값이며, CONSTANT이면 정확히 1개,
 * VARIANT이면 2개 이상입니다.</p>
 *
 * @param key 속성 키
 * @param kind 상수/변형 구분
 * @param values 정렬된 서로 다른 정규 값
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record ClassifiedAttribute(AttributeKey key, AttributeKind kind, List<CanonicalValue> values) {

    public ClassifiedAttribute {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        if (kind == AttributeKind.CONSTANT && values.size() != 1) {
            throw new IllegalArgumentException("CONSTANT attribute must have exactly one value: " + values);
        }
        if (kind == AttributeKind.VARIANT && values.size() < 2) {
            throw new IllegalArgumentException("VARIANT attribute must have at least two values: " + values);
        }
        values = List.copyOf(values);
    }

    public boolean isConstant() {
        return kind == AttributeKind.CONSTANT;
    }

    public boolean isVariant() {
        return kind == AttributeKind.VARIANT;
    }

    /**
     * 상수 속성의 유일한 값.
     *
     * @throws IllegalStateException 변형 속성인 경우
     */
    public CanonicalValue constantValue() {
        if (!isConstant()) {
            throw new IllegalStateException(key + " is not constant");
        }
        return values.get(0);
    }
}
