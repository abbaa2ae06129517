package com.ryuqq.catalogsync.core.catalog;

import com.ryuqq.catalogsync.core.classify.AttributeKey;

import java.util.List;

/**
 * 상품 옵션 차원 (예: "Size": 5.0, 6.0, 6.5).
 *
 * @param key 속성 키
 * @param name 옵션 이름
 * @param values 정규 순서로 정렬된 값
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record VariantOption(AttributeKey key, String name, List<String> values) {

    public VariantOption {
        if (key == null || name == null || name.isBlank()) {
            throw new IllegalArgumentException("key and name cannot be null");
        }
        if (values == null || values.size() < 2) {
            throw new IllegalArgumentException("Option " + name + " needs at least two values");
        }
        values = List.copyOf(values);
    }
}
