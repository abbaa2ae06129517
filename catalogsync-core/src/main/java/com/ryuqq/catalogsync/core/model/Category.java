package com.ryuqq.catalogsync.core.model;

import java.util.Locale;

/**
 * 상품 카테고리 (Item Category Code).
 *
 * <p>카테고리마다 옵션 우선순위와 메타필드 대상 속성이 다르며,
 * 이는 {@link com.ryuqq.catalogsync.core.classify.CategoryRules}에 정의됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum Category {

    RING("Ring"),
    EARRING("Earring"),
    NECKLACE("Necklace"),
    BRACELET("Bracelet"),
    PENDANT("Pendant"),
    GEMSTONE("Gemstone"),
    OTHER("Jewelry");

    private final String displayName;

    Category(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 원본 카테고리 코드 해석.
     *
     * <p>알 수 없는 코드나 빈 값은 {@link #OTHER}로 매핑합니다.</p>
     *
     * @param code 원본 코드 (예: "RING", "earring")
     * @return Category
     */
    public static Category fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        // 복수형 코드 (RINGS, EARRINGS) 허용
        if (normalized.endsWith("S")) {
            return fromCode(normalized.substring(0, normalized.length() - 1));
        }
        return OTHER;
    }

    /**
     * 제목과 productType에 쓰이는 표시 이름.
     *
     * @return 표시 이름 (예: "Ring")
     */
    public String displayName() {
        return displayName;
    }
}
