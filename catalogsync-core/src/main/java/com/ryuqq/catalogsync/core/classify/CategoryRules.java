package com.ryuqq.catalogsync.core.classify;

import com.ryuqq.catalogsync.core.model.Category;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 카테고리별 분류 규칙.
 *
 * <p>optionPriority는 옵션 차원이 될 수 있는 키를 우선순위 순으로 나열하고,
 * detailKeys는 메타필드로만 쓰이는 키입니다. 두 목록은 겹치지 않습니다.</p>
 *
 * @param category 대상 카테고리
 * @param optionPriority 옵션 후보 키 (우선순위 순)
 * @param detailKeys 메타필드 전용 키
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record CategoryRules(Category category, List<AttributeKey> optionPriority, Set<AttributeKey> detailKeys) {

    public CategoryRules {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (optionPriority == null || detailKeys == null) {
            throw new IllegalArgumentException("optionPriority and detailKeys cannot be null");
        }
        if (optionPriority.stream().distinct().count() != optionPriority.size()) {
            throw new IllegalArgumentException("optionPriority contains duplicates: " + optionPriority);
        }
        for (AttributeKey key : optionPriority) {
            if (detailKeys.contains(key)) {
                throw new IllegalArgumentException(key + " cannot be both option and detail key");
            }
        }
        optionPriority = List.copyOf(optionPriority);
        detailKeys = detailKeys.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(detailKeys));
    }

    /**
     * 분류 대상 키 전체 (옵션 ∪ 상세).
     */
    public Set<AttributeKey> eligibleKeys() {
        EnumSet<AttributeKey> keys = EnumSet.noneOf(AttributeKey.class);
        keys.addAll(optionPriority);
        keys.addAll(detailKeys);
        return keys;
    }

    public boolean isOptionKey(AttributeKey key) {
        return optionPriority.contains(key);
    }
}
