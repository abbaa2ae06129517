package com.ryuqq.catalogsync.core.classify;

import com.ryuqq.catalogsync.core.model.Category;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.catalogsync.core.classify.AttributeKey.*;

/**
 * 카테고리 → {@link CategoryRules} 조회표.
 *
 * <p>기본 규칙:</p>
 * <pre>
 * RING                      : Carat Weight, Metal Type, Size
 * EARRING                   : Carat Weight, Metal Type, Stone Length
 * NECKLACE/BRACELET/PENDANT : Carat Weight, Metal Type, Plating
 * GEMSTONE                  : Carat Weight, Stone Length, Stone Width
 * OTHER                     : Carat Weight, Metal Type, Stone Shape
 * </pre>
 *
 * <p>옵션 후보가 아닌 나머지 공통 키는 상세(메타필드 전용) 키입니다.
 * {@link #withRules(CategoryRules)}로 카테고리 단위 재정의가 가능합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class CategoryRuleBook {

    private static final Set<AttributeKey> COMMON_DETAILS = EnumSet.of(
        STONE_LENGTH, STONE_WIDTH, PLATING_TYPE, STONE_SHAPE, STONE_MATERIAL, CLARITY, CUT_GRADE,
        SETTING_STYLE, STONE_COLOR, SETTING_TYPE, COLLECTION, JEWELRY_BRAND, GEMSTONE_BRAND,
        STYLE_ID, WEB_DESCRIPTOR, STONE_COUNT
    );

    private final Map<Category, CategoryRules> rules;

    private CategoryRuleBook(Map<Category, CategoryRules> rules) {
        this.rules = rules;
    }

    public static CategoryRuleBook defaults() {
        Map<Category, CategoryRules> rules = new EnumMap<>(Category.class);
        put(rules, Category.RING, List.of(CARAT_WEIGHT, METAL_TYPE, RING_SIZE));
        put(rules, Category.EARRING, List.of(CARAT_WEIGHT, METAL_TYPE, STONE_LENGTH));
        put(rules, Category.NECKLACE, List.of(CARAT_WEIGHT, METAL_TYPE, PLATING_TYPE));
        put(rules, Category.BRACELET, List.of(CARAT_WEIGHT, METAL_TYPE, PLATING_TYPE));
        put(rules, Category.PENDANT, List.of(CARAT_WEIGHT, METAL_TYPE, PLATING_TYPE));
        put(rules, Category.GEMSTONE, List.of(CARAT_WEIGHT, STONE_LENGTH, STONE_WIDTH));
        put(rules, Category.OTHER, List.of(CARAT_WEIGHT, METAL_TYPE, STONE_SHAPE));
        return new CategoryRuleBook(rules);
    }

    private static void put(Map<Category, CategoryRules> rules, Category category, List<AttributeKey> options) {
        EnumSet<AttributeKey> details = EnumSet.copyOf(COMMON_DETAILS);
        options.forEach(details::remove);
        rules.put(category, new CategoryRules(category, options, details));
    }

    /**
     * 한 카테고리의 규칙을 교체한 새 조회표.
     */
    public CategoryRuleBook withRules(CategoryRules override) {
        if (override == null) {
            throw new IllegalArgumentException("override cannot be null");
        }
        Map<Category, CategoryRules> copy = new EnumMap<>(rules);
        copy.put(override.category(), override);
        return new CategoryRuleBook(copy);
    }

    public CategoryRules rulesFor(Category category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return rules.get(category);
    }
}
