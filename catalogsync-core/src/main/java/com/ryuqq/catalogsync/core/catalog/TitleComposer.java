package com.ryuqq.catalogsync.core.catalog;

import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.classify.ClassifiedAttribute;
import com.ryuqq.catalogsync.core.model.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 상수 속성으로 상품 제목과 설명을 조합.
 *
 * <p>제목 토큰 순서:</p>
 * <pre>
 * [캐럿 무게 (+ " DEW")] [모양] [소재] [세팅 스타일] [카테고리] [in 금속]
 * 예: "2.80 CTW DEW Cushion Moissanite Solitaire Ring in 14K White Gold"
 * </pre>
 *
 * <p>변형 속성이나 값이 없는 토큰은 건너뜁니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class TitleComposer {

    private static final String MOISSANITE = "Moissanite";

    public String title(Category category, Map<AttributeKey, ClassifiedAttribute> classified) {
        List<String> tokens = new ArrayList<>();
        constant(classified, AttributeKey.CARAT_WEIGHT).ifPresent(ctw -> {
            boolean moissanite = constant(classified, AttributeKey.STONE_MATERIAL)
                .filter(MOISSANITE::equals)
                .isPresent();
            tokens.add(moissanite ? ctw + " DEW" : ctw);
        });
        constant(classified, AttributeKey.STONE_SHAPE).ifPresent(tokens::add);
        constant(classified, AttributeKey.STONE_MATERIAL).ifPresent(tokens::add);
        constant(classified, AttributeKey.SETTING_STYLE).ifPresent(tokens::add);
        tokens.add(category.displayName());
        constant(classified, AttributeKey.METAL_TYPE).ifPresent(metal -> tokens.add("in " + metal));
        return String.join(" ", tokens);
    }

    /**
     * 설명 문장. 예: "Beautiful Moissanite jewelry. crafted in 14K White Gold. with 2.80 total carat weight."
     */
    public String description(Map<AttributeKey, ClassifiedAttribute> classified) {
        List<String> parts = new ArrayList<>();
        constant(classified, AttributeKey.STONE_MATERIAL)
            .ifPresent(material -> parts.add("Beautiful " + material + " jewelry"));
        constant(classified, AttributeKey.METAL_TYPE)
            .ifPresent(metal -> parts.add("crafted in " + metal));
        constant(classified, AttributeKey.CARAT_WEIGHT)
            .ifPresent(ctw -> parts.add("with " + ctw.replace(" CTW", "") + " total carat weight"));
        if (parts.isEmpty()) {
            return "";
        }
        return String.join(". ", parts) + ".";
    }

    private static Optional<String> constant(Map<AttributeKey, ClassifiedAttribute> classified, AttributeKey key) {
        ClassifiedAttribute attribute = classified.get(key);
        if (attribute == null || !attribute.isConstant()) {
            return Optional.empty();
        }
        return Optional.of(attribute.constantValue().display());
    }
}
