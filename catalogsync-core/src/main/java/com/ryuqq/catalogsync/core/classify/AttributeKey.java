package com.ryuqq.catalogsync.core.classify;

/**
 * 그룹을 분류하는 의미 단위 속성 차원.
 *
 * <p>각 키는 옵션으로 쓰일 때의 표시 이름과 메타필드 정의(key, type)를 가집니다.
 * 메타필드 네임스페이스는 상수 속성이면 상품 단위, 변형 속성이면 변형 단위로 결정됩니다.</p>
 *
 * <p>선언 순서가 분류 결과 맵의 순서입니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum AttributeKey {

    CARAT_WEIGHT("Carat Weight", "total_carat_weight", MetafieldType.TEXT),
    METAL_TYPE("Metal Type", "metal_type", MetafieldType.TEXT),
    RING_SIZE("Size", "ring_size", MetafieldType.TEXT),
    STONE_LENGTH("Stone Length", "stone_dimensions_length", MetafieldType.TEXT),
    STONE_WIDTH("Stone Width", "stone_dimensions_width", MetafieldType.TEXT),
    PLATING_TYPE("Plating", "plating_type", MetafieldType.TEXT),
    STONE_SHAPE("Stone Shape", "stone_shape", MetafieldType.TEXT),
    STONE_MATERIAL("Stone Material", "stone_material", MetafieldType.TEXT),
    CLARITY("Clarity", "clarity_grade", MetafieldType.TEXT),
    CUT_GRADE("Cut Grade", "cut_grade", MetafieldType.TEXT),
    SETTING_STYLE("Setting Style", "setting_style", MetafieldType.TEXT),
    STONE_COLOR("Stone Color", "stone_color", MetafieldType.TEXT),
    SETTING_TYPE("Setting Type", "main_setting_type", MetafieldType.TEXT),
    COLLECTION("Collection", "collection", MetafieldType.TEXT),
    JEWELRY_BRAND("Jewelry Brand", "jewelry_brand", MetafieldType.TEXT),
    GEMSTONE_BRAND("Gemstone Brand", "gemstone_brand", MetafieldType.TEXT),
    STYLE_ID("Style ID", "style_id", MetafieldType.TEXT),
    WEB_DESCRIPTOR("Web Descriptor", "web_descriptor", MetafieldType.TEXT),
    STONE_COUNT("Stone Count", "stone_count", MetafieldType.INTEGER);

    private final String displayName;
    private final String metafieldKey;
    private final MetafieldType metafieldType;

    AttributeKey(String displayName, String metafieldKey, MetafieldType metafieldType) {
        this.displayName = displayName;
        this.metafieldKey = metafieldKey;
        this.metafieldType = metafieldType;
    }

    /**
     * 옵션 이름 (예: "Metal Type").
     */
    public String displayName() {
        return displayName;
    }

    public String metafieldKey() {
        return metafieldKey;
    }

    public MetafieldType metafieldType() {
        return metafieldType;
    }

    /**
     * 메타필드 값 타입.
     */
    public enum MetafieldType {
        TEXT("single_line_text_field"),
        INTEGER("number_integer"),
        BOOLEAN("boolean");

        private final String code;

        MetafieldType(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
