package com.ryuqq.catalogsync.core.fingerprint;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogVariant;
import com.ryuqq.catalogsync.core.catalog.Metafield;
import com.ryuqq.catalogsync.core.catalog.VariantOption;
import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.model.ProductFlag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FingerprintCalculator / CanonicalForm 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class FingerprintCalculatorTest {

    private final CanonicalForm canonicalForm = new CanonicalForm();
    private final FingerprintCalculator calculator = new FingerprintCalculator(canonicalForm);

    @Test
    void fingerprint_SameEntity_SameValue() {
        assertThat(calculator.fingerprint(entity("899.00", "Solitaire")))
            .isEqualTo(calculator.fingerprint(entity("899.00", "Solitaire")));
    }

    @Test
    void fingerprint_Is64LowercaseHex() {
        assertThat(calculator.fingerprint(entity("899.00", "Solitaire")).getValue()).matches("[0-9a-f]{64}");
    }

    @Test
    void fingerprint_PriceScaleDoesNotMatter() {
        assertThat(calculator.fingerprint(entity("899.0", "Solitaire")))
            .isEqualTo(calculator.fingerprint(entity("899.00", "Solitaire")));
    }

    @Test
    void fingerprint_MeaningfulChange_ChangesValue() {
        SyncFingerprint original = calculator.fingerprint(entity("899.00", "Solitaire"));

        assertThat(calculator.fingerprint(entity("949.00", "Solitaire"))).isNotEqualTo(original);
        assertThat(calculator.fingerprint(entity("899.00", "Halo"))).isNotEqualTo(original);
    }

    @Test
    void fingerprint_ConstantInsertionOrderDoesNotMatter() {
        // given
        Map<AttributeKey, String> forward = new LinkedHashMap<>();
        forward.put(AttributeKey.METAL_TYPE, "14K White Gold");
        forward.put(AttributeKey.SETTING_STYLE, "Solitaire");
        Map<AttributeKey, String> backward = new LinkedHashMap<>();
        backward.put(AttributeKey.SETTING_STYLE, "Solitaire");
        backward.put(AttributeKey.METAL_TYPE, "14K White Gold");

        // then
        assertThat(calculator.fingerprint(entity(forward, "899.00")))
            .isEqualTo(calculator.fingerprint(entity(backward, "899.00")));
    }

    @Test
    void canonicalTree_SortsMetafieldsByNamespaceThenKey() {
        // when
        JsonNode tree = canonicalForm.toTree(entity("899.00", "Solitaire"));

        // then
        JsonNode metafields = tree.get("metafields");
        assertThat(metafields.get(0).get("key").asText()).isEqualTo("is_best_seller");
        assertThat(metafields.get(1).get("key").asText()).isEqualTo("metal_type");
        assertThat(metafields.get(2).get("key").asText()).isEqualTo("setting_style");
        assertThat(tree.get("handle").asText()).isEqualTo("solitaire-ring-grp-r100");
        assertThat(tree.get("variants").get(0).get("price").asText()).isEqualTo("899");
    }

    private static CatalogEntity entity(String price, String settingStyle) {
        Map<AttributeKey, String> constants = new LinkedHashMap<>();
        constants.put(AttributeKey.METAL_TYPE, "14K White Gold");
        constants.put(AttributeKey.SETTING_STYLE, settingStyle);
        return entity(constants, price);
    }

    private static CatalogEntity entity(Map<AttributeKey, String> constants, String price) {
        List<CatalogVariant> variants = List.of(
            new CatalogVariant("R100-5", List.of("5.0"), new BigDecimal(price), null, 3, null, null,
                List.of(new Metafield(Metafield.VARIANT_NAMESPACE, "clarity_grade", "single_line_text_field", "VVS1"))),
            new CatalogVariant("R100-6", List.of("6.0"), new BigDecimal(price), null, 2, null, null, List.of())
        );
        return new CatalogEntity(
            GroupId.of("GRP-R100"),
            "Solitaire Ring",
            "solitaire-ring-grp-r100",
            "Ring",
            "Beautiful Moissanite jewelry.",
            "Charles Colvard",
            "ACTIVE",
            constants,
            Map.of(ProductFlag.BEST_SELLER, true),
            List.of(new VariantOption(AttributeKey.RING_SIZE, "Size", List.of("5.0", "6.0"))),
            variants,
            List.of(MediaRef.of("https://cdn.example.com/r100.jpg"))
        );
    }
}
