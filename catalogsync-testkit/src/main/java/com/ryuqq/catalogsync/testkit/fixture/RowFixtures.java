package com.ryuqq.catalogsync.testkit.fixture;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.catalog.VariantBuilder;
import com.ryuqq.catalogsync.core.classify.AttributeClassifier;
import com.ryuqq.catalogsync.core.classify.CategoryRuleBook;
import com.ryuqq.catalogsync.core.classify.CategoryRules;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import com.ryuqq.catalogsync.core.normalize.FieldNormalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 원본 행과 그룹.
 *
 * <p>기본 반지는 14K White Gold, 2.80 CTW Cushion Moissanite Solitaire 입니다.
 * 사이즈만 다른 행들로 그룹을 만들면 옵션이 {@code Size} 하나인 상품이 됩니다.</p>
 *
 * <pre>
 * Group group = RowFixtures.ringGroup("GRP-R100", "5", "6", "6.5");
 * // SKU: R100-5, R100-6, R100-6.5
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class RowFixtures {

    private RowFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 반지 행 빌더. 호출자가 속성을 덮어쓸 수 있습니다.
     */
    public static RawComponentRow.Builder ring(String groupId, String sku) {
        return RawComponentRow.builder(sku, GroupId.of(groupId))
            .category("RING")
            .subgroup("SOLITAIRE")
            .metal("14K", "WHITE")
            .material("MOI")
            .shape("CU")
            .clarity("VVS1")
            .cut("EX")
            .caratWeight("2.80")
            .collection("Forever One")
            .gemstoneBrand("Charles & Colvard")
            .imageSku(groupId)
            .price(new BigDecimal("899.00"))
            .compareAtPrice(new BigDecimal("1099.00"))
            .inventoryQuantity(3)
            .weightGrams(new BigDecimal("3.2"));
    }

    public static RawComponentRow ringRow(String groupId, String size) {
        return ring(groupId, skuPrefix(groupId) + "-" + size).ringSize(size).build();
    }

    /**
     * 사이즈별 행 하나씩으로 구성된 반지 그룹.
     */
    public static Group ringGroup(String groupId, String... sizes) {
        List<RawComponentRow> rows = new ArrayList<>();
        for (String size : sizes) {
            rows.add(ringRow(groupId, size));
        }
        return Group.of(GroupId.of(groupId), rows);
    }

    /**
     * 기본 귀걸이 행 빌더 (18K Yellow Gold, 1.00 CTW Round Lab-Grown Diamond, 4.0mm).
     */
    public static RawComponentRow.Builder earring(String groupId, String sku) {
        return RawComponentRow.builder(sku, GroupId.of(groupId))
            .category("EARRING")
            .subgroup("STUD")
            .metal("18K", "YELLOW")
            .material("LGD")
            .shape("RD")
            .caratWeight("1.00")
            .dimensions(new BigDecimal("4.0"), new BigDecimal("4.0"))
            .piecesPer(2)
            .price(new BigDecimal("450.00"))
            .inventoryQuantity(10);
    }

    /**
     * 기본 규칙과 설정으로 그룹의 엔티티를 생성합니다.
     */
    public static CatalogEntity entity(Group group, MediaRef... media) {
        FieldNormalizer normalizer = new FieldNormalizer();
        CategoryRules rules = CategoryRuleBook.defaults().rulesFor(group.getCategory());
        return new VariantBuilder(normalizer, new CatalogSettings())
            .build(group, new AttributeClassifier(normalizer).classify(group, rules), rules, List.of(media));
    }

    private static String skuPrefix(String groupId) {
        int dash = groupId.lastIndexOf('-');
        return dash < 0 ? groupId : groupId.substring(dash + 1);
    }
}
