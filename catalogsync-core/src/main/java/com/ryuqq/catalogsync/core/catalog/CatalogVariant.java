package com.ryuqq.catalogsync.core.catalog;

import java.math.BigDecimal;
import java.util.List;

/**
 * 플랫폼 변형 한 건. 원본 행 하나에 대응합니다.
 *
 * <p>optionValues는 엔티티의 옵션 순서와 같은 순서이며, 그룹 안에서 유일합니다.
 * 가격/재고 등 상거래 필드는 원본 그대로 전달되고 null일 수 있습니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record CatalogVariant(
    String sku,
    List<String> optionValues,
    BigDecimal price,
    BigDecimal compareAtPrice,
    Integer inventoryQuantity,
    BigDecimal weightGrams,
    String barcode,
    List<Metafield> metafields
) {

    public CatalogVariant {
        if (sku == null) {
            throw new IllegalArgumentException("sku cannot be null");
        }
        optionValues = optionValues == null ? List.of() : List.copyOf(optionValues);
        metafields = metafields == null ? List.of() : List.copyOf(metafields);
    }
}
