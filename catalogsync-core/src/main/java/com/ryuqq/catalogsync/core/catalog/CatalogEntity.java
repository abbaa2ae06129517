package com.ryuqq.catalogsync.core.catalog;

import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.model.ProductFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 플랫폼에 전달되는 상품 하나.
 *
 * <p>{@link VariantBuilder}가 생성하며, 이후 어떤 단계에서도 변경되지 않습니다.
 * 상품 단위 메타필드는 {@link #metafields()}로 상수 속성과 플래그에서 파생됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record CatalogEntity(
    GroupId groupId,
    String title,
    String handle,
    String productType,
    String description,
    String vendor,
    String status,
    Map<AttributeKey, String> constantAttributes,
    Map<ProductFlag, Boolean> flags,
    List<VariantOption> options,
    List<CatalogVariant> variants,
    List<MediaRef> media
) {

    public CatalogEntity {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("handle cannot be null or blank");
        }
        Map<AttributeKey, String> attributes = new EnumMap<>(AttributeKey.class);
        if (constantAttributes != null) {
            attributes.putAll(constantAttributes);
        }
        constantAttributes = Collections.unmodifiableMap(attributes);
        Map<ProductFlag, Boolean> flagCopy = new EnumMap<>(ProductFlag.class);
        if (flags != null) {
            flagCopy.putAll(flags);
        }
        flags = Collections.unmodifiableMap(flagCopy);
        options = options == null ? List.of() : List.copyOf(options);
        variants = variants == null ? List.of() : List.copyOf(variants);
        media = media == null ? List.of() : List.copyOf(media);
    }

    /**
     * 상품 단위 메타필드: 상수 속성 (키 순서) 다음에 플래그 (플래그 순서).
     *
     * @return 메타필드 목록
     */
    public List<Metafield> metafields() {
        List<Metafield> result = new ArrayList<>();
        constantAttributes.forEach((key, value) -> result.add(new Metafield(
            Metafield.PRODUCT_NAMESPACE, key.metafieldKey(), key.metafieldType().code(), value)));
        flags.forEach((flag, value) -> result.add(new Metafield(
            Metafield.PRODUCT_NAMESPACE, flag.metafieldKey(),
            AttributeKey.MetafieldType.BOOLEAN.code(), String.valueOf(value))));
        return result;
    }

    /**
     * 상품 + 모든 변형의 메타필드 수.
     */
    public int metafieldCount() {
        int count = metafields().size();
        for (CatalogVariant variant : variants) {
            count += variant.metafields().size();
        }
        return count;
    }
}
