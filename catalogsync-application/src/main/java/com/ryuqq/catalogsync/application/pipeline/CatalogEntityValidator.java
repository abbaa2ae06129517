package com.ryuqq.catalogsync.application.pipeline;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.catalog.CatalogVariant;
import com.ryuqq.catalogsync.core.catalog.Metafield;
import com.ryuqq.catalogsync.core.error.CatalogValidationException;
import com.ryuqq.catalogsync.core.error.ErrorKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 디스패치 전 구조 검증.
 *
 * <p>모든 위반을 모아 한 번에 보고합니다. 옵션 튜플 중복은 DUPLICATE_VARIANT,
 * 나머지는 VALIDATION으로 분류됩니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>제목: 비어 있지 않고 최대 길이 이하</li>
 *   <li>핸들: 최대 길이 이하</li>
 *   <li>변형: 1개 이상, 옵션 수와 옵션 값 수 일치, 옵션 튜플 유일</li>
 *   <li>SKU: 비어 있지 않고 255자 이하</li>
 *   <li>가격: 0 이상</li>
 *   <li>메타필드: namespace, key, type, value 모두 존재</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class CatalogEntityValidator {

    static final int MAX_SKU_LENGTH = 255;

    private final CatalogSettings settings;

    public CatalogEntityValidator(CatalogSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    /**
     * 엔티티 검증.
     *
     * @param entity 검증 대상
     * @throws CatalogValidationException 위반이 하나라도 있는 경우
     */
    public void validate(CatalogEntity entity) {
        List<String> errors = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();

        if (entity.title() == null || entity.title().isBlank()) {
            errors.add("Product title is required");
        } else if (entity.title().length() > settings.maxTitleLength()) {
            errors.add("Product title exceeds " + settings.maxTitleLength() + " characters");
        }
        if (entity.handle().length() > settings.maxHandleLength()) {
            errors.add("Handle exceeds " + settings.maxHandleLength() + " characters");
        }
        if (entity.options().size() > settings.maxOptions()) {
            errors.add("Product has " + entity.options().size() + " options, maximum is " + settings.maxOptions());
        }
        if (entity.variants().isEmpty()) {
            errors.add("At least one variant is required");
        }

        Map<List<String>, String> tuples = new HashMap<>();
        for (int i = 0; i < entity.variants().size(); i++) {
            CatalogVariant variant = entity.variants().get(i);
            String prefix = "Variant " + (i + 1);
            checkVariant(variant, prefix, entity.options().size(), errors);
            String previous = tuples.putIfAbsent(variant.optionValues(), variant.sku());
            if (previous != null) {
                duplicates.add("SKUs " + previous + " and " + variant.sku()
                    + " share option values " + variant.optionValues());
            }
            checkMetafields(variant.metafields(), prefix + " metafield", errors);
        }
        checkMetafields(entity.metafields(), "Metafield", errors);

        if (!duplicates.isEmpty()) {
            throw new CatalogValidationException(ErrorKind.DUPLICATE_VARIANT, duplicates);
        }
        if (!errors.isEmpty()) {
            throw new CatalogValidationException(ErrorKind.VALIDATION, errors);
        }
    }

    private static void checkVariant(CatalogVariant variant, String prefix, int optionCount, List<String> errors) {
        if (variant.sku().isBlank()) {
            errors.add(prefix + ": SKU is required");
        } else if (variant.sku().length() > MAX_SKU_LENGTH) {
            errors.add(prefix + ": SKU exceeds " + MAX_SKU_LENGTH + " characters");
        }
        if (variant.optionValues().size() != optionCount) {
            errors.add(prefix + ": expected " + optionCount + " option values, found " + variant.optionValues().size());
        }
        if (isNegative(variant.price())) {
            errors.add(prefix + ": price cannot be negative");
        }
        if (isNegative(variant.compareAtPrice())) {
            errors.add(prefix + ": compare-at price cannot be negative");
        }
    }

    private static void checkMetafields(List<Metafield> metafields, String prefix, List<String> errors) {
        for (int i = 0; i < metafields.size(); i++) {
            Metafield metafield = metafields.get(i);
            if (!metafield.isComplete()) {
                errors.add(prefix + " " + (i + 1) + ": namespace, key, type and value are required");
            }
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}
