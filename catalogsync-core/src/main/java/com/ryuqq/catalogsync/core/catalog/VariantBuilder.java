package com.ryuqq.catalogsync.core.catalog;

import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.classify.CategoryRules;
import com.ryuqq.catalogsync.core.classify.ClassifiedAttribute;
import com.ryuqq.catalogsync.core.error.CatalogValidationException;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.model.ProductFlag;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import com.ryuqq.catalogsync.core.normalize.CanonicalValue;
import com.ryuqq.catalogsync.core.normalize.FieldNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 분류 결과로 {@link CatalogEntity} 생성.
 *
 * <p><strong>생성 규칙:</strong></p>
 * <ul>
 *   <li>옵션: 카테고리 우선순위 중 VARIANT인 키. 플랫폼 허용 수를 넘으면 VALIDATION</li>
 *   <li>변형: 행마다 하나, (옵션 값 튜플, SKU) 순으로 정렬</li>
 *   <li>같은 옵션 튜플을 가진 변형이 둘 이상이면 DUPLICATE_VARIANT</li>
 *   <li>VARIANT인 상세 키는 변형 메타필드로</li>
 *   <li>플래그: 값이 있는 행 중 하나라도 true면 true</li>
 * </ul>
 *
 * <p>결과는 행 순서와 무관합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class VariantBuilder {

    private final FieldNormalizer normalizer;
    private final TitleComposer titleComposer;
    private final HandleGenerator handleGenerator;
    private final CatalogSettings settings;

    public VariantBuilder(FieldNormalizer normalizer, CatalogSettings settings) {
        if (normalizer == null || settings == null) {
            throw new IllegalArgumentException("normalizer and settings cannot be null");
        }
        this.normalizer = normalizer;
        this.settings = settings;
        this.titleComposer = new TitleComposer();
        this.handleGenerator = new HandleGenerator(settings.maxHandleLength());
    }

    /**
     * 엔티티 생성.
     *
     * @param group 대상 그룹
     * @param classified 그룹 분류 결과
     * @param rules 그룹 카테고리 규칙
     * @param media 검증된 미디어 (순서 유지)
     * @return 카탈로그 엔티티
     * @throws CatalogValidationException 옵션 수 초과, 옵션 값 누락, 중복 변형
     */
    public CatalogEntity build(Group group,
                               Map<AttributeKey, ClassifiedAttribute> classified,
                               CategoryRules rules,
                               List<MediaRef> media) {
        if (group == null || classified == null || rules == null) {
            throw new IllegalArgumentException("group, classified and rules cannot be null");
        }

        List<AttributeKey> optionKeys = new ArrayList<>();
        for (AttributeKey key : rules.optionPriority()) {
            ClassifiedAttribute attribute = classified.get(key);
            if (attribute != null && attribute.isVariant()) {
                optionKeys.add(key);
            }
        }
        if (optionKeys.size() > settings.maxOptions()) {
            throw new CatalogValidationException(ErrorKind.VALIDATION,
                "Group " + group.getGroupId().getValue() + " varies on " + optionKeys.size()
                    + " option dimensions " + optionKeys + ", platform allows " + settings.maxOptions());
        }

        List<VariantOption> options = new ArrayList<>();
        for (AttributeKey key : optionKeys) {
            List<String> values = classified.get(key).values().stream().map(CanonicalValue::display).toList();
            options.add(new VariantOption(key, key.displayName(), values));
        }

        List<AttributeKey> variantDetailKeys = new ArrayList<>();
        Map<AttributeKey, String> constants = new EnumMap<>(AttributeKey.class);
        for (ClassifiedAttribute attribute : classified.values()) {
            if (attribute.isConstant()) {
                constants.put(attribute.key(), attribute.constantValue().display());
            } else if (!rules.isOptionKey(attribute.key())) {
                variantDetailKeys.add(attribute.key());
            }
        }

        List<CatalogVariant> variants = buildVariants(group, optionKeys, variantDetailKeys);
        String title = titleComposer.title(group.getCategory(), classified);

        return new CatalogEntity(
            group.getGroupId(),
            title,
            handleGenerator.generate(title, group.getGroupId()),
            group.getCategory().displayName(),
            titleComposer.description(classified),
            settings.vendor(),
            settings.status(),
            constants,
            flags(group),
            options,
            variants,
            media
        );
    }

    private List<CatalogVariant> buildVariants(Group group,
                                               List<AttributeKey> optionKeys,
                                               List<AttributeKey> variantDetailKeys) {
        List<String> missing = new ArrayList<>();
        List<KeyedVariant> keyed = new ArrayList<>();
        for (RawComponentRow row : group.getRows()) {
            List<CanonicalValue> tuple = new ArrayList<>();
            for (AttributeKey key : optionKeys) {
                Optional<CanonicalValue> value = normalizer.normalize(key, row);
                if (value.isEmpty()) {
                    missing.add("SKU " + row.getSku() + " has no value for option " + key.displayName());
                } else {
                    tuple.add(value.get());
                }
            }
            keyed.add(new KeyedVariant(tuple, toVariant(row, tuple, variantDetailKeys)));
        }
        if (!missing.isEmpty()) {
            throw new CatalogValidationException(ErrorKind.VALIDATION, missing);
        }

        keyed.sort(KeyedVariant.ORDER);

        List<String> duplicates = new ArrayList<>();
        for (int i = 1; i < keyed.size(); i++) {
            KeyedVariant previous = keyed.get(i - 1);
            KeyedVariant current = keyed.get(i);
            if (previous.tuple().equals(current.tuple())) {
                duplicates.add("SKUs " + previous.variant().sku() + " and " + current.variant().sku()
                    + " share option values " + current.variant().optionValues());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new CatalogValidationException(ErrorKind.DUPLICATE_VARIANT, duplicates);
        }

        return keyed.stream().map(KeyedVariant::variant).toList();
    }

    private CatalogVariant toVariant(RawComponentRow row, List<CanonicalValue> tuple, List<AttributeKey> detailKeys) {
        List<Metafield> metafields = new ArrayList<>();
        for (AttributeKey key : detailKeys) {
            normalizer.normalize(key, row).ifPresent(value -> metafields.add(new Metafield(
                Metafield.VARIANT_NAMESPACE, key.metafieldKey(), key.metafieldType().code(), value.display())));
        }
        return new CatalogVariant(
            row.getSku(),
            tuple.stream().map(CanonicalValue::display).toList(),
            row.getPrice(),
            row.getCompareAtPrice(),
            row.getInventoryQuantity(),
            row.getWeightGrams(),
            row.getBarcode(),
            metafields
        );
    }

    private static Map<ProductFlag, Boolean> flags(Group group) {
        Map<ProductFlag, Boolean> flags = new EnumMap<>(ProductFlag.class);
        for (ProductFlag flag : ProductFlag.values()) {
            for (RawComponentRow row : group.getRows()) {
                Boolean value = row.getFlag(flag);
                if (value != null) {
                    flags.merge(flag, value, Boolean::logicalOr);
                }
            }
        }
        return flags;
    }

    private record KeyedVariant(List<CanonicalValue> tuple, CatalogVariant variant) {

        static final Comparator<KeyedVariant> ORDER = KeyedVariant::compare;

        private static int compare(KeyedVariant a, KeyedVariant b) {
            for (int i = 0; i < a.tuple.size(); i++) {
                int result = a.tuple.get(i).compareTo(b.tuple.get(i));
                if (result != 0) {
                    return result;
                }
            }
            return a.variant.sku().compareTo(b.variant.sku());
        }
    }
}
