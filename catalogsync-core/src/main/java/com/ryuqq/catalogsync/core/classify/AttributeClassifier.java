package com.ryuqq.catalogsync.core.classify;

import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import com.ryuqq.catalogsync.core.normalize.CanonicalValue;
import com.ryuqq.catalogsync.core.normalize.FieldNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 그룹의 속성을 상수/변형으로 분류.
 *
 * <p>대상 키마다 모든 행의 정규 값을 모아 서로 다른 값의 수로 판정합니다:</p>
 * <ul>
 *   <li>0개: 결과에서 제외</li>
 *   <li>1개: {@link AttributeKind#CONSTANT}</li>
 *   <li>2개 이상: {@link AttributeKind#VARIANT}</li>
 * </ul>
 *
 * <p>값은 정렬 집합에, 결과는 enum 순서 맵에 담기므로 행 순서와 무관하고 멱등입니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class AttributeClassifier {

    private final FieldNormalizer normalizer;

    public AttributeClassifier(FieldNormalizer normalizer) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        this.normalizer = normalizer;
    }

    /**
     * 그룹 분류.
     *
     * @param group 대상 그룹
     * @param rules 그룹 카테고리의 규칙
     * @return 키 → 분류 결과 (enum 순서, 불변)
     * @throws IllegalArgumentException 규칙의 카테고리가 그룹과 다른 경우
     */
    public SortedMap<AttributeKey, ClassifiedAttribute> classify(Group group, CategoryRules rules) {
        if (group == null || rules == null) {
            throw new IllegalArgumentException("group and rules cannot be null");
        }
        if (rules.category() != group.getCategory()) {
            throw new IllegalArgumentException(
                "Rules for " + rules.category() + " cannot classify " + group.getCategory() + " group");
        }

        SortedMap<AttributeKey, ClassifiedAttribute> result = new TreeMap<>();
        for (AttributeKey key : rules.eligibleKeys()) {
            SortedSet<CanonicalValue> values = new TreeSet<>();
            for (RawComponentRow row : group.getRows()) {
                normalizer.normalize(key, row).ifPresent(values::add);
            }
            if (values.isEmpty()) {
                continue;
            }
            AttributeKind kind = values.size() == 1 ? AttributeKind.CONSTANT : AttributeKind.VARIANT;
            result.put(key, new ClassifiedAttribute(key, kind, new ArrayList<>(values)));
        }
        return Collections.unmodifiableSortedMap(result);
    }
}
