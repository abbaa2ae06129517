package com.ryuqq.catalogsync.application.pipeline;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.VariantBuilder;
import com.ryuqq.catalogsync.core.classify.AttributeClassifier;
import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.classify.CategoryRuleBook;
import com.ryuqq.catalogsync.core.classify.CategoryRules;
import com.ryuqq.catalogsync.core.classify.ClassifiedAttribute;
import com.ryuqq.catalogsync.core.fingerprint.FingerprintCalculator;
import com.ryuqq.catalogsync.core.fingerprint.SyncFingerprint;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.spi.GroupSource;
import com.ryuqq.catalogsync.core.spi.MediaProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SortedMap;

/**
 * 그룹 하나를 원격 호출 없이 디스패치 직전까지 준비.
 *
 * <p><strong>단계:</strong></p>
 * <ol>
 *   <li>그룹 조회 ({@link GroupSource})</li>
 *   <li>미디어 조회 ({@link MediaProvider})</li>
 *   <li>속성 분류</li>
 *   <li>엔티티 생성</li>
 *   <li>구조 검증</li>
 *   <li>지문 계산</li>
 * </ol>
 *
 * <p>어느 단계에서 실패해도 플랫폼은 호출되지 않습니다.
 * 예외는 호출자(러너)가 그룹 단위로 처리합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class GroupPipeline {

    private static final Logger log = LoggerFactory.getLogger(GroupPipeline.class);

    private final GroupSource groupSource;
    private final MediaProvider mediaProvider;
    private final CategoryRuleBook ruleBook;
    private final AttributeClassifier classifier;
    private final VariantBuilder variantBuilder;
    private final CatalogEntityValidator validator;
    private final FingerprintCalculator fingerprintCalculator;

    public GroupPipeline(GroupSource groupSource,
                         MediaProvider mediaProvider,
                         CategoryRuleBook ruleBook,
                         AttributeClassifier classifier,
                         VariantBuilder variantBuilder,
                         CatalogEntityValidator validator,
                         FingerprintCalculator fingerprintCalculator) {
        if (groupSource == null || mediaProvider == null || ruleBook == null || classifier == null
            || variantBuilder == null || validator == null || fingerprintCalculator == null) {
            throw new IllegalArgumentException("GroupPipeline collaborators cannot be null");
        }
        this.groupSource = groupSource;
        this.mediaProvider = mediaProvider;
        this.ruleBook = ruleBook;
        this.classifier = classifier;
        this.variantBuilder = variantBuilder;
        this.validator = validator;
        this.fingerprintCalculator = fingerprintCalculator;
    }

    /**
     * 그룹 준비.
     *
     * @param groupId 그룹 ID
     * @return 검증을 통과한 그룹
     * @throws com.ryuqq.catalogsync.core.error.GroupNotFoundException 그룹이 없는 경우
     * @throws com.ryuqq.catalogsync.core.error.CatalogValidationException 생성/검증 실패
     */
    public PreparedGroup prepare(GroupId groupId) {
        Group group = groupSource.fetchGroup(groupId);
        List<MediaRef> media = mediaProvider.getValidatedMedia(group);
        CategoryRules rules = ruleBook.rulesFor(group.getCategory());

        SortedMap<AttributeKey, ClassifiedAttribute> classified = classifier.classify(group, rules);
        CatalogEntity entity = variantBuilder.build(group, classified, rules, media);
        validator.validate(entity);
        SyncFingerprint fingerprint = fingerprintCalculator.fingerprint(entity);

        log.debug("Prepared group {}: handle={}, options={}, variants={}, media={}",
            groupId.getValue(), entity.handle(), entity.options().size(), entity.variants().size(), media.size());
        return new PreparedGroup(group, entity, fingerprint);
    }
}
