package com.ryuqq.catalogsync.application.sync;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.model.GroupId;

import java.util.List;

/**
 * 그룹 하나의 동기화 결과.
 *
 * @param groupId 그룹 ID
 * @param outcome 최종 결과
 * @param platformId 플랫폼 엔티티 ID (없으면 null)
 * @param errorKind 실패 분류 (성공이면 null)
 * @param errorDetails 실패 상세 (성공이면 빈 목록)
 * @param variantCount 엔티티 변형 수 (엔티티 생성 전 실패면 0)
 * @param metafieldCount 엔티티 메타필드 수 (엔티티 생성 전 실패면 0)
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record GroupResult(
    GroupId groupId,
    GroupOutcome outcome,
    String platformId,
    ErrorKind errorKind,
    List<String> errorDetails,
    int variantCount,
    int metafieldCount
) {

    public GroupResult {
        if (groupId == null || outcome == null) {
            throw new IllegalArgumentException("groupId and outcome cannot be null");
        }
        if (outcome == GroupOutcome.FAILED && errorKind == null) {
            throw new IllegalArgumentException("FAILED result requires an errorKind");
        }
        errorDetails = errorDetails == null ? List.of() : List.copyOf(errorDetails);
    }

    public static GroupResult succeeded(GroupOutcome outcome, String platformId, CatalogEntity entity) {
        if (!outcome.isSuccess()) {
            throw new IllegalArgumentException("Not a success outcome: " + outcome);
        }
        return new GroupResult(entity.groupId(), outcome, platformId, null, List.of(),
            entity.variants().size(), entity.metafieldCount());
    }

    public static GroupResult partialFailure(String platformId, List<String> details, CatalogEntity entity) {
        return new GroupResult(entity.groupId(), GroupOutcome.PARTIAL_FAILURE, platformId,
            ErrorKind.REMOTE_REJECTION, details, entity.variants().size(), entity.metafieldCount());
    }

    /**
     * 실패 결과.
     *
     * @param entity 생성된 엔티티 (생성 전 실패면 null)
     */
    public static GroupResult failed(GroupId groupId, ErrorKind errorKind, List<String> details, CatalogEntity entity) {
        int variants = entity == null ? 0 : entity.variants().size();
        int metafields = entity == null ? 0 : entity.metafieldCount();
        return new GroupResult(groupId, GroupOutcome.FAILED, null, errorKind, details, variants, metafields);
    }

    public static GroupResult failed(GroupId groupId, ErrorKind errorKind, String detail) {
        return failed(groupId, errorKind, List.of(detail), null);
    }

    public String errorMessage() {
        return String.join("; ", errorDetails);
    }
}
