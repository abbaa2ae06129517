package com.ryuqq.catalogsync.application.sync;

import com.ryuqq.catalogsync.core.model.GroupId;

import java.util.List;

/**
 * 카탈로그 동기화 실행 조정자.
 *
 * <p>그룹마다 조회 → 분류 → 생성 → 검증 → 원격 상태 비교 → 디스패치를 수행하고,
 * 모든 그룹의 결과를 {@link RunSummary}로 돌려줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunSummary summary = catalogSync.sync(List.of(GroupId.of("GRP-100"), GroupId.of("GRP-101")));
 * log.info(summary.describe());
 *
 * for (GroupResult failed : summary.failures()) {
 *     // 그룹별 실패 사유
 * }
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>한 그룹의 실패가 다른 그룹을 중단시키지 않음</li>
 *   <li>요청한 모든 그룹이 결과에 포함됨 (중복 ID는 한 번만)</li>
 *   <li>원격 상태가 이미 최신이면 변경 요청을 보내지 않음</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public interface CatalogSync {

    /**
     * 지정한 그룹 동기화.
     *
     * @param groupIds 그룹 ID (중복 허용, 한 번만 처리)
     * @return 실행 요약
     * @throws IllegalArgumentException groupIds가 null인 경우
     */
    RunSummary sync(List<GroupId> groupIds);

    /**
     * 조회 계층이 아는 모든 그룹 동기화.
     *
     * @return 실행 요약
     */
    RunSummary syncAll();

    /**
     * 진행 중인 실행 취소.
     *
     * <p>새 디스패치를 즉시 멈춥니다. 이미 보낸 호출은 완료되며,
     * 디스패치되지 않은 그룹은 FAILED/CANCELLED로 보고됩니다.</p>
     */
    void cancel();
}
