package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.application.sync.GroupOutcome;
import com.ryuqq.catalogsync.application.sync.GroupResult;
import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.fingerprint.SyncDecision;
import com.ryuqq.catalogsync.core.spi.FieldError;
import com.ryuqq.catalogsync.core.spi.UpsertResult;

import java.util.List;

/**
 * 플랫폼 upsert 결과를 그룹 결과로 해석.
 *
 * <ul>
 *   <li>platformId 있음, 필드 오류 없음: CREATED 또는 UPDATED</li>
 *   <li>platformId 있음, 필드 오류 있음: PARTIAL_FAILURE (platformId 보존)</li>
 *   <li>platformId 없음: FAILED / REMOTE_REJECTION</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
final class DispatchResults {

    private DispatchResults() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static GroupResult interpret(CatalogEntity entity, SyncDecision decision, UpsertResult upsert) {
        List<String> errors = upsert.fieldErrors().stream().map(FieldError::toString).toList();
        if (upsert.platformId() == null) {
            List<String> details = errors.isEmpty() ? List.of("Platform returned no entity id") : errors;
            return GroupResult.failed(entity.groupId(), ErrorKind.REMOTE_REJECTION, details, entity);
        }
        if (upsert.hasFieldErrors()) {
            return GroupResult.partialFailure(upsert.platformId(), errors, entity);
        }
        GroupOutcome outcome = decision == SyncDecision.CREATE ? GroupOutcome.CREATED : GroupOutcome.UPDATED;
        return GroupResult.succeeded(outcome, upsert.platformId(), entity);
    }
}
