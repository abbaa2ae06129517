package com.ryuqq.catalogsync.application.sync;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.testkit.fixture.RowFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunSummary / GroupResult 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class RunSummaryTest {

    private final CatalogEntity entity = RowFixtures.entity(RowFixtures.ringGroup("GRP-R100", "5", "6"));

    @Test
    void counts_AreTalliedPerOutcome() {
        // given
        RunSummary summary = new RunSummary(List.of(
            GroupResult.succeeded(GroupOutcome.CREATED, "gid://catalog/Product/1", entity),
            GroupResult.succeeded(GroupOutcome.NO_OP, "gid://catalog/Product/1", entity),
            GroupResult.partialFailure("gid://catalog/Product/2", List.of("metafields.shape: bad value"), entity),
            GroupResult.failed(GroupId.of("GRP-X"), ErrorKind.NOT_FOUND, "No rows found for group: GRP-X")
        ), 1200);

        // then
        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.successful()).isEqualTo(2);
        assertThat(summary.count(GroupOutcome.UPDATED)).isZero();
        assertThat(summary.count(GroupOutcome.PARTIAL_FAILURE)).isEqualTo(1);
        assertThat(summary.failures()).extracting(GroupResult::outcome)
            .containsExactly(GroupOutcome.PARTIAL_FAILURE, GroupOutcome.FAILED);
    }

    @Test
    void describe_ListsCountsAndFailures() {
        // given
        RunSummary summary = new RunSummary(List.of(
            GroupResult.succeeded(GroupOutcome.UPDATED, "gid://catalog/Product/1", entity),
            GroupResult.failed(GroupId.of("GRP-X"), ErrorKind.NOT_FOUND, "No rows found for group: GRP-X")
        ), 42);

        // when
        String description = summary.describe();

        // then
        assertThat(description).startsWith(
            "Sync finished in 42 ms: total=2, successful=1 (created=0, updated=1, no-op=0), partial=0, failed=1");
        assertThat(description).contains("FAILED GRP-X [NOT_FOUND] No rows found for group: GRP-X");
    }

    @Test
    void succeeded_CarriesEntityCounts() {
        GroupResult result = GroupResult.succeeded(GroupOutcome.CREATED, "gid://catalog/Product/1", entity);

        assertThat(result.variantCount()).isEqualTo(2);
        assertThat(result.metafieldCount()).isEqualTo(entity.metafieldCount());
        assertThat(result.errorKind()).isNull();
    }

    @Test
    void partialFailure_KeepsPlatformId() {
        GroupResult result = GroupResult.partialFailure("gid://catalog/Product/2", List.of("a", "b"), entity);

        assertThat(result.platformId()).isEqualTo("gid://catalog/Product/2");
        assertThat(result.errorKind()).isEqualTo(ErrorKind.REMOTE_REJECTION);
        assertThat(result.errorMessage()).isEqualTo("a; b");
    }

    @Test
    void succeeded_WithFailureOutcome_ThrowsException() {
        assertThatThrownBy(() -> GroupResult.succeeded(GroupOutcome.FAILED, null, entity))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failed_WithoutKind_ThrowsException() {
        assertThatThrownBy(() -> new GroupResult(GroupId.of("GRP-X"), GroupOutcome.FAILED, null, null, null, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
