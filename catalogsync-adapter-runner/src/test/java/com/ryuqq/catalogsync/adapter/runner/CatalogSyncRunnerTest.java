package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.adapter.inmemory.InMemoryCatalogPlatform;
import com.ryuqq.catalogsync.adapter.inmemory.InMemoryGroupSource;
import com.ryuqq.catalogsync.adapter.inmemory.InMemoryMediaProvider;
import com.ryuqq.catalogsync.application.pipeline.CatalogEntityValidator;
import com.ryuqq.catalogsync.application.pipeline.GroupPipeline;
import com.ryuqq.catalogsync.application.sync.GroupOutcome;
import com.ryuqq.catalogsync.application.sync.GroupResult;
import com.ryuqq.catalogsync.application.sync.RunSummary;
import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.catalog.VariantBuilder;
import com.ryuqq.catalogsync.core.classify.AttributeClassifier;
import com.ryuqq.catalogsync.core.classify.CategoryRuleBook;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.fingerprint.CanonicalForm;
import com.ryuqq.catalogsync.core.fingerprint.FingerprintCalculator;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.normalize.FieldNormalizer;
import com.ryuqq.catalogsync.core.outcome.Retry;
import com.ryuqq.catalogsync.core.protection.RateLimiterConfig;
import com.ryuqq.catalogsync.core.spi.FieldError;
import com.ryuqq.catalogsync.testkit.fixture.RowFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CatalogSyncRunner 통합 테스트.
 *
 * <p>In-memory 어댑터로 전체 흐름(조회 → 생성 → 검증 → 지문 비교 → 디스패치)을 검증합니다.
 * 대기는 가짜 시계를 진행시키므로 실제 시간이 걸리지 않습니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class CatalogSyncRunnerTest {

    private static final GroupId R100 = GroupId.of("GRP-R100");
    private static final GroupId R200 = GroupId.of("GRP-R200");
    private static final GroupId R300 = GroupId.of("GRP-R300");

    private final AtomicLong clock = new AtomicLong(0);
    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final Sleeper sleeper = millis -> {
        sleeps.add(millis);
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    };

    private InMemoryGroupSource groupSource;
    private InMemoryMediaProvider mediaProvider;
    private InMemoryCatalogPlatform platform;

    @BeforeEach
    void setUp() {
        groupSource = new InMemoryGroupSource();
        mediaProvider = new InMemoryMediaProvider();
        platform = new InMemoryCatalogPlatform();

        groupSource.addRows(RowFixtures.ringGroup("GRP-R100", "5", "6", "7").getRows());
        groupSource.addRows(RowFixtures.ringGroup("GRP-R200", "5", "6").getRows());
        groupSource.addRows(RowFixtures.ringGroup("GRP-R300", "8").getRows());
        mediaProvider.register("GRP-R100", MediaRef.of("https://cdn.example.com/r100.jpg"));
    }

    private CatalogSyncRunner runner(SyncRunnerConfig config) {
        FieldNormalizer normalizer = new FieldNormalizer();
        CatalogSettings settings = new CatalogSettings();
        GroupPipeline pipeline = new GroupPipeline(
            groupSource,
            mediaProvider,
            CategoryRuleBook.defaults(),
            new AttributeClassifier(normalizer),
            new VariantBuilder(normalizer, settings),
            new CatalogEntityValidator(settings),
            new FingerprintCalculator(new CanonicalForm())
        );
        return new CatalogSyncRunner(groupSource, pipeline, platform,
            new TokenBucketRateLimiter(new RateLimiterConfig(1000.0, 1000)),
            config, new BackoffCalculator(1000, 300000, 0.1, () -> 0.0), sleeper, clock::get);
    }

    private CatalogSyncRunner individualRunner() {
        return runner(new SyncRunnerConfig().withBulkThreshold(100));
    }

    private CatalogSyncRunner bulkRunner() {
        return runner(new SyncRunnerConfig().withBulkThreshold(2));
    }

    private static String handleOf(String groupId, String... sizes) {
        return RowFixtures.entity(RowFixtures.ringGroup(groupId, sizes)).handle();
    }

    private static GroupResult resultFor(RunSummary summary, GroupId groupId) {
        return summary.getResults().stream()
            .filter(result -> result.groupId().equals(groupId))
            .findFirst()
            .orElseThrow();
    }

    // ============================================================
    // 1. 개별 모드: 생성 / 변경 없음 / 갱신
    // ============================================================

    @Test
    void sync_첫_실행은_CREATED_두번째_실행은_NO_OP() {
        // given
        CatalogSyncRunner runner = individualRunner();

        // when
        RunSummary first = runner.sync(List.of(R100, R200));
        RunSummary second = runner.sync(List.of(R100, R200));

        // then
        assertThat(first.count(GroupOutcome.CREATED)).isEqualTo(2);
        assertThat(second.count(GroupOutcome.NO_OP)).isEqualTo(2);
        assertThat(platform.upsertCount()).isEqualTo(2);
        assertThat(resultFor(second, R100).platformId()).isEqualTo(resultFor(first, R100).platformId());
    }

    @Test
    void sync_결과_순서는_요청_순서() {
        RunSummary summary = individualRunner().sync(List.of(R300, R100, R200));

        assertThat(summary.getResults()).extracting(GroupResult::groupId).containsExactly(R300, R100, R200);
    }

    @Test
    void sync_저장된_지문은_엔티티_지문과_같음() {
        // when
        RunSummary summary = individualRunner().sync(List.of(R100));

        // then
        String handle = handleOf("GRP-R100", "5", "6", "7");
        assertThat(platform.getFingerprint(handle)).isNotNull();
        assertThat(platform.getPlatformId(handle)).isEqualTo(resultFor(summary, R100).platformId());
        assertThat(resultFor(summary, R100).variantCount()).isEqualTo(3);
    }

    @Test
    void sync_행이_바뀌면_같은_platformId로_UPDATED() {
        // given
        CatalogSyncRunner runner = individualRunner();
        RunSummary first = runner.sync(List.of(R100));
        groupSource.addRow(RowFixtures.ring("GRP-R100", "R100-5").ringSize("5")
            .price(new BigDecimal("799.00")).build());

        // when
        RunSummary second = runner.sync(List.of(R100));

        // then
        GroupResult updated = resultFor(second, R100);
        assertThat(updated.outcome()).isEqualTo(GroupOutcome.UPDATED);
        assertThat(updated.platformId()).isEqualTo(resultFor(first, R100).platformId());
        assertThat(platform.productCount()).isEqualTo(1);
    }

    @Test
    void sync_새_이미지가_추가되면_UPDATED() {
        // given
        CatalogSyncRunner runner = individualRunner();
        runner.sync(List.of(R200));
        mediaProvider.register("GRP-R200", MediaRef.of("https://cdn.example.com/r200.jpg"));

        // when
        RunSummary second = runner.sync(List.of(R200));

        // then
        assertThat(resultFor(second, R200).outcome()).isEqualTo(GroupOutcome.UPDATED);
    }

    @Test
    void sync_구두점만_다른_그룹_ID는_별도_상품으로_생성() {
        // given
        GroupId underscored = GroupId.of("GRP_R500");
        GroupId plain = GroupId.of("GRPR500");
        groupSource.addRows(RowFixtures.ringGroup("GRP_R500", "6").getRows());
        groupSource.addRows(RowFixtures.ringGroup("GRPR500", "6").getRows());

        // when
        RunSummary summary = individualRunner().sync(List.of(underscored, plain));

        // then
        assertThat(summary.count(GroupOutcome.CREATED)).isEqualTo(2);
        assertThat(platform.productCount()).isEqualTo(2);
        assertThat(resultFor(summary, underscored).platformId())
            .isNotEqualTo(resultFor(summary, plain).platformId());
    }

    // ============================================================
    // 2. 실패 격리
    // ============================================================

    @Test
    void sync_검증_실패_그룹은_플랫폼을_호출하지_않음() {
        // given
        GroupId duplicated = GroupId.of("GRP-R400");
        groupSource.addRow(RowFixtures.ring("GRP-R400", "R400-6A").ringSize("6").build());
        groupSource.addRow(RowFixtures.ring("GRP-R400", "R400-6B").ringSize("6").build());

        // when
        RunSummary summary = individualRunner().sync(List.of(duplicated, R200));

        // then
        GroupResult failed = resultFor(summary, duplicated);
        assertThat(failed.outcome()).isEqualTo(GroupOutcome.FAILED);
        assertThat(failed.errorKind()).isEqualTo(ErrorKind.DUPLICATE_VARIANT);
        assertThat(resultFor(summary, R200).outcome()).isEqualTo(GroupOutcome.CREATED);
        assertThat(platform.lookupCount()).isEqualTo(1);
        assertThat(platform.upsertCount()).isEqualTo(1);
    }

    @Test
    void sync_없는_그룹은_NOT_FOUND() {
        // given
        GroupId missing = GroupId.of("GRP-MISSING");

        // when
        RunSummary summary = individualRunner().sync(List.of(missing, R100));

        // then
        GroupResult failed = resultFor(summary, missing);
        assertThat(failed.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(failed.errorMessage()).isEqualTo("No rows found for group: GRP-MISSING");
        assertThat(summary.successful()).isEqualTo(1);
    }

    @Test
    void sync_필드_오류는_PARTIAL_FAILURE로_platformId_보존() {
        // given
        String handle = handleOf("GRP-R200", "5", "6");
        platform.rejectFields(handle, List.of(new FieldError("metafields.stone_shape", "INVALID", "bad value")));

        // when
        RunSummary summary = individualRunner().sync(List.of(R200));

        // then
        GroupResult partial = resultFor(summary, R200);
        assertThat(partial.outcome()).isEqualTo(GroupOutcome.PARTIAL_FAILURE);
        assertThat(partial.platformId()).isEqualTo(platform.getPlatformId(handle));
        assertThat(partial.errorKind()).isEqualTo(ErrorKind.REMOTE_REJECTION);
        assertThat(summary.failures()).containsExactly(partial);
    }

    @Test
    void sync_중복된_그룹_ID는_한_번만_처리() {
        RunSummary summary = individualRunner().sync(List.of(R100, R100, R200));

        assertThat(summary.total()).isEqualTo(2);
        assertThat(platform.upsertCount()).isEqualTo(2);
    }

    @Test
    void sync_빈_목록은_빈_요약() {
        RunSummary summary = individualRunner().sync(List.of());

        assertThat(summary.total()).isZero();
        assertThat(platform.lookupCount()).isZero();
    }

    // ============================================================
    // 3. 재시도
    // ============================================================

    @Test
    void sync_Retry_After_힌트만큼_대기_후_성공() {
        // given
        platform.enqueueUpsertResponse(Retry.after("429 Too Many Requests", 2000));

        // when
        RunSummary summary = individualRunner().sync(List.of(R300));

        // then
        assertThat(resultFor(summary, R300).outcome()).isEqualTo(GroupOutcome.CREATED);
        assertThat(platform.upsertCount()).isEqualTo(2);
        assertThat(sleeps).containsExactly(2000L);
    }

    @Test
    void sync_조회_재시도_소진_시_TRANSIENT_REMOTE() {
        // given
        for (int i = 0; i < 4; i++) {
            platform.enqueueLookupResponse(Retry.of("503 Service Unavailable"));
        }

        // when
        RunSummary summary = individualRunner().sync(List.of(R300));

        // then
        GroupResult failed = resultFor(summary, R300);
        assertThat(failed.errorKind()).isEqualTo(ErrorKind.TRANSIENT_REMOTE);
        assertThat(platform.lookupCount()).isEqualTo(4);
        assertThat(platform.upsertCount()).isZero();
        assertThat(sleeps).containsExactly(1000L, 2000L, 4000L);
    }

    // ============================================================
    // 4. 벌크 모드
    // ============================================================

    @Test
    void sync_그룹_수가_임계값_이상이면_벌크_작업_하나로_전송() {
        // given
        platform.setBulkPollsBeforeCompletion(2);
        CatalogSyncRunner runner = bulkRunner();

        // when
        RunSummary first = runner.sync(List.of(R100, R200, R300));
        RunSummary second = runner.sync(List.of(R100, R200, R300));

        // then
        assertThat(first.count(GroupOutcome.CREATED)).isEqualTo(3);
        assertThat(platform.bulkSubmitCount()).isEqualTo(1);
        assertThat(platform.bulkPollCount()).isEqualTo(3);
        assertThat(platform.upsertCount()).isZero();
        assertThat(sleeps).containsExactly(1000L, 1000L);
        assertThat(second.count(GroupOutcome.NO_OP)).isEqualTo(3);
    }

    @Test
    void sync_벌크는_변경된_그룹만_전송() {
        // given
        CatalogSyncRunner runner = bulkRunner();
        runner.sync(List.of(R100, R200, R300));
        groupSource.addRow(RowFixtures.ringRow("GRP-R300", "9"));

        // when
        RunSummary second = runner.sync(List.of(R100, R200, R300));

        // then
        assertThat(second.count(GroupOutcome.NO_OP)).isEqualTo(2);
        assertThat(resultFor(second, R300).outcome()).isEqualTo(GroupOutcome.UPDATED);
        assertThat(platform.bulkSubmitCount()).isEqualTo(2);
    }

    @Test
    void sync_벌크_작업이_제한_시간을_넘으면_BULK_TIMEOUT() {
        // given
        platform.setBulkPollsBeforeCompletion(100);
        CatalogSyncRunner runner = runner(new SyncRunnerConfig()
            .withBulkThreshold(2)
            .withBulkPollIntervalMs(1000)
            .withBulkTimeoutMs(3000));

        // when
        RunSummary summary = runner.sync(List.of(R100, R200));

        // then
        assertThat(summary.getResults())
            .extracting(GroupResult::errorKind)
            .containsOnly(ErrorKind.BULK_TIMEOUT);
        assertThat(platform.bulkPollCount()).isEqualTo(4);
        assertThat(platform.productCount()).isZero();
    }

    @Test
    void sync_벌크_작업_실패는_모든_그룹에_REMOTE_REJECTION() {
        // given
        platform.setBulkFailureMessage("INTERNAL_SERVER_ERROR");

        // when
        RunSummary summary = bulkRunner().sync(List.of(R100, R200));

        // then
        assertThat(summary.getResults()).allSatisfy(result -> {
            assertThat(result.outcome()).isEqualTo(GroupOutcome.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.REMOTE_REJECTION);
            assertThat(result.errorMessage()).contains("INTERNAL_SERVER_ERROR");
        });
    }

    @Test
    void sync_벌크_모드에서도_검증_실패는_그룹별로_격리() {
        // given
        GroupId missing = GroupId.of("GRP-MISSING");

        // when
        RunSummary summary = bulkRunner().sync(List.of(missing, R100, R200));

        // then
        assertThat(resultFor(summary, missing).errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(summary.count(GroupOutcome.CREATED)).isEqualTo(2);
    }

    // ============================================================
    // 5. syncAll / 취소 / 동시 실행
    // ============================================================

    @Test
    void syncAll_소스의_모든_그룹을_처리() {
        RunSummary summary = individualRunner().syncAll();

        assertThat(summary.getResults()).extracting(GroupResult::groupId).containsExactly(R100, R200, R300);
        assertThat(summary.successful()).isEqualTo(3);
    }

    @Test
    void sync_동시_워커_여러개여도_결과는_요청_순서와_개수_유지() {
        // given
        List<GroupId> requested = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            String id = "GRP-C" + i;
            groupSource.addRows(RowFixtures.ringGroup(id, "5", "6").getRows());
            requested.add(GroupId.of(id));
        }
        Collections.reverse(requested);
        CatalogSyncRunner runner = runner(new SyncRunnerConfig().withConcurrency(4).withBulkThreshold(100));

        // when
        RunSummary summary = runner.sync(requested);

        // then
        assertThat(summary.total()).isEqualTo(8);
        assertThat(summary.getResults()).extracting(GroupResult::groupId).containsExactlyElementsOf(requested);
        assertThat(summary.count(GroupOutcome.CREATED)).isEqualTo(8);
        assertThat(platform.productCount()).isEqualTo(8);
        assertThat(platform.upsertCount()).isEqualTo(8);
    }

    @Test
    void cancel_이후_새_디스패치는_시작하지_않음() {
        // given
        AtomicReference<CatalogSyncRunner> holder = new AtomicReference<>();
        groupSource = new InMemoryGroupSource() {
            @Override
            public Group fetchGroup(GroupId groupId) {
                holder.get().cancel();
                return super.fetchGroup(groupId);
            }
        };
        groupSource.addRows(RowFixtures.ringGroup("GRP-R100", "5", "6").getRows());
        groupSource.addRows(RowFixtures.ringGroup("GRP-R200", "5", "6").getRows());
        holder.set(runner(new SyncRunnerConfig().withConcurrency(1).withBulkThreshold(100)));

        // when
        RunSummary summary = holder.get().sync(List.of(R100, R200));

        // then
        assertThat(summary.getResults()).extracting(GroupResult::errorKind)
            .containsOnly(ErrorKind.CANCELLED);
        assertThat(platform.upsertCount()).isZero();
    }

    @Test
    void sync_실행_중_다시_호출하면_예외() {
        // given
        AtomicReference<CatalogSyncRunner> holder = new AtomicReference<>();
        AtomicReference<Throwable> nested = new AtomicReference<>();
        groupSource = new InMemoryGroupSource() {
            @Override
            public Group fetchGroup(GroupId groupId) {
                try {
                    holder.get().sync(List.of(groupId));
                } catch (IllegalStateException e) {
                    nested.set(e);
                }
                return super.fetchGroup(groupId);
            }
        };
        groupSource.addRows(RowFixtures.ringGroup("GRP-R100", "5", "6").getRows());
        holder.set(individualRunner());

        // when
        RunSummary summary = holder.get().sync(List.of(R100));

        // then
        assertThat(nested.get()).isInstanceOf(IllegalStateException.class)
            .hasMessage("A sync run is already in progress");
        assertThat(summary.successful()).isEqualTo(1);
    }

    @Test
    void sync_null_목록은_예외() {
        assertThatThrownBy(() -> individualRunner().sync(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
