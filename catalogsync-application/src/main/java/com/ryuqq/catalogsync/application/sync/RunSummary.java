package com.ryuqq.catalogsync.application.sync;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 실행 요약.
 *
 * <p>결과 목록은 요청 순서를 유지합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class RunSummary {

    private final List<GroupResult> results;
    private final Map<GroupOutcome, Integer> counts;
    private final long elapsedMillis;

    public RunSummary(List<GroupResult> results, long elapsedMillis) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        this.results = List.copyOf(results);
        this.elapsedMillis = elapsedMillis;
        Map<GroupOutcome, Integer> tally = new EnumMap<>(GroupOutcome.class);
        for (GroupOutcome outcome : GroupOutcome.values()) {
            tally.put(outcome, 0);
        }
        for (GroupResult result : this.results) {
            tally.merge(result.outcome(), 1, Integer::sum);
        }
        this.counts = tally;
    }

    public List<GroupResult> getResults() {
        return results;
    }

    public int total() {
        return results.size();
    }

    public int count(GroupOutcome outcome) {
        return counts.get(outcome);
    }

    public int successful() {
        return count(GroupOutcome.CREATED) + count(GroupOutcome.UPDATED) + count(GroupOutcome.NO_OP);
    }

    /**
     * PARTIAL_FAILURE와 FAILED 결과.
     */
    public List<GroupResult> failures() {
        return results.stream().filter(r -> !r.outcome().isSuccess()).toList();
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * 실행 종료 시 로그로 남기는 요약 문자열.
     *
     * <pre>
     * Sync finished in 1234 ms: total=5, successful=3 (created=1, updated=1, no-op=1), partial=1, failed=1
     *   PARTIAL_FAILURE GRP-2 [REMOTE_REJECTION] variants[1].price: must be positive
     *   FAILED GRP-3 [VALIDATION] Product title is required
     * </pre>
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Sync finished in ").append(elapsedMillis).append(" ms: ")
          .append("total=").append(total())
          .append(", successful=").append(successful())
          .append(" (created=").append(count(GroupOutcome.CREATED))
          .append(", updated=").append(count(GroupOutcome.UPDATED))
          .append(", no-op=").append(count(GroupOutcome.NO_OP))
          .append("), partial=").append(count(GroupOutcome.PARTIAL_FAILURE))
          .append(", failed=").append(count(GroupOutcome.FAILED));
        for (GroupResult failure : failures()) {
            sb.append(System.lineSeparator())
              .append("  ").append(failure.outcome())
              .append(' ').append(failure.groupId().getValue())
              .append(" [").append(failure.errorKind()).append("] ")
              .append(failure.errorMessage());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RunSummary{total=" + total() + ", successful=" + successful()
            + ", partial=" + count(GroupOutcome.PARTIAL_FAILURE) + ", failed=" + count(GroupOutcome.FAILED) + '}';
    }
}
