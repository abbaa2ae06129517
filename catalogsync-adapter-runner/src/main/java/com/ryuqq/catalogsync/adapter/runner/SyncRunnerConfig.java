package com.ryuqq.catalogsync.adapter.runner;

/**
 * {@link CatalogSyncRunner} 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 처리하는 그룹 수 (기본 4)</li>
 *   <li>bulkThreshold: 이 수 이상의 그룹이면 벌크 작업으로 디스패치 (기본 10)</li>
 *   <li>maxAttempts: 원격 호출당 최대 시도 횟수 (기본 4 = 최초 1회 + 재시도 3회)</li>
 *   <li>bulkPollIntervalMs: 벌크 작업 폴링 간격 (기본 1000ms)</li>
 *   <li>bulkTimeoutMs: 벌크 작업 대기 상한 (기본 600000ms = 10분)</li>
 *   <li>shutdownTimeoutSeconds: 워커 풀 종료 대기 (기본 60초)</li>
 * </ul>
 *
 * @param concurrency 동시 처리 그룹 수 (1 이상)
 * @param bulkThreshold 벌크 전환 기준 그룹 수 (1 이상)
 * @param maxAttempts 원격 호출당 최대 시도 횟수 (1 이상)
 * @param bulkPollIntervalMs 폴링 간격 (밀리초, 양수)
 * @param bulkTimeoutMs 벌크 대기 상한 (밀리초, 폴링 간격 이상)
 * @param shutdownTimeoutSeconds 종료 대기 (초, 양수)
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record SyncRunnerConfig(
    int concurrency,
    int bulkThreshold,
    int maxAttempts,
    long bulkPollIntervalMs,
    long bulkTimeoutMs,
    long shutdownTimeoutSeconds
) {

    public SyncRunnerConfig() {
        this(4, 10, 4, 1000, 600000, 60);
    }

    public SyncRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (bulkThreshold <= 0) {
            throw new IllegalArgumentException(
                "bulkThreshold must be positive (current: " + bulkThreshold + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (bulkPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "bulkPollIntervalMs must be positive (current: " + bulkPollIntervalMs + ")"
            );
        }
        if (bulkTimeoutMs < bulkPollIntervalMs) {
            throw new IllegalArgumentException(
                "bulkTimeoutMs must be >= bulkPollIntervalMs (interval: " + bulkPollIntervalMs + ", timeout: " + bulkTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutSeconds must be positive (current: " + shutdownTimeoutSeconds + ")"
            );
        }
    }

    public SyncRunnerConfig withConcurrency(int concurrency) {
        return new SyncRunnerConfig(concurrency, bulkThreshold, maxAttempts, bulkPollIntervalMs, bulkTimeoutMs, shutdownTimeoutSeconds);
    }

    public SyncRunnerConfig withBulkThreshold(int bulkThreshold) {
        return new SyncRunnerConfig(concurrency, bulkThreshold, maxAttempts, bulkPollIntervalMs, bulkTimeoutMs, shutdownTimeoutSeconds);
    }

    public SyncRunnerConfig withMaxAttempts(int maxAttempts) {
        return new SyncRunnerConfig(concurrency, bulkThreshold, maxAttempts, bulkPollIntervalMs, bulkTimeoutMs, shutdownTimeoutSeconds);
    }

    public SyncRunnerConfig withBulkPollIntervalMs(long bulkPollIntervalMs) {
        return new SyncRunnerConfig(concurrency, bulkThreshold, maxAttempts, bulkPollIntervalMs, bulkTimeoutMs, shutdownTimeoutSeconds);
    }

    public SyncRunnerConfig withBulkTimeoutMs(long bulkTimeoutMs) {
        return new SyncRunnerConfig(concurrency, bulkThreshold, maxAttempts, bulkPollIntervalMs, bulkTimeoutMs, shutdownTimeoutSeconds);
    }
}
