package com.ryuqq.catalogsync.adapter.runner;

import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.protection.RateLimiterConfig;

/**
 * 설정 파일 하나에서 읽은 전체 설정.
 *
 * @param catalog 엔티티 생성 설정
 * @param runner 러너 설정
 * @param rateLimiter Rate Limiter 설정
 * @param retryBaseDelayMs 재시도 기본 지연 (밀리초)
 * @param retryMaxDelayMs 재시도 최대 지연 (밀리초)
 * @param retryJitterFactor 재시도 Jitter 비율
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record SyncSettings(
    CatalogSettings catalog,
    SyncRunnerConfig runner,
    RateLimiterConfig rateLimiter,
    long retryBaseDelayMs,
    long retryMaxDelayMs,
    double retryJitterFactor
) {

    public SyncSettings() {
        this(new CatalogSettings(), new SyncRunnerConfig(), new RateLimiterConfig(), 1000, 300000, 0.1);
    }

    public SyncSettings {
        if (catalog == null || runner == null || rateLimiter == null) {
            throw new IllegalArgumentException("catalog, runner and rateLimiter cannot be null");
        }
    }

    /**
     * 재시도 설정으로 만든 백오프 계산기. 값 검증은 계산기 생성자가 담당합니다.
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }
}
