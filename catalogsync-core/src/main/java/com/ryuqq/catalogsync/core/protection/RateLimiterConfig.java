package com.ryuqq.catalogsync.core.protection;

/**
 * Rate Limiter 설정.
 *
 * @param permitsPerSecond 초당 허용 요청 수 (토큰 충전 속도)
 * @param maxBurstSize 버킷 크기 (한 번에 소비 가능한 최대 토큰 수)
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double permitsPerSecond, int maxBurstSize) {

    /**
     * 기본값: 초당 2회, 버스트 2.
     */
    public RateLimiterConfig() {
        this(2.0, 2);
    }

    /**
     * @throws IllegalArgumentException if permitsPerSecond is not positive
     * @throws IllegalArgumentException if maxBurstSize is not positive
     */
    public RateLimiterConfig {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive");
        }
        if (maxBurstSize <= 0) {
            throw new IllegalArgumentException("maxBurstSize must be positive");
        }
    }

    public RateLimiterConfig withPermitsPerSecond(double permitsPerSecond) {
        return new RateLimiterConfig(permitsPerSecond, maxBurstSize);
    }

    public RateLimiterConfig withMaxBurstSize(int maxBurstSize) {
        return new RateLimiterConfig(permitsPerSecond, maxBurstSize);
    }
}
