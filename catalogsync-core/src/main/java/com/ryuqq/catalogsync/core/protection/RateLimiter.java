package com.ryuqq.catalogsync.core.protection;

/**
 * Rate Limiter SPI.
 *
 * <p>카탈로그 플랫폼 API의 초당 호출 수를 제한합니다. 한 실행의 모든 워커가
 * 같은 인스턴스를 공유하며, 모든 원격 호출(상태 조회, upsert, 벌크 제출/폴링)은
 * 호출 전에 토큰을 하나 획득합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * limiter.acquire();                 // 토큰이 생길 때까지 대기
 * Outcome<UpsertResult> result = platform.upsert(request);
 * }</pre>
 *
 * <p>구현체는 thread-safe 해야 합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰을 획득할 때까지 대기 (블로킹).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void acquire() throws InterruptedException;
}
