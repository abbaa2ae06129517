/**
 * Runner Adapter Layer - CatalogSync 구현체.
 *
 * <p>이 패키지는 CatalogSync 인터페이스의 구체적인 구현체와 원격 호출 보호 장치를 포함합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalogsync.adapter.runner.CatalogSyncRunner} - 워커 풀 기반 동기화 러너 (개별/벌크 모드)</li>
 *   <li>{@link com.ryuqq.catalogsync.adapter.runner.TokenBucketRateLimiter} - 워커 전체가 공유하는 호출 속도 제한</li>
 *   <li>{@link com.ryuqq.catalogsync.adapter.runner.RetryExecutor} - Retry-After 힌트와 백오프를 따르는 재시도</li>
 *   <li>{@link com.ryuqq.catalogsync.adapter.runner.SyncSettingsLoader} - YAML 설정 + 환경 변수 치환</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CatalogSyncRunner)
 *   ↓ implements
 * application (CatalogSync interface, GroupPipeline)
 *   ↓ depends on
 * core (Outcome, SyncState, CatalogEntity, SPI)
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
package com.ryuqq.catalogsync.adapter.runner;
