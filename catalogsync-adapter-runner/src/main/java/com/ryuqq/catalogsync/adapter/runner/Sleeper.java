package com.ryuqq.catalogsync.adapter.runner;

/**
 * 대기 추상화. 테스트에서 실제 시간 대신 가짜 시계를 쓰기 위해 분리합니다.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
