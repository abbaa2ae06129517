package com.ryuqq.catalogsync.core.outcome;

/**
 * 원격 호출 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (값 포함)</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능 (Rate Limit, 타임아웃, 5xx)</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가 (잘못된 필드, 거부된 요청)</li>
 * </ul>
 *
 * <p>재시도 판단을 예외가 아닌 값으로 표현하여, 재시도 루프가
 * 명시적으로 분기할 수 있도록 합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;UpsertResult&gt; ok) {
 *     reconcile(ok.value());
 * } else if (outcome instanceof Retry&lt;UpsertResult&gt; retry) {
 *     backoff(retry.waitHintMillis());
 * } else if (outcome instanceof Fail&lt;UpsertResult&gt; fail) {
 *     report(fail.errorKind(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 시 값 타입
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Retry, Fail {
}
