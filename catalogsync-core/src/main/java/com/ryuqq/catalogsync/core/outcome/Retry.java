package com.ryuqq.catalogsync.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>일시적인 오류로 인해 실패했으나, 재시도하면 성공할 가능성이 있는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃</li>
 *   <li>외부 서비스 일시 장애 (503 Service Unavailable)</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests, Retry-After 헤더 포함 가능)</li>
 * </ul>
 *
 * <p>{@code waitHintMillis}가 0 이상이면 플랫폼이 명시한 대기 시간이며,
 * 계산된 지수 백오프 대신 그대로 사용됩니다. {@link #NO_HINT}이면 백오프 계산기를 따릅니다.</p>
 *
 * @param reason 재시도 사유
 * @param waitHintMillis 플랫폼이 요청한 대기 시간 (밀리초) 또는 {@link #NO_HINT}
 * @param <T> 성공 시 값 타입
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record Retry<T>(
    String reason,
    long waitHintMillis
) implements Outcome<T> {

    /**
     * 대기 시간 힌트 없음.
     */
    public static final long NO_HINT = -1L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (waitHintMillis < NO_HINT) {
            throw new IllegalArgumentException("waitHintMillis must be non-negative or NO_HINT (current: " + waitHintMillis + ")");
        }
    }

    /**
     * 대기 시간 힌트 없이 생성.
     *
     * @param reason 재시도 사유
     * @param <T> 값 타입
     * @return Retry 인스턴스
     */
    public static <T> Retry<T> of(String reason) {
        return new Retry<>(reason, NO_HINT);
    }

    /**
     * 명시적 대기 시간과 함께 생성 (예: Retry-After 헤더).
     *
     * @param reason 재시도 사유
     * @param waitHintMillis 대기 시간 (밀리초, 0 이상)
     * @param <T> 값 타입
     * @return Retry 인스턴스
     */
    public static <T> Retry<T> after(String reason, long waitHintMillis) {
        if (waitHintMillis < 0) {
            throw new IllegalArgumentException("waitHintMillis must be non-negative (current: " + waitHintMillis + ")");
        }
        return new Retry<>(reason, waitHintMillis);
    }

    /**
     * 명시적 대기 시간 힌트 보유 여부.
     *
     * @return 힌트가 있으면 true
     */
    public boolean hasWaitHint() {
        return waitHintMillis >= 0;
    }
}
