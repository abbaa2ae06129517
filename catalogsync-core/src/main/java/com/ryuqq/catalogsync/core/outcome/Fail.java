package com.ryuqq.catalogsync.core.outcome;

import com.ryuqq.catalogsync.core.error.ErrorKind;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>잘못된 필드 값이나 플랫폼이 거부한 요청처럼 재시도해도 성공할 수 없는 경우를 나타냅니다.</p>
 *
 * @param errorKind 오류 분류
 * @param message 오류 메시지
 * @param <T> 성공 시 값 타입
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record Fail<T>(
    ErrorKind errorKind,
    String message
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind가 null이거나 message가 null/빈 문자열인 경우
     */
    public Fail {
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param errorKind 오류 분류
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(ErrorKind errorKind, String message) {
        return new Fail<>(errorKind, message);
    }
}
