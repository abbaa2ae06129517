package com.ryuqq.catalogsync.core.error;

/**
 * 그룹 단위 실패 분류.
 *
 * <p>실행 요약(run summary)에 실패한 그룹마다 하나씩 기록됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 필수 필드 누락, 잘못된 값 등 구조 검증 실패. 재시도하지 않음.
     */
    VALIDATION,

    /**
     * 같은 그룹 안에서 두 SKU의 옵션 값 조합이 동일함. 재시도하지 않음.
     */
    DUPLICATE_VARIANT,

    /**
     * 그룹 ID에 해당하는 행이 없음.
     */
    NOT_FOUND,

    /**
     * Rate Limit, 타임아웃, 5xx 등 일시적 원격 오류가 재시도 한도를 넘김.
     */
    TRANSIENT_REMOTE,

    /**
     * 플랫폼이 필드 단위 오류로 요청을 거부함.
     */
    REMOTE_REJECTION,

    /**
     * Bulk 작업이 제한 시간 안에 끝나지 않음.
     */
    BULK_TIMEOUT,

    /**
     * 실행이 취소되어 디스패치되지 않음.
     */
    CANCELLED,

    /**
     * 협력 객체에서 예상하지 못한 예외가 발생함.
     */
    UNEXPECTED;

    /**
     * 재시도 대상이 아닌 검증 계열 오류인지 확인.
     *
     * @return VALIDATION 또는 DUPLICATE_VARIANT인 경우 true
     */
    public boolean isValidation() {
        return this == VALIDATION || this == DUPLICATE_VARIANT;
    }
}
