package com.ryuqq.catalogsync.core.error;

import java.util.List;

/**
 * 카탈로그 엔티티 구성 또는 검증 실패.
 *
 * <p>그룹 하나에만 영향을 주며, 원격 플랫폼에 요청을 보내기 전에 발생합니다.
 * 같은 실행의 다른 그룹 처리는 계속됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class CatalogValidationException extends RuntimeException {

    private final ErrorKind errorKind;
    private final List<String> details;

    /**
     * 생성자.
     *
     * @param errorKind VALIDATION 또는 DUPLICATE_VARIANT
     * @param details 개별 오류 메시지 (1개 이상)
     * @throws IllegalArgumentException errorKind가 검증 계열이 아니거나 details가 비어 있는 경우
     */
    public CatalogValidationException(ErrorKind errorKind, List<String> details) {
        super(errorKind + ": " + String.join("; ", requireDetails(details)));
        if (errorKind == null || !errorKind.isValidation()) {
            throw new IllegalArgumentException("errorKind must be a validation kind (current: " + errorKind + ")");
        }
        this.errorKind = errorKind;
        this.details = List.copyOf(details);
    }

    /**
     * 단일 메시지로 생성.
     *
     * @param errorKind 오류 분류
     * @param detail 오류 메시지
     */
    public CatalogValidationException(ErrorKind errorKind, String detail) {
        this(errorKind, List.of(detail));
    }

    private static List<String> requireDetails(List<String> details) {
        if (details == null || details.isEmpty()) {
            throw new IllegalArgumentException("details cannot be null or empty");
        }
        return details;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public List<String> getDetails() {
        return details;
    }
}
