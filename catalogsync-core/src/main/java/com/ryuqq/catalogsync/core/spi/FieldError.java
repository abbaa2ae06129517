package com.ryuqq.catalogsync.core.spi;

/**
 * 플랫폼이 거부한 필드 하나.
 *
 * @param field 필드 경로 (예: "variants[2].price")
 * @param code 플랫폼 오류 코드 (null 가능)
 * @param message 오류 메시지
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public record FieldError(String field, String code, String message) {

    public FieldError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return (field == null ? "" : field + ": ") + message + (code == null ? "" : " [" + code + "]");
    }
}
