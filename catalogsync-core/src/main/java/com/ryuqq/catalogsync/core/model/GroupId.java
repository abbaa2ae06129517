package com.ryuqq.catalogsync.core.model;

/**
 * 카탈로그 그룹 식별자.
 *
 * <p>같은 GroupId를 가진 SKU 행들이 하나의 카탈로그 상품(변형 포함)으로 묶입니다.
 * 핸들의 접미사로 사용되므로 카탈로그 상품의 원격 식별성을 보장합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가 (앞뒤 공백 제거)</li>
 *   <li>길이: 1~64자</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class GroupId implements Comparable<GroupId> {

    private static final int MAX_LENGTH = 64;

    private final String value;

    private GroupId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("GroupId cannot be null or blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("GroupId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = trimmed;
    }

    /**
     * GroupId 생성.
     *
     * @param value GroupId 값
     * @return GroupId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static GroupId of(String value) {
        return new GroupId(value);
    }

    /**
     * GroupId 값 조회.
     *
     * @return GroupId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(GroupId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupId groupId = (GroupId) o;
        return value.equals(groupId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "GroupId{" + value + '}';
    }
}
