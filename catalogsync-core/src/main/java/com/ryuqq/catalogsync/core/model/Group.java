package com.ryuqq.catalogsync.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 동기화 단위: 같은 {@link GroupId}를 가진 모든 SKU 행.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>행이 1개 이상</li>
 *   <li>모든 행의 groupId가 그룹 ID와 같음</li>
 *   <li>모든 행이 같은 카테고리</li>
 *   <li>SKU 중복 없음</li>
 * </ul>
 *
 * <p>한 번의 동기화 패스 동안만 존재하며, 해당 그룹을 처리하는 워커가 독점합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class Group {

    private final GroupId groupId;
    private final Category category;
    private final List<RawComponentRow> rows;

    private Group(GroupId groupId, List<RawComponentRow> rows) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Group " + groupId.getValue() + " must contain at least one row");
        }
        Category first = rows.get(0).getCategory();
        Set<String> skus = new HashSet<>();
        for (RawComponentRow row : rows) {
            if (!groupId.equals(row.getGroupId())) {
                throw new IllegalArgumentException(
                    "Row " + row.getSku() + " belongs to " + row.getGroupId().getValue() + ", not " + groupId.getValue());
            }
            if (row.getCategory() != first) {
                throw new IllegalArgumentException(
                    "Group " + groupId.getValue() + " mixes categories " + first + " and " + row.getCategory());
            }
            if (!skus.add(row.getSku())) {
                throw new IllegalArgumentException("Duplicate SKU " + row.getSku() + " in group " + groupId.getValue());
            }
        }
        this.groupId = groupId;
        this.category = first;
        this.rows = List.copyOf(rows);
    }

    /**
     * Group 생성.
     *
     * @param groupId 그룹 ID
     * @param rows 그룹에 속한 행 (1개 이상)
     * @return Group
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public static Group of(GroupId groupId, List<RawComponentRow> rows) {
        return new Group(groupId, rows);
    }

    public GroupId getGroupId() {
        return groupId;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * 조회 계층이 돌려준 순서 그대로의 행 목록 (불변).
     *
     * @return 행 목록
     */
    public List<RawComponentRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "Group{" + groupId.getValue() + ", category=" + category + ", rows=" + rows.size() + '}';
    }
}
