package com.ryuqq.catalogsync.core.error;

import com.ryuqq.catalogsync.core.model.GroupId;

/**
 * 조회 계층에 그룹 ID와 일치하는 행이 없음.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class GroupNotFoundException extends RuntimeException {

    private final GroupId groupId;

    public GroupNotFoundException(GroupId groupId) {
        super("No rows found for group: " + groupId.getValue());
        this.groupId = groupId;
    }

    public GroupId getGroupId() {
        return groupId;
    }
}
