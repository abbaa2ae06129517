package com.ryuqq.catalogsync.core.spi;

import com.ryuqq.catalogsync.core.error.GroupNotFoundException;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.GroupId;

import java.util.List;

/**
 * Query layer SPI over the warranty database.
 *
 * <p>Returns raw component rows grouped by group id. The rows are read-only to the core.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently by sync workers for different groups</li>
 *   <li>Rows of one group must share a single category</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public interface GroupSource {

    /**
     * Fetches every row of a group.
     *
     * @param groupId the group id
     * @return the group (never empty)
     * @throws GroupNotFoundException if no row carries the group id
     */
    Group fetchGroup(GroupId groupId);

    /**
     * Lists every group id known to the source, used by a full sync.
     *
     * @return group ids (may be empty)
     */
    List<GroupId> fetchAllGroupIds();
}
