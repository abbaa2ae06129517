package com.ryuqq.catalogsync.adapter.inmemory;

import com.ryuqq.catalogsync.core.error.GroupNotFoundException;
import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import com.ryuqq.catalogsync.core.spi.GroupSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link GroupSource}.
 *
 * <p>행을 그룹 ID별로 보관하고, 조회 시마다 {@link Group}을 새로 구성합니다.
 * 그룹 ID 목록은 사전순입니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class InMemoryGroupSource implements GroupSource {

    private final ConcurrentSkipListMap<GroupId, List<RawComponentRow>> rowsByGroup = new ConcurrentSkipListMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    public InMemoryGroupSource addRows(Collection<RawComponentRow> rows) {
        for (RawComponentRow row : rows) {
            addRow(row);
        }
        return this;
    }

    public InMemoryGroupSource addRow(RawComponentRow row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        rowsByGroup.compute(row.getGroupId(), (id, existing) -> {
            List<RawComponentRow> rows = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            rows.removeIf(r -> r.getSku().equals(row.getSku()));
            rows.add(row);
            return List.copyOf(rows);
        });
        return this;
    }

    /**
     * 그룹의 행 전체를 교체합니다.
     */
    public InMemoryGroupSource replaceGroup(GroupId groupId, List<RawComponentRow> rows) {
        rowsByGroup.put(groupId, List.copyOf(rows));
        return this;
    }

    @Override
    public Group fetchGroup(GroupId groupId) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        fetchCount.incrementAndGet();
        List<RawComponentRow> rows = rowsByGroup.get(groupId);
        if (rows == null || rows.isEmpty()) {
            throw new GroupNotFoundException(groupId);
        }
        return Group.of(groupId, rows);
    }

    @Override
    public List<GroupId> fetchAllGroupIds() {
        List<GroupId> ids = new ArrayList<>();
        for (Map.Entry<GroupId, List<RawComponentRow>> entry : rowsByGroup.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    public int fetchCount() {
        return fetchCount.get();
    }
}
