package com.ryuqq.catalogsync.adapter.inmemory;

import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import com.ryuqq.catalogsync.core.spi.MediaProvider;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link MediaProvider}.
 *
 * <p>이미지 SKU(없으면 SKU)별로 등록된 미디어만 유효한 것으로 취급합니다.
 * 같은 URI는 한 번만, 행 순서대로 반환합니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class InMemoryMediaProvider implements MediaProvider {

    private final Map<String, List<MediaRef>> mediaByImageSku = new ConcurrentHashMap<>();

    public InMemoryMediaProvider register(String imageSku, MediaRef... media) {
        if (imageSku == null || imageSku.isBlank()) {
            throw new IllegalArgumentException("imageSku cannot be null or blank");
        }
        mediaByImageSku.put(imageSku, List.of(media));
        return this;
    }

    @Override
    public List<MediaRef> getValidatedMedia(Group group) {
        Set<String> seen = new LinkedHashSet<>();
        List<MediaRef> validated = new ArrayList<>();
        for (RawComponentRow row : group.getRows()) {
            String key = row.getImageSku() == null || row.getImageSku().isBlank() ? row.getSku() : row.getImageSku();
            for (MediaRef ref : mediaByImageSku.getOrDefault(key, List.of())) {
                if (seen.add(ref.uri())) {
                    validated.add(ref);
                }
            }
        }
        return validated;
    }
}
