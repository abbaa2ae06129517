package com.ryuqq.catalogsync.core.spi;

import com.ryuqq.catalogsync.core.model.Group;
import com.ryuqq.catalogsync.core.model.MediaRef;

import java.util.List;

/**
 * Image subsystem SPI.
 *
 * <p>Discovery, validation and upload of product images happen behind this interface.
 * The core attaches the returned references in the given order.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public interface MediaProvider {

    /**
     * Returns validated media references for a group.
     *
     * @param group the group
     * @return media references in display order (may be empty)
     */
    List<MediaRef> getValidatedMedia(Group group);
}
