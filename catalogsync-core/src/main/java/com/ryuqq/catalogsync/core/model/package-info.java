/**
 * Source-side domain model: raw component rows and the groups they form.
 *
 * <ul>
 *   <li>{@link com.ryuqq.catalogsync.core.model.GroupId} - Group identifier (value object)</li>
 *   <li>{@link com.ryuqq.catalogsync.core.model.RawComponentRow} - One warranty database row, as read</li>
 *   <li>{@link com.ryuqq.catalogsync.core.model.Group} - Rows sharing a group id, one product on the platform</li>
 *   <li>{@link com.ryuqq.catalogsync.core.model.MediaRef} - Validated image reference</li>
 * </ul>
 *
 * <p>All types are immutable. Raw rows keep source codes untouched; normalization
 * happens later in {@code core.normalize}.</p>
 *
 * @since 1.0.0
 * @author Catalog Sync Team
 */
package com.ryuqq.catalogsync.core.model;
