/**
 * Catalog entity construction.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalogsync.core.catalog.VariantBuilder}: options, variants, metafields</li>
 *   <li>{@link com.ryuqq.catalogsync.core.catalog.TitleComposer}: title and description from constant attributes</li>
 *   <li>{@link com.ryuqq.catalogsync.core.catalog.HandleGenerator}: URL handle with a group id suffix</li>
 * </ul>
 *
 * <p>A {@link com.ryuqq.catalogsync.core.catalog.CatalogEntity} is immutable once built.</p>
 */
package com.ryuqq.catalogsync.core.catalog;
