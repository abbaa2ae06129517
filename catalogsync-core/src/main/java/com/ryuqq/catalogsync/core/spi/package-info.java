/**
 * Service Provider Interfaces.
 *
 * <h2>Collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalogsync.core.spi.GroupSource}: warranty database query layer</li>
 *   <li>{@link com.ryuqq.catalogsync.core.spi.MediaProvider}: image subsystem</li>
 *   <li>{@link com.ryuqq.catalogsync.core.spi.CatalogPlatform}: remote catalog API</li>
 * </ul>
 *
 * <p>Adapters implement these interfaces. The in-memory adapter is used by tests and local runs.</p>
 */
package com.ryuqq.catalogsync.core.spi;
