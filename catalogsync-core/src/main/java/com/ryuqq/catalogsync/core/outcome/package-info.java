/**
 * Remote call outcome package.
 *
 * <p>This package defines the sealed result hierarchy returned by every
 * {@link com.ryuqq.catalogsync.core.spi.CatalogPlatform} call.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalogsync.core.outcome.Ok} - Successful completion carrying a value</li>
 *   <li>{@link com.ryuqq.catalogsync.core.outcome.Retry} - Transient failure, optionally with a platform wait hint</li>
 *   <li>{@link com.ryuqq.catalogsync.core.outcome.Fail} - Permanent failure (never retried)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Catalog Sync Team
 */
package com.ryuqq.catalogsync.core.outcome;
