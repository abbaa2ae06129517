/**
 * Sync entry point and run results.
 *
 * <p>{@link com.ryuqq.catalogsync.application.sync.CatalogSync} is implemented by the runner adapter.
 * Every requested group ends up as exactly one {@link com.ryuqq.catalogsync.application.sync.GroupResult}
 * inside the {@link com.ryuqq.catalogsync.application.sync.RunSummary}.</p>
 */
package com.ryuqq.catalogsync.application.sync;
