/**
 * Remote call protection.
 *
 * <p>{@link com.ryuqq.catalogsync.core.protection.RateLimiter} is the single shared mutable
 * resource of a sync run. Implementations live in the runner adapter.</p>
 */
package com.ryuqq.catalogsync.core.protection;
