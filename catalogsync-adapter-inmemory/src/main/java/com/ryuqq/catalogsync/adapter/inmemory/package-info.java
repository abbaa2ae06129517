/**
 * In-memory reference adapters.
 *
 * <p>{@link com.ryuqq.catalogsync.adapter.inmemory.InMemoryCatalogPlatform} simulates a catalog
 * platform with handle-keyed upserts, bulk jobs and scriptable failures.
 * {@link com.ryuqq.catalogsync.adapter.inmemory.InMemoryGroupSource} and
 * {@link com.ryuqq.catalogsync.adapter.inmemory.InMemoryMediaProvider} stand in for the
 * warranty database and media service.</p>
 *
 * <p>These adapters are intended for tests and local runs. Data is lost on process restart.</p>
 */
package com.ryuqq.catalogsync.adapter.inmemory;
