package com.ryuqq.catalogsync.core.spi;

import com.ryuqq.catalogsync.core.fingerprint.RemoteState;
import com.ryuqq.catalogsync.core.outcome.Outcome;

import java.util.List;

/**
 * Catalog platform SPI (e-commerce product API).
 *
 * <p>Every call returns an {@link Outcome} instead of throwing:</p>
 * <ul>
 *   <li>{@code Ok}: the call succeeded (field level rejections travel inside the value)</li>
 *   <li>{@code Retry}: throttled, timed out or 5xx; may carry a wait hint such as Retry-After</li>
 *   <li>{@code Fail}: permanent rejection, never retried</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently by sync workers</li>
 *   <li>Upsert keyed by handle: repeating a request never creates a second entity</li>
 *   <li>Upsert is atomic: product, options, variants, metafields and media in one call</li>
 *   <li>The request fingerprint is stored and returned by {@link #findRemoteState(String)}</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public interface CatalogPlatform {

    /**
     * Reads the remote state of the entity with the given handle.
     *
     * @param handle the entity handle
     * @return remote state, {@link RemoteState#none()} when the entity does not exist
     */
    Outcome<RemoteState> findRemoteState(String handle);

    /**
     * Creates or updates one entity atomically.
     *
     * @param request the entity and its fingerprint
     * @return platform id, variant ids and field errors
     */
    Outcome<UpsertResult> upsert(UpsertRequest request);

    /**
     * Submits many entities as one bulk job.
     *
     * @param serializedEntities one JSON document per entity (JSON lines)
     * @return the submitted operation
     */
    Outcome<BulkOperation> submitBulk(List<String> serializedEntities);

    /**
     * Polls a bulk job.
     *
     * @param operation the submitted operation
     * @return current status, with per-handle results once completed
     */
    Outcome<BulkStatus> pollBulk(BulkOperation operation);
}
