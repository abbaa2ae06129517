/**
 * Change detection.
 *
 * <p>{@link com.ryuqq.catalogsync.core.fingerprint.FingerprintCalculator} hashes the
 * {@link com.ryuqq.catalogsync.core.fingerprint.CanonicalForm} of an entity;
 * {@link com.ryuqq.catalogsync.core.fingerprint.StateComparator} compares it with the
 * {@link com.ryuqq.catalogsync.core.fingerprint.RemoteState} to decide CREATE, UPDATE or NO_OP.</p>
 */
package com.ryuqq.catalogsync.core.fingerprint;
