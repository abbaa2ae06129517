/**
 * Per-group sync lifecycle.
 *
 * <p>{@link com.ryuqq.catalogsync.core.statemachine.StateTransition} is the only way a group's
 * {@link com.ryuqq.catalogsync.core.statemachine.SyncState} advances. Terminal states never move.</p>
 */
package com.ryuqq.catalogsync.core.statemachine;
