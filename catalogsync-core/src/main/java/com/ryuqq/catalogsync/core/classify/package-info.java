/**
 * Attribute classification.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>{@link com.ryuqq.catalogsync.core.classify.CategoryRuleBook} resolves the rules of the group's category</li>
 *   <li>{@link com.ryuqq.catalogsync.core.classify.AttributeClassifier} normalizes every eligible key per row</li>
 *   <li>Distinct values decide CONSTANT or VARIANT</li>
 * </ol>
 *
 * <h2>Ordering</h2>
 * <p>Results are keyed in {@link com.ryuqq.catalogsync.core.classify.AttributeKey} declaration order,
 * values in canonical order. Row order never changes the result.</p>
 */
package com.ryuqq.catalogsync.core.classify;
