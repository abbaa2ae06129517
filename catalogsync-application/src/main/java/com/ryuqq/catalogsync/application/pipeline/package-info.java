/**
 * Group preparation.
 *
 * <p>{@link com.ryuqq.catalogsync.application.pipeline.GroupPipeline} runs fetch, classify, build,
 * validate and fingerprint for one group. Nothing here talks to the catalog platform.</p>
 */
package com.ryuqq.catalogsync.application.pipeline;
