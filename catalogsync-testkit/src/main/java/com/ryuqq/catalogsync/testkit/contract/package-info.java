/**
 * Contract tests shared by catalog platform adapters.
 *
 * <p>Adapters extend {@link com.ryuqq.catalogsync.testkit.contract.AbstractCatalogPlatformContractTest}
 * in their own test sources and supply a fresh platform per test.</p>
 */
package com.ryuqq.catalogsync.testkit.contract;
