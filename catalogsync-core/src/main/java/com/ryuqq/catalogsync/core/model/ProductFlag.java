package com.ryuqq.catalogsync.core.model;

/**
 * 상품 단위 boolean 플래그.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public enum ProductFlag {

    BEST_SELLER("is_best_seller"),
    HIGH_ROAS("is_high_roas"),
    PINTEREST("is_pinterest");

    private final String metafieldKey;

    ProductFlag(String metafieldKey) {
        this.metafieldKey = metafieldKey;
    }

    public String metafieldKey() {
        return metafieldKey;
    }
}
