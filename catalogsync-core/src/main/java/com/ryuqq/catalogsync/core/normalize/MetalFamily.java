package com.ryuqq.catalogsync.core.normalize;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 금속 스탬프로 판별한 금속 계열.
 *
 * <p>선언 순서가 곧 정렬 우선순위입니다 (Gold → Silver → Platinum → 기타).</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
enum MetalFamily {

    GOLD,
    SILVER,
    PLATINUM,
    TANTALUM,
    TITANIUM,
    OTHER;

    private static final Pattern KARAT = Pattern.compile("^(\\d{1,2})\\s*(K|KT|KARAT)$");
    private static final Set<String> SILVER_STAMPS = Set.of("SS", "925", "AG", "STERLING", "SILVER", "STERLING SILVER");
    private static final Set<String> PLATINUM_STAMPS = Set.of("PT", "PT950", "PT900", "PT 950", "PT 900", "950", "PLAT", "PLATINUM");
    private static final Set<String> TANTALUM_STAMPS = Set.of("TA", "TANTALUM");
    private static final Set<String> TITANIUM_STAMPS = Set.of("TI", "TITANIUM");

    static MetalFamily fromStamp(String stamp) {
        if (stamp == null || stamp.isBlank()) {
            return OTHER;
        }
        String normalized = normalizeStamp(stamp);
        if (KARAT.matcher(normalized).matches()) {
            return GOLD;
        }
        if (SILVER_STAMPS.contains(normalized)) {
            return SILVER;
        }
        if (PLATINUM_STAMPS.contains(normalized)) {
            return PLATINUM;
        }
        if (TANTALUM_STAMPS.contains(normalized)) {
            return TANTALUM;
        }
        if (TITANIUM_STAMPS.contains(normalized)) {
            return TITANIUM;
        }
        return OTHER;
    }

    /**
     * 금 스탬프를 "14K" 형태로 정규화. 금 계열이 아니면 대문자 원본.
     */
    static String karatStamp(String stamp) {
        String normalized = normalizeStamp(stamp);
        Matcher matcher = KARAT.matcher(normalized);
        if (matcher.matches()) {
            return Integer.parseInt(matcher.group(1)) + "K";
        }
        return normalized;
    }

    private static String normalizeStamp(String stamp) {
        return stamp.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
