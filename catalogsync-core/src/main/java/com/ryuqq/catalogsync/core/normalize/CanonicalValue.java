package com.ryuqq.catalogsync.core.normalize;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 정규화된 속성 값.
 *
 * <p>표시 문자열과 정렬 키를 함께 가집니다. 동등성은 표시 문자열 기준이며,
 * 정렬은 (tier, rank, subRank, 표시 문자열) 순으로 비교합니다.</p>
 *
 * <ul>
 *   <li>숫자 값: rank = 숫자 값, 숫자로 해석할 수 없는 값은 tier 1 (숫자 뒤)</li>
 *   <li>금속: tier = 계열, rank = 캐럿, subRank = 색상 우선순위</li>
 *   <li>Clarity: rank = 등급 순서, 알 수 없는 등급은 tier 1</li>
 *   <li>그 외 텍스트: 표시 문자열 순</li>
 * </ul>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class CanonicalValue implements Comparable<CanonicalValue> {

    private final String display;
    private final int tier;
    private final BigDecimal rank;
    private final int subRank;

    private CanonicalValue(String display, int tier, BigDecimal rank, int subRank) {
        if (display == null || display.isBlank()) {
            throw new IllegalArgumentException("display cannot be null or blank");
        }
        if (rank == null) {
            throw new IllegalArgumentException("rank cannot be null");
        }
        this.display = display;
        this.tier = tier;
        this.rank = rank;
        this.subRank = subRank;
    }

    public static CanonicalValue text(String display) {
        return new CanonicalValue(display, 0, BigDecimal.ZERO, 0);
    }

    public static CanonicalValue numeric(String display, BigDecimal value) {
        return new CanonicalValue(display, 0, value, 0);
    }

    /**
     * 숫자 정렬 대상이지만 숫자로 해석할 수 없는 값. 모든 숫자 값 뒤에 정렬됩니다.
     */
    public static CanonicalValue nonNumeric(String display) {
        return new CanonicalValue(display, 1, BigDecimal.ZERO, 0);
    }

    public static CanonicalValue ranked(String display, int tier, long rank, int subRank) {
        return new CanonicalValue(display, tier, BigDecimal.valueOf(rank), subRank);
    }

    public String display() {
        return display;
    }

    @Override
    public int compareTo(CanonicalValue other) {
        if (display.equals(other.display)) {
            return 0;
        }
        int result = Integer.compare(tier, other.tier);
        if (result != 0) {
            return result;
        }
        result = rank.compareTo(other.rank);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(subRank, other.subRank);
        if (result != 0) {
            return result;
        }
        return display.compareTo(other.display);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalValue that = (CanonicalValue) o;
        return display.equals(that.display);
    }

    @Override
    public int hashCode() {
        return Objects.hash(display);
    }

    @Override
    public String toString() {
        return display;
    }
}
