package com.ryuqq.catalogsync.core.normalize;

import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.model.RawComponentRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 원본 코드 값을 표시용 정규 값(canonical value)으로 변환.
 *
 * <p>모든 함수는 순수 함수이며, 정의된 코드표 밖의 값에 대해서도 실패하지 않고
 * 문서화된 기본값으로 대체합니다. 잘못된 원본 데이터 하나가 그룹 전체를 중단시키지 않아야 합니다.</p>
 *
 * <p><strong>대체 규칙 (DataError):</strong></p>
 * <ul>
 *   <li>알 수 없는 clarity 코드: 대문자로 정리해 그대로 통과</li>
 *   <li>알 수 없는 cut 코드: "Excellent"</li>
 *   <li>알 수 없는 소재/모양/도금 코드: Title Case로 통과</li>
 *   <li>0 이하 또는 누락된 캐럿 무게: 값 없음</li>
 *   <li>숫자가 아닌 반지 사이즈: 원본 텍스트 통과 (정렬 시 숫자 뒤)</li>
 * </ul>
 *
 * <p><strong>금속 표기 규칙:</strong></p>
 * <pre>
 * 14K + WHITE   → "14K White Gold"
 * SS  + WHITE   → "White Silver"      (스탬프 생략)
 * PT950 + WHITE → "Platinum"          (흰색 또는 색상 없음)
 * PT950 + ROSE  → "Platinum Rose"
 * TA  + (없음)  → "Tantalum"
 * TI  + BLACK   → "Titanium Black"
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    /**
     * 알 수 없는 cut 코드의 기본값.
     */
    public static final String DEFAULT_CUT = "Excellent";

    private static final String TWO_TONE = "Two-Tone";

    private static final Map<String, String> MATERIALS = Map.of(
        "LGD", "Lab-Grown Diamond",
        "MOISSANITE", "Moissanite",
        "MOI", "Moissanite",
        "NAT", "Natural Diamond",
        "CZ", "Cubic Zirconia",
        "SAPPHIRE", "Sapphire",
        "RUBY", "Ruby",
        "EMERALD", "Emerald",
        "AMETHYST", "Amethyst"
    );

    private static final Map<String, String> SHAPES = Map.ofEntries(
        Map.entry("RD", "Round"),
        Map.entry("RB", "Round"),
        Map.entry("CU", "Cushion"),
        Map.entry("OV", "Oval"),
        Map.entry("PR", "Princess"),
        Map.entry("EM", "Emerald"),
        Map.entry("RA", "Radiant"),
        Map.entry("PE", "Pear"),
        Map.entry("PS", "Pear"),
        Map.entry("MQ", "Marquise"),
        Map.entry("AS", "Asscher"),
        Map.entry("HS", "Heart"),
        Map.entry("HT", "Heart"),
        Map.entry("TR", "Trillion")
    );

    /**
     * Clarity 등급 (좋은 등급 → 낮은 등급 순).
     */
    static final List<String> CLARITY_GRADES = List.of(
        "FL", "IF", "VVS1", "VVS2", "VS1", "VS2", "SI1", "SI2", "SI3", "I1", "I2", "I3"
    );

    private static final Map<String, String> CUTS = Map.of(
        "ID", "Ideal",
        "IDEAL", "Ideal",
        "EX", "Excellent",
        "EXCELLENT", "Excellent",
        "VG", "Very Good",
        "VERY GOOD", "Very Good",
        "G", "Good",
        "GOOD", "Good",
        "F", "Fair",
        "FAIR", "Fair"
    );

    private static final Map<String, String> PLATINGS = Map.of(
        "RH", "Rhodium",
        "BRH", "Black Rhodium",
        "YGP", "Yellow Gold",
        "RGP", "Rose Gold",
        "NONE", "None"
    );

    private static final Map<String, String> COLORS = Map.of(
        "W", "White",
        "WHT", "White",
        "Y", "Yellow",
        "YEL", "Yellow",
        "R", "Rose",
        "PINK", "Rose",
        "TT", TWO_TONE,
        "2T", TWO_TONE,
        "TWO TONE", TWO_TONE,
        "TWOTONE", TWO_TONE
    );

    /**
     * 속성 키에 해당하는 원본 값을 행에서 꺼내 정규화.
     *
     * @param key 속성 키
     * @param row 원본 행
     * @return 정규 값, 원본 값이 없으면 empty
     */
    public Optional<CanonicalValue> normalize(AttributeKey key, RawComponentRow row) {
        if (key == null || row == null) {
            throw new IllegalArgumentException("key and row cannot be null");
        }
        return switch (key) {
            case CARAT_WEIGHT -> caratWeight(row.getCaratWeight());
            case METAL_TYPE -> metalType(row.getMetalStamp(), row.getMetalColor());
            case RING_SIZE -> ringSize(row.getRingSize());
            case STONE_LENGTH -> millimetres(row.getLengthMm());
            case STONE_WIDTH -> millimetres(row.getWidthMm());
            case PLATING_TYPE -> plating(row.getPlatingCode());
            case STONE_SHAPE -> shape(row.getShapeCode());
            case STONE_MATERIAL -> material(row.getMaterialCode());
            case CLARITY -> clarity(row.getClarityCode());
            case CUT_GRADE -> cut(row.getCutCode());
            case SETTING_STYLE -> titleText(row.getSubgroupCode());
            case SETTING_TYPE -> titleText(row.getSettingType());
            case STONE_COLOR -> titleText(row.getStoneColor());
            case COLLECTION -> text(row.getCollection());
            case JEWELRY_BRAND -> text(row.getJewelryBrand());
            case GEMSTONE_BRAND -> text(row.getGemstoneBrand());
            case STYLE_ID -> text(row.getStyleId());
            case WEB_DESCRIPTOR -> text(row.getWebDescriptor());
            case STONE_COUNT -> count(row.getPiecesPer());
        };
    }

    /**
     * 금속 스탬프와 색상으로 금속 표기 생성.
     *
     * @param stamp 금속 스탬프 (예: "14K", "PT950", "SS")
     * @param color 금속 색상 코드 (예: "WHITE", "TT")
     * @return 금속 표기, 둘 다 비어 있으면 empty
     */
    public Optional<CanonicalValue> metalType(String stamp, String color) {
        boolean noStamp = isBlank(stamp);
        String colorName = color(color);
        if (noStamp && colorName.isEmpty()) {
            return Optional.empty();
        }
        MetalFamily family = MetalFamily.fromStamp(stamp);
        int colorRank = colorRank(colorName);
        CanonicalValue result = switch (family) {
            case GOLD -> {
                String karat = MetalFamily.karatStamp(stamp);
                long karatValue = Long.parseLong(karat.substring(0, karat.length() - 1));
                yield CanonicalValue.ranked(join(karat, colorName, "Gold"), 0, karatValue, colorRank);
            }
            case SILVER -> CanonicalValue.ranked(join(colorName, "Silver"), 1, 0, colorRank);
            case PLATINUM -> colorName.isEmpty() || "White".equals(colorName)
                ? CanonicalValue.ranked("Platinum", 2, 0, 0)
                : CanonicalValue.ranked(join("Platinum", colorName), 2, 0, colorRank);
            case TANTALUM -> CanonicalValue.ranked(join("Tantalum", colorName), 3, 0, colorRank);
            case TITANIUM -> CanonicalValue.ranked(join("Titanium", colorName), 3, 0, colorRank);
            case OTHER -> {
                log.debug("Unmapped metal stamp '{}', composing stamp and color", stamp);
                String composed = join(noStamp ? "" : stamp.trim().toUpperCase(Locale.ROOT), colorName);
                yield CanonicalValue.ranked(composed, 3, 0, colorRank);
            }
        };
        return Optional.of(result);
    }

    /**
     * 같은 계열 안에서의 색상 우선순위. 색상 없음은 흰색과 같은 순위입니다.
     */
    private static int colorRank(String colorName) {
        switch (colorName) {
            case "":
            case "White":
                return 0;
            case "Yellow":
                return 1;
            case "Rose":
                return 2;
            case TWO_TONE:
                return 4;
            default:
                return 3;
        }
    }

    /**
     * 금속 색상 코드 정규화. 비어 있으면 빈 문자열.
     */
    String color(String rawColor) {
        if (isBlank(rawColor)) {
            return "";
        }
        String code = rawColor.trim().toUpperCase(Locale.ROOT);
        String mapped = COLORS.get(code);
        if (mapped != null) {
            return mapped;
        }
        if (code.equals("TWO-TONE")) {
            return TWO_TONE;
        }
        return titleCase(code);
    }

    public Optional<CanonicalValue> material(String code) {
        return mapped(code, MATERIALS, "material");
    }

    public Optional<CanonicalValue> shape(String code) {
        return mapped(code, SHAPES, "shape");
    }

    public Optional<CanonicalValue> plating(String code) {
        return mapped(code, PLATINGS, "plating");
    }

    /**
     * Clarity 코드 정규화. 알 수 없는 코드는 대문자로 그대로 통과합니다.
     */
    public Optional<CanonicalValue> clarity(String code) {
        if (isBlank(code)) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        int grade = CLARITY_GRADES.indexOf(normalized);
        if (grade < 0) {
            log.debug("Unmapped clarity code '{}', passing through", normalized);
            return Optional.of(CanonicalValue.ranked(normalized, 1, 0, 0));
        }
        return Optional.of(CanonicalValue.ranked(normalized, 0, grade, 0));
    }

    /**
     * Cut 코드 정규화. 알 수 없는 코드는 {@link #DEFAULT_CUT}.
     */
    public Optional<CanonicalValue> cut(String code) {
        if (isBlank(code)) {
            return Optional.empty();
        }
        String mapped = CUTS.get(code.trim().toUpperCase(Locale.ROOT));
        if (mapped == null) {
            log.debug("Unmapped cut code '{}', defaulting to {}", code, DEFAULT_CUT);
            return Optional.of(CanonicalValue.text(DEFAULT_CUT));
        }
        return Optional.of(CanonicalValue.text(mapped));
    }

    /**
     * 캐럿 무게 표기 ("2.80 CTW"). 0 이하는 값 없음.
     */
    public Optional<CanonicalValue> caratWeight(BigDecimal weight) {
        if (weight == null || weight.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal scaled = weight.setScale(2, RoundingMode.HALF_UP);
        return Optional.of(CanonicalValue.numeric(scaled.toPlainString() + " CTW", scaled));
    }

    /**
     * 반지 사이즈 표기 ("6.0", "6.25"). 숫자가 아니면 원본 텍스트.
     *
     * <p>정렬 기준은 표기와 같은 소수 둘째 자리 반올림 값입니다.</p>
     */
    public Optional<CanonicalValue> ringSize(String size) {
        if (isBlank(size)) {
            return Optional.empty();
        }
        String trimmed = size.trim();
        BigDecimal numeric;
        try {
            numeric = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            log.debug("Non-numeric ring size '{}', passing through", trimmed);
            return Optional.of(CanonicalValue.nonNumeric(trimmed));
        }
        BigDecimal rounded = numeric.setScale(2, RoundingMode.HALF_UP);
        return Optional.of(CanonicalValue.numeric(decimal(rounded), rounded));
    }

    /**
     * 밀리미터 표기 ("6.5mm"). 0 이하는 값 없음.
     */
    public Optional<CanonicalValue> millimetres(BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP);
        return Optional.of(CanonicalValue.numeric(decimal(rounded) + "mm", rounded));
    }

    public Optional<CanonicalValue> count(Integer pieces) {
        if (pieces == null || pieces <= 0) {
            return Optional.empty();
        }
        return Optional.of(CanonicalValue.numeric(String.valueOf(pieces), BigDecimal.valueOf(pieces)));
    }

    /**
     * 코드형 텍스트를 Title Case로 (예: "THREE_STONE" → "Three Stone").
     */
    public Optional<CanonicalValue> titleText(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        return Optional.of(CanonicalValue.text(titleCase(raw)));
    }

    /**
     * 자유 텍스트는 앞뒤 공백만 정리.
     */
    public Optional<CanonicalValue> text(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        return Optional.of(CanonicalValue.text(raw.trim().replaceAll("\\s+", " ")));
    }

    private Optional<CanonicalValue> mapped(String code, Map<String, String> table, String field) {
        if (isBlank(code)) {
            return Optional.empty();
        }
        String key = code.trim().toUpperCase(Locale.ROOT);
        String value = table.get(key);
        if (value != null) {
            return Optional.of(CanonicalValue.text(value));
        }
        String fallback = titleCase(key);
        if (!table.containsValue(fallback)) {
            log.debug("Unmapped {} code '{}', using '{}'", field, code, fallback);
        }
        return Optional.of(CanonicalValue.text(fallback));
    }

    /**
     * 단어 단위 Title Case. 밑줄은 공백으로, 하이픈으로 연결된 단어는 각각 대문자로 시작합니다.
     *
     * @param raw 원본 텍스트
     * @return Title Case 텍스트
     */
    static String titleCase(String raw) {
        String[] words = raw.trim().replace('_', ' ').split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            String[] parts = word.split("-", -1);
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    sb.append('-');
                }
                String part = parts[i];
                if (!part.isEmpty()) {
                    sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT))
                      .append(part.substring(1).toLowerCase(Locale.ROOT));
                }
            }
        }
        return sb.toString();
    }

    private static String decimal(BigDecimal value) {
        DecimalFormat format = new DecimalFormat("0.0#", DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value);
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
