package com.ryuqq.catalogsync.core.catalog;

import com.ryuqq.catalogsync.core.model.GroupId;

import java.util.Locale;

/**
 * URL 핸들 생성.
 *
 * <p>제목을 슬러그로 바꾸고 소문자 groupId를 접미사로 붙입니다. 접미사는 슬러그 처리하지 않으므로
 * groupId가 다르면 핸들도 다릅니다. 길이 제한을 넘으면 제목 부분만 잘라내며 접미사는 항상 유지됩니다.</p>
 *
 * <pre>
 * "2.80 CTW Cushion Moissanite Ring" + GRP-1 → "280-ctw-cushion-moissanite-ring-grp-1"
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class HandleGenerator {

    private final int maxLength;

    public HandleGenerator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    /**
     * 핸들 생성.
     *
     * @param title 상품 제목
     * @param groupId 그룹 ID (접미사)
     * @return 핸들
     * @throws IllegalArgumentException groupId만으로 길이 제한을 넘는 경우
     */
    public String generate(String title, GroupId groupId) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        String suffix = groupId.getValue().toLowerCase(Locale.ROOT);
        if (suffix.length() > maxLength) {
            throw new IllegalArgumentException(
                "GroupId '" + suffix + "' exceeds handle limit " + maxLength);
        }
        String base = slug(title == null ? "" : title);
        int available = maxLength - suffix.length() - 1;
        if (base.isEmpty() || available <= 0) {
            return suffix;
        }
        if (base.length() > available) {
            base = trimHyphens(base.substring(0, available));
        }
        return base.isEmpty() ? suffix : base + "-" + suffix;
    }

    /**
     * 소문자, 공백 → 하이픈, [a-z0-9-] 외 문자 제거, 연속 하이픈 축약, 양끝 하이픈 제거.
     */
    static String slug(String text) {
        String slug = text.toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", "-")
            .replaceAll("[^a-z0-9-]", "")
            .replaceAll("-{2,}", "-");
        return trimHyphens(slug);
    }

    private static String trimHyphens(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
