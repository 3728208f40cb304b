package com.copyleft.LetterClash.global.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern ALEF_VARIANTS = Pattern.compile("[إأآ]");
    private static final Pattern NON_LETTERS = Pattern.compile("[^A-Za-z\\u0621-\\u064A]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private TextNormalizer() {
    }

    /**
     * 아랍어 철자 변형을 하나로 모은다: 함자가 붙은 알리프 → 알리프, 알리프 막수라 → 야, 타 마르부타 → 하.
     */
    public static String foldArabic(String s) {
        if (s == null) {
            return "";
        }
        return ALEF_VARIANTS.matcher(s).replaceAll("ا")
                .replace('ى', 'ي')
                .replace('ة', 'ه');
    }

    /**
     * 비교용 정규화 (변형 통합 + trim + 소문자).
     */
    public static String normalizeWord(String s) {
        return foldArabic(s).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 라틴/아랍 문자만 남긴다.
     */
    public static String lettersOnly(String s) {
        if (s == null) {
            return "";
        }
        return NON_LETTERS.matcher(s).replaceAll("");
    }

    public static int countLetters(String s) {
        return lettersOnly(s).length();
    }

    /**
     * 대문자 변환 후 영문/숫자 외 문자를 제거하고 maxLength 로 자른다. 결과가 비어 있을 수 있다.
     */
    public static String normalizeRoomCode(String raw, int maxLength) {
        if (raw == null) {
            return "";
        }
        String code = NON_ALPHANUMERIC.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("");
        return truncate(code, maxLength);
    }

    public static String truncate(String s, int maxLength) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxLength ? s : s.substring(0, maxLength);
    }
}
