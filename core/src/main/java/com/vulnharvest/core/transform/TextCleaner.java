package com.vulnharvest.core.transform;

import java.util.regex.Pattern;

/** 설명 텍스트 정리: 제어문자 제거 → 공백 압축 → trim → 길이 제한 */
public final class TextCleaner {
    private TextCleaner() {}

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\s]]");
    private static final Pattern WS = Pattern.compile("\\s+");

    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        String s = CONTROL.matcher(raw).replaceAll("");
        return WS.matcher(s).replaceAll(" ").trim();
    }

    /** maxLength 초과 시 잘라낸다. 서로게이트 쌍 중간에서 끊지 않음 */
    public static String bound(String s, int maxLength) {
        if (s == null) return "";
        if (maxLength <= 0) return "";
        if (s.length() <= maxLength) return s;
        int end = maxLength;
        if (Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end).trim();
    }
}
