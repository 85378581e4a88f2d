package com.vulnharvest.core.model;

import java.util.Locale;

/** 업스트림 심각도 등급. 해석 불가 값은 UNKNOWN */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL, UNKNOWN;

    /** 대소문자/공백 무시 파싱. null·빈 문자열·미지정 값은 UNKNOWN */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity v : values()) {
            if (v.name().equals(s)) return v;
        }
        return UNKNOWN;
    }
}
