package com.vulnharvest.core.model;

/** 레코드 불리언 플래그 묶음 (업스트림 hasFix / exploitable / isHighProfileThreat / hasCisaKevExploit) */
public record RecordFlags(boolean hasFix, boolean exploitable, boolean highProfile, boolean knownExploited) {
    public static final RecordFlags NONE = new RecordFlags(false, false, false, false);
}
