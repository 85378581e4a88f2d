package com.vulnharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (완료 스윕 / 전체 스윕)
     * @param phase    "sweep" | "merge" | "done"
     * @param done     종료된 스윕 수
     * @param total    전체 스윕 수
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
