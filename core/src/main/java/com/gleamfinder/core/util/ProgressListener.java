package com.gleamfinder.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase "search" | "resolve" | "fetch"
     * @param done  처리 수
     * @param total 전체 수(모르면 -1)
     */
    void onProgress(String phase, long done, long total);

    ProgressListener NONE = (phase, d, t) -> {};
}
