package com.gleamfinder.core.model;

import java.util.Objects;

/** 응모 방법 하나: 종류 태그 + 획득 점수(worth >= 0). */
public record EntryMethod(String kind, long worth) {
    public EntryMethod {
        Objects.requireNonNull(kind, "kind");
        if (worth < 0) throw new IllegalArgumentException("worth must be >= 0");
    }
}
