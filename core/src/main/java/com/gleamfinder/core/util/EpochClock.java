package com.gleamfinder.core.util;

/** lastFetchedAt 등에 쓰는 현재 시각(unix seconds) 공급자. */
@FunctionalInterface
public interface EpochClock {
    long nowSeconds();

    EpochClock SYSTEM = () -> System.currentTimeMillis() / 1000L;
}
