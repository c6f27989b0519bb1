package com.gleamfinder.core.util;

import java.time.Duration;

/** 요청 사이 대기 훅. 테스트에서는 기록만 하는 구현으로 바꿔 끼운다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
