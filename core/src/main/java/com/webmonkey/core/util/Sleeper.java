package com.webmonkey.core.util;

import java.time.Duration;

/** 대기 추상화: 테스트에서는 기록만 하는 구현으로 바꿔 끼운다. */
@FunctionalInterface
public interface Sleeper {

    /** Thread.sleep 기반 기본 구현. 0 이하 대기는 바로 돌아온다. */
    Sleeper SYSTEM = d -> {
        long ms = d == null ? 0 : d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };

    void sleep(Duration d) throws InterruptedException;
}
