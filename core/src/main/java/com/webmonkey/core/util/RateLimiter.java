package com.webmonkey.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 최소 간격 리미터: 연속한 두 acquire() 사이에 minInterval 이상을 보장한다.
 * 처리량의 목표치가 아니라 하한선이다. 워커 여러 개가 하나를 공유해도 된다(단일 락).
 */
public final class RateLimiter {
    private final long intervalNs;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private long lastNs;
    private boolean first = true;

    public RateLimiter(Duration minInterval) {
        this(minInterval, Sleeper.SYSTEM, System::nanoTime);
    }

    public RateLimiter(Duration minInterval, Sleeper sleeper, LongSupplier nanoClock) {
        Objects.requireNonNull(minInterval, "minInterval");
        if (minInterval.isNegative()) throw new IllegalArgumentException("minInterval must be >= 0");
        this.intervalNs = minInterval.toNanos();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public static RateLimiter unlimited() { return new RateLimiter(Duration.ZERO); }

    public Duration getMinInterval() { return Duration.ofNanos(intervalNs); }

    public synchronized void acquire() throws InterruptedException {
        long now = nanoClock.getAsLong();
        if (!first && intervalNs > 0) {
            long earliest = lastNs + intervalNs;
            long waitNs = earliest - now;
            if (waitNs > 0) {
                sleeper.sleep(Duration.ofNanos(waitNs));
                // 시계가 덜 흘렀어도(테스트 시계 등) 다음 기준점은 earliest 이후
                now = Math.max(nanoClock.getAsLong(), earliest);
            }
        }
        first = false;
        lastNs = now;
    }
}
