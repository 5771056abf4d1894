package com.dataplatform.common.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#tryAcquire(String)}. A denial is routine control flow,
 * not an error: callers move on to the next candidate or wait {@code retryAfter}.
 *
 * @param deniedBy name of the bucket that refused admission; {@code null} when granted
 */
public record AdmissionResult(
    boolean  granted,
    Duration retryAfter,
    String   deniedBy
) {

    private static final AdmissionResult GRANTED = new AdmissionResult(true, Duration.ZERO, null);

    public static AdmissionResult grant() {
        return GRANTED;
    }

    public static AdmissionResult deny(Duration retryAfter, String deniedBy) {
        Duration wait = retryAfter == null || retryAfter.isNegative() || retryAfter.isZero()
            ? Duration.ofMillis(1) : retryAfter;
        return new AdmissionResult(false, wait, deniedBy);
    }
}
