package com.dataplatform.common.model;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Request budget of one provider.
 *
 * <ul>
 *   <li>{@code requests} per {@code window}: primary continuously-refilling token bucket.</li>
 *   <li>{@code burst} per {@code burstWindow}: secondary short-window bucket checked in series.
 *       A burst of {@code 0} or {@code >= requests} disables the secondary bucket.</li>
 *   <li>{@code dailyCap}: fixed budget that resets at {@code dailyResetTime} in {@code zone};
 *       {@code 0} means no daily cap.</li>
 * </ul>
 */
public record RateLimitSpec(
    int       requests,
    Duration  window,
    int       burst,
    Duration  burstWindow,
    int       dailyCap,
    LocalTime dailyResetTime,
    ZoneId    zone
) {

    public static final Duration DEFAULT_BURST_WINDOW = Duration.ofSeconds(10);

    public RateLimitSpec {
        if (requests <= 0) {
            throw new IllegalArgumentException("requests must be > 0");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (burst < 0 || dailyCap < 0) {
            throw new IllegalArgumentException("burst and dailyCap must be >= 0");
        }
        burstWindow    = burstWindow == null ? DEFAULT_BURST_WINDOW : burstWindow;
        dailyResetTime = dailyResetTime == null ? LocalTime.MIDNIGHT : dailyResetTime;
        zone           = zone == null ? ZoneOffset.UTC : zone;
    }

    public static RateLimitSpec of(int requests, Duration window, int burst) {
        return new RateLimitSpec(requests, window, burst, DEFAULT_BURST_WINDOW, 0, null, null);
    }

    public RateLimitSpec withDailyCap(int cap, LocalTime resetTime, ZoneId resetZone) {
        return new RateLimitSpec(requests, window, burst, burstWindow, cap, resetTime, resetZone);
    }

    public RateLimitSpec withBurstWindow(Duration newBurstWindow) {
        return new RateLimitSpec(requests, window, burst, newBurstWindow, dailyCap, dailyResetTime, zone);
    }

    public boolean hasBurstBucket() {
        return burst > 0 && burst < requests;
    }

    public boolean hasDailyCap() {
        return dailyCap > 0;
    }
}
