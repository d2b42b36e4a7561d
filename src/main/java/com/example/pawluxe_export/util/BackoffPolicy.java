package com.example.pawluxe_export.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delay: {@code base * 2^(retryCount - 1)}, capped at {@code max}. Jitter removes a
 * random share (at most {@code jitter}) of the capped delay, so the cap still holds.
 */
public final class BackoffPolicy {
    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Require 0 <= base <= max, got base=" + base + " max=" + max);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
        }
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static BackoffPolicy withoutJitter(Duration base, Duration max) {
        return new BackoffPolicy(base, max, 0.0, () -> 0.0);
    }

    /**
     * @param retryCount retry number after increment; {@code 1} for the first retry.
     * @return wait before the job becomes eligible again; zero for {@code retryCount <= 0}.
     */
    public Duration delay(int retryCount) {
        if (retryCount <= 0) {
            return Duration.ZERO;
        }
        Duration capped = exponential(retryCount);
        if (jitter == 0.0) {
            return capped;
        }
        double draw = Math.min(1.0, Math.max(0.0, random.getAsDouble()));
        long cut = (long) (capped.toMillis() * jitter * draw);
        return capped.minusMillis(cut);
    }

    public Instant nextRunAt(int retryCount, Instant now) {
        return now.plus(delay(retryCount));
    }

    private Duration exponential(int retryCount) {
        // 2^62 ms already exceeds any sane cap
        int shift = Math.min(retryCount - 1, 62);
        long factor = 1L << shift;
        long baseMs = base.toMillis();
        if (baseMs != 0 && factor > max.toMillis() / baseMs) {
            return max;
        }
        Duration raw = Duration.ofMillis(baseMs * factor);
        return raw.compareTo(max) > 0 ? max : raw;
    }
}
