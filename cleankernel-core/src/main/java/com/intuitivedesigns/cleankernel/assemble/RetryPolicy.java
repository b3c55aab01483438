/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff for destination commits.
 *
 * @param maxAttempts total commit attempts per record, including the first
 * @param backoffBase wait before the second attempt; doubled for each further attempt
 * @param backoffMax upper bound for a single wait
 * @param commitTimeout upper bound handed to the sink for a single write
 */
public record RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffMax, Duration commitTimeout) {

    public RetryPolicy {
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(backoffMax, "backoffMax");
        Objects.requireNonNull(commitTimeout, "commitTimeout");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoffBase.isNegative()) throw new IllegalArgumentException("backoffBase must be >= 0");
        if (backoffMax.compareTo(backoffBase) < 0) throw new IllegalArgumentException("backoffMax must be >= backoffBase");
        if (commitTimeout.isZero() || commitTimeout.isNegative()) {
            throw new IllegalArgumentException("commitTimeout must be > 0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    /**
     * Wait after the given failed attempt (1-based): {@code base * 2^(attempt-1)}, capped.
     */
    public Duration backoffFor(int failedAttempt) {
        if (failedAttempt < 1) return Duration.ZERO;
        final long base = backoffBase.toMillis();
        final long max = backoffMax.toMillis();
        final int shift = Math.min(failedAttempt - 1, 30);
        try {
            return Duration.ofMillis(Math.min(Math.multiplyExact(base, 1L << shift), max));
        } catch (ArithmeticException overflow) {
            return Duration.ofMillis(max);
        }
    }
}
