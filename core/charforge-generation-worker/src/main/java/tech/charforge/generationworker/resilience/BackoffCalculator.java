package tech.charforge.generationworker.resilience;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 */
public final class BackoffCalculator {

    private BackoffCalculator() {
        // Utility class
    }

    /**
     * Delay before the retry that follows the given failed attempt.
     *
     * @param policy  retry policy
     * @param attempt 1-based number of the attempt that just failed
     */
    public static long delayMs(RetryPolicy policy, int attempt) {
        return delayMs(policy, attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Same as {@link #delayMs(RetryPolicy, int)} with a supplied random source in [0, 1).
     */
    public static long delayMs(RetryPolicy policy, int attempt, DoubleSupplier random) {
        int exponent = Math.max(0, attempt - 1);
        double multiplier = Math.max(1.0, policy.backoffMultiplier());
        double raw = policy.baseDelayMs() * Math.pow(multiplier, exponent);
        double capped = Math.min(raw, policy.maxDelayMs());

        double jitter = Math.max(0.0, policy.jitterFactor());
        // Spread uniformly across [capped - jitter*capped, capped + jitter*capped]
        double spread = capped * jitter * (2 * random.getAsDouble() - 1);
        long delay = Math.round(capped + spread);

        return Math.max(0, Math.min(delay, policy.maxDelayMs()));
    }
}
