package relay.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between reconnect attempts.
 *
 * <p>Delay formula: {@code initial * 2^(failures-1)}, capped at {@code max}. No jitter;
 * each client reconnects on its own schedule.
 */
public final class ReconnectBackoff {
  public static final Duration DEFAULT_INITIAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

  private final long initialMs;
  private final long maxMs;

  public ReconnectBackoff() {
    this(DEFAULT_INITIAL, DEFAULT_MAX);
  }

  /**
   * @param initial delay after the first failure
   * @param max     delay cap
   */
  public ReconnectBackoff(Duration initial, Duration max) {
    Objects.requireNonNull(initial, "initial");
    Objects.requireNonNull(max, "max");
    if (initial.isZero() || initial.isNegative()) {
      throw new IllegalArgumentException("initial must be > 0, got: " + initial);
    }
    if (max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("max must be >= initial, got: " + max);
    }
    this.initialMs = initial.toMillis();
    this.maxMs = max.toMillis();
  }

  /**
   * Computes the delay before the next attempt.
   *
   * @param failures consecutive failures so far (1-based)
   * @return delay in milliseconds, {@code 0} when {@code failures <= 0}
   */
  public long computeDelayMs(int failures) {
    if (failures <= 0) {
      return 0L;
    }
    if (failures >= 31) {
      return maxMs;
    }
    long shift = 1L << (failures - 1);
    // shift * initialMs would overflow past this point
    if (shift > maxMs / initialMs) {
      return maxMs;
    }
    return Math.min(maxMs, initialMs * shift);
  }
}
