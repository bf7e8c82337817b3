package cafe.woden.linkvault.util;

import java.util.concurrent.ThreadLocalRandom;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Bounded exponential backoff.
 *
 * <p>The delay before retry number {@code n} (1-based) is {@code baseDelayMs * multiplier^(n-1)},
 * capped at {@code maxDelayMs}, optionally spread by {@code jitterPct}. {@code maxRetries} counts
 * retries after the first attempt, so a policy with {@code maxRetries == 0} never retries.
 */
@ValueObject
public record BackoffPolicy(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    double multiplier,
    double jitterPct
) {

  public BackoffPolicy {
    if (maxRetries < 0) maxRetries = 0;
    if (baseDelayMs < 0) baseDelayMs = 0;
    if (maxDelayMs < baseDelayMs) maxDelayMs = baseDelayMs;
    if (multiplier < 1.0) multiplier = 1.0;
    if (jitterPct < 0) jitterPct = 0;
    if (jitterPct > 0.75) jitterPct = 0.75;
  }

  public static BackoffPolicy fixed(int maxRetries, long delayMs) {
    return new BackoffPolicy(maxRetries, delayMs, delayMs, 1.0, 0);
  }

  public static BackoffPolicy exponential(int maxRetries, long baseDelayMs, long maxDelayMs) {
    return new BackoffPolicy(maxRetries, baseDelayMs, maxDelayMs, 2.0, 0);
  }

  public static BackoffPolicy none() {
    return fixed(0, 0);
  }

  /** Whether retry number {@code retry} (1-based) is still within the bound. */
  public boolean allowsRetry(int retry) {
    return retry >= 1 && retry <= maxRetries;
  }

  /** Delay before retry number {@code retry} (1-based). */
  public long delayMs(int retry) {
    double mult = Math.pow(multiplier, Math.max(0, retry - 1));
    double raw = baseDelayMs * mult;
    long capped = (long) Math.min(raw, (double) maxDelayMs);

    if (jitterPct <= 0) return capped;

    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitterPct, jitterPct);
    return (long) Math.max(0, capped * factor);
  }
}
