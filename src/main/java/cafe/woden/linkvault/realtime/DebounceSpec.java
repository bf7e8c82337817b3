package cafe.woden.linkvault.realtime;

import cafe.woden.linkvault.config.LinkVaultProperties;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Coalescing window.
 *
 * <p>Events arriving less than {@code delayMs} apart are merged and the last one is delivered once
 * things go quiet (trailing edge). {@code maxWaitMs}, when positive, caps how long a burst may
 * postpone delivery. {@code leading} additionally delivers the first event of a burst at once.
 */
@ValueObject
public record DebounceSpec(long delayMs, long maxWaitMs, boolean leading, boolean trailing) {

  public DebounceSpec {
    if (delayMs < 0) delayMs = 0;
    if (maxWaitMs < 0) maxWaitMs = 0;
    if (maxWaitMs > 0 && maxWaitMs < delayMs) maxWaitMs = delayMs;
    if (!leading && !trailing) trailing = true;
  }

  public static DebounceSpec trailing(long delayMs) {
    return new DebounceSpec(delayMs, 0, false, true);
  }

  public static DebounceSpec from(LinkVaultProperties.Debounce d) {
    return new DebounceSpec(d.delayMs(), d.maxWaitMs(), d.leading(), d.trailing());
  }
}
