package cafe.woden.linkvault.config;

import cafe.woden.linkvault.util.BackoffPolicy;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * LinkVault client configuration.
 *
 * <p>Every nested record clamps its own values, so a partially specified YAML block still yields a
 * usable policy.
 */
@ConfigurationProperties(prefix = "linkvault")
public record LinkVaultProperties(
    Session session,
    Realtime realtime,
    Hierarchy hierarchy,
    Storage storage,
    Broadcast broadcast,
    Backend backend
) {

  public LinkVaultProperties {
    if (session == null) session = new Session(0, 0, 0, 0, 0);
    if (realtime == null) realtime = new Realtime(null, null, null);
    if (hierarchy == null) hierarchy = new Hierarchy(0);
    if (storage == null) storage = new Storage(null);
    if (broadcast == null) broadcast = new Broadcast(null, null, 0, 0);
    if (backend == null) backend = new Backend(null, 0, null);
  }

  public static LinkVaultProperties defaults() {
    return new LinkVaultProperties(null, null, null, null, null, null);
  }

  /**
   * Session recovery timing.
   *
   * <p>Example YAML:
   * <pre>
   * linkvault:
   *   session:
   *     logout-cooldown-ms: 5000
   *     primary-attempts: 2
   * </pre>
   */
  public record Session(
      long logoutCooldownMs,
      int primaryAttempts,
      long retryDelayMs,
      long initTimeoutMs,
      long validationPeriodMs
  ) {
    public Session {
      if (logoutCooldownMs <= 0) logoutCooldownMs = 5_000;
      if (primaryAttempts <= 0) primaryAttempts = 2;
      if (primaryAttempts > 5) primaryAttempts = 5;
      if (retryDelayMs <= 0) retryDelayMs = 500;
      if (initTimeoutMs <= 0) initTimeoutMs = 8_000;
      if (validationPeriodMs <= 0) validationPeriodMs = 120_000;
    }

    /** Retry policy for the primary recovery strategy: fixed delay, attempts minus one retries. */
    public BackoffPolicy primaryRetryPolicy() {
      return BackoffPolicy.fixed(primaryAttempts - 1, retryDelayMs);
    }
  }

  public enum SyncStrategy {
    /** Apply every change event to the local mirror as it arrives. */
    APPLY_EVENTS,
    /** Coalesce change events and re-read the affected table from the repository. */
    REFETCH
  }

  public record Realtime(Reconnect reconnect, Debounce defaultDebounce, SyncStrategy strategy) {
    public Realtime {
      if (reconnect == null) reconnect = new Reconnect(3, 1_000, 30_000, 2.0, 0);
      if (defaultDebounce == null) defaultDebounce = new Debounce(300, 1_000, false, true);
      if (strategy == null) strategy = SyncStrategy.REFETCH;
    }
  }

  public record Reconnect(
      int maxRetries,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct
  ) {
    public Reconnect {
      if (maxRetries <= 0) maxRetries = 3;
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 30_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.0) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
    }

    public BackoffPolicy toPolicy() {
      return new BackoffPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitterPct);
    }
  }

  public record Debounce(long delayMs, long maxWaitMs, boolean leading, boolean trailing) {
    public Debounce {
      if (delayMs < 0) delayMs = 0;
      if (maxWaitMs < 0) maxWaitMs = 0;
      if (maxWaitMs > 0 && maxWaitMs < delayMs) maxWaitMs = delayMs;
    }
  }

  public record Hierarchy(int maxSubFolders) {
    public Hierarchy {
      if (maxSubFolders <= 0) maxSubFolders = 10;
    }
  }

  /**
   * Local persistent storage.
   *
   * <p>A blank {@code file} keeps everything in memory (useful for throwaway sessions and tests).
   */
  public record Storage(String file) {
    public Storage {
      file = Objects.toString(file, "").trim();
    }

    public boolean inMemory() {
      return file.isEmpty();
    }
  }

  public enum BroadcastMode {
    SPOOL,
    IN_PROCESS,
    DISABLED
  }

  public record Broadcast(BroadcastMode mode, String spoolDirectory, long pollPeriodMs, long retentionMs) {
    public Broadcast {
      if (mode == null) mode = BroadcastMode.SPOOL;
      spoolDirectory = Objects.toString(spoolDirectory, "").trim();
      if (spoolDirectory.isEmpty()) {
        spoolDirectory = System.getProperty("user.home") + "/.config/linkvault/broadcast";
      }
      if (pollPeriodMs <= 0) pollPeriodMs = 250;
      if (retentionMs <= 0) retentionMs = 60_000;
      if (retentionMs < pollPeriodMs * 4) retentionMs = pollPeriodMs * 4;
    }
  }

  public enum BackendMode {
    LOOPBACK,
    EXTERNAL
  }

  /**
   * Remote backend settings.
   *
   * <p>{@code EXTERNAL} expects the embedding application to contribute the backend beans.
   */
  public record Backend(BackendMode mode, long mutationTimeoutMs, Reconnect retry) {
    public Backend {
      if (mode == null) mode = BackendMode.LOOPBACK;
      if (mutationTimeoutMs <= 0) mutationTimeoutMs = 10_000;
      if (retry == null) retry = new Reconnect(2, 250, 2_000, 2.0, 0);
    }
  }
}
