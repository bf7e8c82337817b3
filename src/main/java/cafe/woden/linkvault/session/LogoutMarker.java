package cafe.woden.linkvault.session;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.storage.KeyValueStore;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Timestamp of the last explicit logout, kept in local storage so sibling processes see it too.
 *
 * <p>While inside the cooldown window, session recovery resolves to "no user" without asking the
 * backend. This stops a probe that began before the logout from resurrecting stale credentials.
 */
@Component
public class LogoutMarker {
  private static final Logger log = LoggerFactory.getLogger(LogoutMarker.class);

  public static final String KEY = "linkvault_logged_out";

  private final KeyValueStore store;
  private final Scheduler scheduler;
  private final long cooldownMs;

  public LogoutMarker(KeyValueStore store, Scheduler scheduler, LinkVaultProperties props) {
    this.store = store;
    this.scheduler = scheduler;
    this.cooldownMs = props.session().logoutCooldownMs();
  }

  public void mark() {
    store.put(KEY, Long.toString(now()));
  }

  public void clear() {
    store.remove(KEY);
  }

  public boolean withinCooldown() {
    Optional<Long> markedAt = markedAt();
    if (markedAt.isEmpty()) return false;
    long age = now() - markedAt.get();
    return age < cooldownMs;
  }

  public Optional<Long> markedAt() {
    Optional<String> raw = store.get(KEY);
    if (raw.isEmpty()) return Optional.empty();
    try {
      return Optional.of(Long.parseLong(raw.get().trim()));
    } catch (NumberFormatException e) {
      log.warn("[linkvault] Dropping unreadable logout marker '{}'", raw.get());
      store.remove(KEY);
      return Optional.empty();
    }
  }

  private long now() {
    return scheduler.now(TimeUnit.MILLISECONDS);
  }
}
