package cafe.woden.linkvault.data;

import cafe.woden.linkvault.model.RowCodec;
import cafe.woden.linkvault.storage.KeyValueStore;
import io.reactivex.rxjava3.core.Scheduler;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Guest-mode flag and timestamps in local storage.
 *
 * <p>Deactivating keeps the guest's data; only {@link #clearAllGuestData()} removes it.
 */
@Component
public class GuestSessionStore {
  private static final Logger log = LoggerFactory.getLogger(GuestSessionStore.class);

  static final String SESSION_KEY = "linkvault_guest_session";
  static final String LINKS_KEY = "linkvault_guest_links";
  static final String FOLDERS_KEY = "linkvault_guest_folders";

  private final KeyValueStore store;
  private final Scheduler scheduler;
  private final RowCodec codec = new RowCodec();

  public GuestSessionStore(KeyValueStore store, Scheduler scheduler) {
    this.store = store;
    this.scheduler = scheduler;
  }

  public synchronized Optional<GuestSession> current() {
    Optional<String> raw = store.get(SESSION_KEY);
    if (raw.isEmpty()) return Optional.empty();
    try {
      return Optional.of(codec.readJson(raw.get(), GuestSession.class));
    } catch (IllegalArgumentException e) {
      log.warn("[linkvault] Guest session record is unreadable; treating guest mode as inactive", e);
      return Optional.empty();
    }
  }

  public boolean isActive() {
    return current().map(GuestSession::active).orElse(false);
  }

  /** Turns guest mode on, creating empty collections the first time. */
  public synchronized GuestSession activate() {
    Instant now = now();
    Instant since = current().filter(GuestSession::active).map(GuestSession::activatedAt).orElse(now);
    GuestSession s = new GuestSession(true, since, now);
    store.put(SESSION_KEY, codec.toJson(s));
    if (store.get(LINKS_KEY).isEmpty()) store.put(LINKS_KEY, "[]");
    if (store.get(FOLDERS_KEY).isEmpty()) store.put(FOLDERS_KEY, "[]");
    log.info("[linkvault] Guest mode activated");
    return s;
  }

  /** Turns guest mode off. Guest links and folders stay where they are. */
  public synchronized void deactivate() {
    Optional<GuestSession> cur = current();
    if (cur.isEmpty() || !cur.get().active()) return;
    store.put(SESSION_KEY, codec.toJson(new GuestSession(false, cur.get().activatedAt(), now())));
    log.info("[linkvault] Guest mode deactivated; guest data kept");
  }

  public synchronized void touch() {
    current().filter(GuestSession::active).ifPresent(s ->
        store.put(SESSION_KEY, codec.toJson(new GuestSession(true, s.activatedAt(), now()))));
  }

  /** Whether any guest links or folders exist, active or not. */
  public boolean hasGuestData() {
    return store.get(LINKS_KEY).map(v -> !v.isBlank() && !v.trim().equals("[]")).orElse(false)
        || store.get(FOLDERS_KEY).map(v -> !v.isBlank() && !v.trim().equals("[]")).orElse(false);
  }

  public synchronized void clearAllGuestData() {
    store.remove(SESSION_KEY);
    store.remove(LINKS_KEY);
    store.remove(FOLDERS_KEY);
    log.info("[linkvault] Guest data cleared");
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }
}
