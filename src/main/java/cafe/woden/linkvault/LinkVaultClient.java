package cafe.woden.linkvault;

import cafe.woden.linkvault.auth.AuthCoordinator;
import cafe.woden.linkvault.auth.BroadcastSync;
import cafe.woden.linkvault.auth.SessionWatchdog;
import cafe.woden.linkvault.mode.ModeReconciler;
import cafe.woden.linkvault.session.SessionRecoveryService;
import cafe.woden.linkvault.session.SessionState;
import cafe.woden.linkvault.sync.RealtimeSyncBinder;
import io.reactivex.rxjava3.core.Single;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Startup order of one client context.
 *
 * <p>Listeners are attached before session recovery runs, so the first resolved state already
 * flows through mode reconciliation and realtime binding.
 */
@Component
public class LinkVaultClient {
  private static final Logger log = LoggerFactory.getLogger(LinkVaultClient.class);

  private final ModeReconciler reconciler;
  private final RealtimeSyncBinder realtimeBinder;
  private final AuthCoordinator auth;
  private final BroadcastSync broadcastSync;
  private final SessionWatchdog watchdog;
  private final SessionRecoveryService sessions;
  private final AtomicBoolean started = new AtomicBoolean();

  public LinkVaultClient(
      ModeReconciler reconciler,
      RealtimeSyncBinder realtimeBinder,
      AuthCoordinator auth,
      BroadcastSync broadcastSync,
      SessionWatchdog watchdog,
      SessionRecoveryService sessions
  ) {
    this.reconciler = reconciler;
    this.realtimeBinder = realtimeBinder;
    this.auth = auth;
    this.broadcastSync = broadcastSync;
    this.watchdog = watchdog;
    this.sessions = sessions;
  }

  /** Starts every component and kicks off session recovery. Later calls return the current state. */
  public Single<SessionState> start() {
    if (!started.compareAndSet(false, true)) {
      return Single.just(sessions.current());
    }
    log.info("[linkvault] Starting client context");
    reconciler.start();
    realtimeBinder.start();
    auth.bindAuthStateChanges();
    broadcastSync.start();
    watchdog.start();
    return sessions.recoverSession();
  }

  public boolean isStarted() {
    return started.get();
  }
}
