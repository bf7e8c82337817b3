package cafe.woden.linkvault.auth;

import cafe.woden.linkvault.app.UiPort;
import cafe.woden.linkvault.broadcast.BroadcastType;
import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.session.SessionNotice;
import cafe.woden.linkvault.session.SessionRecoveryService;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Periodically checks that a signed-in session is still accepted by the backend. */
@Component
public class SessionWatchdog {
  private static final Logger log = LoggerFactory.getLogger(SessionWatchdog.class);

  private final SessionRecoveryService sessions;
  private final BroadcastSync broadcast;
  private final UiPort ui;
  private final Scheduler scheduler;
  private final long periodMs;

  private Disposable ticker;

  public SessionWatchdog(
      SessionRecoveryService sessions,
      BroadcastSync broadcast,
      UiPort ui,
      Scheduler scheduler,
      LinkVaultProperties props
  ) {
    this.sessions = sessions;
    this.broadcast = broadcast;
    this.ui = ui;
    this.scheduler = scheduler;
    this.periodMs = props.session().validationPeriodMs();
  }

  public synchronized void start() {
    if (ticker != null && !ticker.isDisposed()) return;
    ticker = Flowable.interval(periodMs, periodMs, TimeUnit.MILLISECONDS, scheduler)
        .onBackpressureDrop()
        .filter(tick -> sessions.currentUser().isPresent())
        .concatMapSingle(tick -> sessions.validateSession())
        .filter(valid -> !valid)
        .subscribe(invalid -> onExpired(),
            err -> log.error("[linkvault] Session watchdog stopped", err));
  }

  @PreDestroy
  public synchronized void stop() {
    if (ticker != null) {
      ticker.dispose();
      ticker = null;
    }
  }

  private void onExpired() {
    if (sessions.currentUser().isEmpty()) return;
    log.info("[linkvault] Session is no longer valid");
    sessions.resolveSignedOut(SessionNotice.of(SessionNotice.SESSION_EXPIRED, "Your session expired"));
    broadcast.announce(BroadcastType.SESSION_EXPIRED, "expired");
    ui.redirectToLogin("expired");
  }
}
