package cafe.woden.linkvault.auth;

import cafe.woden.linkvault.app.UiPort;
import cafe.woden.linkvault.broadcast.BroadcastChannel;
import cafe.woden.linkvault.broadcast.BroadcastMessage;
import cafe.woden.linkvault.broadcast.BroadcastType;
import cafe.woden.linkvault.session.SessionNotice;
import cafe.woden.linkvault.session.SessionRecoveryService;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Fans local auth events out to sibling contexts and reacts to theirs.
 *
 * <p>A received {@code LOGOUT} or {@code SESSION_EXPIRED} clears the local user, redirects, and then
 * re-runs session recovery so this context derives its own state instead of trusting the message.
 * Without a broadcast channel this class does nothing.
 */
@Component
public class BroadcastSync {
  private static final Logger log = LoggerFactory.getLogger(BroadcastSync.class);

  private final Optional<BroadcastChannel> channel;
  private final SessionRecoveryService sessions;
  private final UiPort ui;

  private Disposable listener;

  public BroadcastSync(
      ObjectProvider<BroadcastChannel> channel, SessionRecoveryService sessions, UiPort ui) {
    this.channel = Optional.ofNullable(channel.getIfAvailable());
    this.sessions = sessions;
    this.ui = ui;
  }

  public boolean isAvailable() {
    return channel.isPresent();
  }

  public synchronized void start() {
    if (listener != null || channel.isEmpty()) {
      if (channel.isEmpty()) log.info("[linkvault] No broadcast channel; running single-context");
      return;
    }
    listener = channel.get().messages().subscribe(this::onMessage,
        err -> log.warn("[linkvault] Broadcast listener stopped: {}", err.toString()));
  }

  /** Best effort; never throws. */
  public void announce(BroadcastType type, String reason) {
    if (channel.isEmpty()) return;
    try {
      channel.get().publish(type, reason == null ? Map.of() : Map.of("reason", reason));
    } catch (RuntimeException e) {
      log.warn("[linkvault] Broadcasting {} failed: {}", type, e.toString());
    }
  }

  @PreDestroy
  public synchronized void stop() {
    Disposable d = listener;
    listener = null;
    if (d == null) return;
    try {
      d.dispose();
    } catch (RuntimeException e) {
      log.warn("[linkvault] Broadcast listener teardown failed", e);
    }
  }

  private void onMessage(BroadcastMessage msg) {
    log.debug("[linkvault] Broadcast {} from {}", msg.type(), msg.originId());
    switch (msg.type()) {
      case LOGOUT:
      case SESSION_EXPIRED:
        boolean expired = msg.type() == BroadcastType.SESSION_EXPIRED;
        sessions.resolveSignedOut(SessionNotice.of(
            expired ? SessionNotice.SESSION_EXPIRED : SessionNotice.REMOTE_LOGOUT,
            expired ? "Your session expired" : "Signed out in another window"));
        ui.redirectToLogin(expired ? "expired" : "signed_out");
        sessions.recoverSession().subscribe(
            s -> log.debug("[linkvault] Re-derived session after {}: {}", msg.type(), s),
            err -> log.warn("[linkvault] Re-deriving session failed: {}", err.toString()));
        break;
      case AUTH_STATE_CHANGED:
        sessions.recoverSession().subscribe(
            s -> log.debug("[linkvault] Re-derived session after auth change: {}", s),
            err -> log.warn("[linkvault] Re-deriving session failed: {}", err.toString()));
        break;
      default:
        break;
    }
  }
}
