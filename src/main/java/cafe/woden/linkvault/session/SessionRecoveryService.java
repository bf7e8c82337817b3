package cafe.woden.linkvault.session;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.error.ErrorClassifier;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.util.BackoffPolicy;
import cafe.woden.linkvault.util.RetryWithBackoff;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the session state machine of this client context.
 *
 * <p>{@link #recoverSession()} is single-flight: while one run is in progress every caller gets the
 * same cached result, so there is exactly one round of backend attempts. Runs always end in a
 * {@link SessionState.Ready}; failures and the hard timeout become {@code Ready(none)} with a
 * notice instead of an error.
 *
 * <p>Explicit transitions ({@link #resolveSignedIn}, {@link #resolveSignedOut}) bump an epoch. A
 * recovery run that started under an older epoch does not overwrite their result.
 */
@Component
@ApplicationLayer
public class SessionRecoveryService implements SessionStatePort {
  private static final Logger log = LoggerFactory.getLogger(SessionRecoveryService.class);

  private final AuthBackend backend;
  private final LogoutMarker logoutMarker;
  private final Scheduler scheduler;
  private final BackoffPolicy primaryRetry;
  private final long initTimeoutMs;

  private final BehaviorProcessor<SessionState> states =
      BehaviorProcessor.createDefault(new SessionState.Unknown());
  private final CompositeDisposable runs = new CompositeDisposable();
  private final Object lock = new Object();

  private Single<SessionState> inFlight;
  private Object inFlightToken;
  private long epoch;

  public SessionRecoveryService(
      AuthBackend backend,
      LogoutMarker logoutMarker,
      Scheduler scheduler,
      LinkVaultProperties props
  ) {
    this.backend = backend;
    this.logoutMarker = logoutMarker;
    this.scheduler = scheduler;
    this.primaryRetry = props.session().primaryRetryPolicy();
    this.initTimeoutMs = props.session().initTimeoutMs();
  }

  @Override
  public SessionState current() {
    SessionState s = states.getValue();
    return s == null ? new SessionState.Unknown() : s;
  }

  @Override
  public Flowable<SessionState> states() {
    return states.onBackpressureLatest().distinctUntilChanged();
  }

  public boolean isSessionReady() {
    return current().isReady();
  }

  /** Resolves the session, joining the run already in progress if there is one. */
  public Single<SessionState> recoverSession() {
    synchronized (lock) {
      if (inFlight != null) {
        log.debug("[linkvault] Session recovery already running; joining it");
        return inFlight;
      }
      final Object token = new Object();
      final long startedEpoch = epoch;
      Single<SessionState> run = resolve(startedEpoch)
          .map(outcome -> settle(token, startedEpoch, outcome))
          .cache();
      inFlight = run;
      inFlightToken = token;
      runs.add(run.subscribe(
          s -> log.debug("[linkvault] Session recovery finished: {}", s),
          err -> log.error("[linkvault] Session recovery ended abnormally", err)));
      return run;
    }
  }

  /**
   * Lightweight expiry probe. Emits {@code false} only when the backend says there is no usable
   * session; inconclusive failures (network) keep the current answer and emit {@code true}.
   */
  public Single<Boolean> validateSession() {
    return Maybe.defer(backend::getSession)
        .map(s -> !s.expiredAt(Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS))))
        .defaultIfEmpty(false)
        .onErrorReturn(err -> {
          if (ErrorClassifier.isAuthentication(err)) return false;
          log.warn("[linkvault] Session validation was inconclusive: {}", err.toString());
          return true;
        });
  }

  /** Marks an explicit logout. Call before the network sign-out so concurrent recovery sees it. */
  public void markLoggedOut() {
    logoutMarker.mark();
    log.debug("[linkvault] Logout marker set");
  }

  public void clearLogoutMarker() {
    logoutMarker.clear();
  }

  public boolean isInLogoutCooldown() {
    return logoutMarker.withinCooldown();
  }

  public void resolveSignedIn(AuthUser user) {
    synchronized (lock) {
      epoch++;
      publish(SessionState.Ready.signedIn(user));
    }
  }

  public void resolveSignedOut(SessionNotice reason) {
    synchronized (lock) {
      epoch++;
      publish(SessionState.Ready.signedOut(reason));
    }
  }

  @PreDestroy
  void shutdown() {
    runs.dispose();
    states.onComplete();
  }

  private Single<SessionState> resolve(long startedEpoch) {
    return Single.defer(() -> {
      if (logoutMarker.withinCooldown()) {
        log.debug("[linkvault] Inside logout cooldown; skipping backend session probe");
        return Single.just(SessionState.Ready.signedOut());
      }
      AtomicInteger attempt = new AtomicInteger();
      Maybe<AuthUser> primary = Maybe.defer(() -> {
        int n = attempt.incrementAndGet();
        publishTransient(startedEpoch, new SessionState.Recovering(n));
        return backend.getSession().flatMap(session -> backend.getUser());
      });
      Maybe<AuthUser> fallback = Maybe.defer(backend::getUser)
          .onErrorResumeNext(err -> {
            log.warn("[linkvault] Fallback session lookup failed: {}", err.toString());
            return Maybe.empty();
          });

      SessionState.Ready timedOut = SessionState.Ready.signedOut(SessionNotice.of(
          SessionNotice.INIT_TIMEOUT, "Session check took too long; continuing signed out"));

      return RetryWithBackoff.maybe(primary, primaryRetry, scheduler,
              err -> !ErrorClassifier.isAuthentication(err))
          .onErrorResumeNext(err -> {
            log.warn("[linkvault] Session lookup failed after {} attempt(s): {}",
                attempt.get(), err.toString());
            return Maybe.empty();
          })
          .switchIfEmpty(fallback)
          .map(user -> (SessionState) SessionState.Ready.signedIn(user))
          .defaultIfEmpty(SessionState.Ready.signedOut())
          .timeout(initTimeoutMs, TimeUnit.MILLISECONDS, scheduler, Single.fromCallable(() -> {
            log.warn("[linkvault] Session recovery exceeded {}ms", initTimeoutMs);
            return timedOut;
          }))
          .onErrorReturn(err -> {
            log.error("[linkvault] Unexpected session recovery failure", err);
            return SessionState.Ready.signedOut(
                SessionNotice.of(SessionNotice.RECOVERY_FAILED, String.valueOf(err.getMessage())));
          });
    });
  }

  private SessionState settle(Object token, long startedEpoch, SessionState outcome) {
    synchronized (lock) {
      if (inFlightToken == token) {
        inFlight = null;
        inFlightToken = null;
      }
      if (startedEpoch != epoch) {
        log.debug("[linkvault] Discarding stale recovery result {}", outcome);
        SessionState now = current();
        if (now.isReady()) return now;
        publish(outcome);
        return outcome;
      }
      SessionState resolved = outcome;
      if (outcome.user().isPresent() && logoutMarker.withinCooldown()) {
        log.debug("[linkvault] Logout happened during recovery; resolving signed out");
        resolved = SessionState.Ready.signedOut();
      }
      publish(resolved);
      return resolved;
    }
  }

  /** Progress from a run superseded by an explicit transition is not published. */
  private void publishTransient(long startedEpoch, SessionState state) {
    synchronized (lock) {
      if (startedEpoch != epoch) return;
      publish(state);
    }
  }

  private void publish(SessionState next) {
    SessionState prev = current();
    states.onNext(next);
    if (next.isReady() && !prev.equals(next)) {
      log.info("[linkvault] Session {} -> {}", describe(prev), describe(next));
    } else {
      log.debug("[linkvault] Session {} -> {}", describe(prev), describe(next));
    }
  }

  private static String describe(SessionState s) {
    if (s instanceof SessionState.Ready r) {
      return r.user().map(u -> "Ready(" + u.id() + ")").orElse("Ready(none)");
    }
    return s.toString();
  }
}
