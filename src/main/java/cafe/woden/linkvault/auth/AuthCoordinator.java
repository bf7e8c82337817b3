package cafe.woden.linkvault.auth;

import cafe.woden.linkvault.app.UiPort;
import cafe.woden.linkvault.broadcast.BroadcastType;
import cafe.woden.linkvault.error.ErrorClassifier;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.session.AuthBackend;
import cafe.woden.linkvault.session.AuthStateChange;
import cafe.woden.linkvault.session.SessionNotice;
import cafe.woden.linkvault.session.SessionRecoveryService;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sign-in, sign-up and sign-out as seen from this client context. */
@Component
@ApplicationLayer
public class AuthCoordinator {
  private static final Logger log = LoggerFactory.getLogger(AuthCoordinator.class);

  private final AuthBackend backend;
  private final SessionRecoveryService sessions;
  private final BroadcastSync broadcast;
  private final UiPort ui;
  private final CompositeDisposable disposables = new CompositeDisposable();

  public AuthCoordinator(
      AuthBackend backend, SessionRecoveryService sessions, BroadcastSync broadcast, UiPort ui) {
    this.backend = backend;
    this.sessions = sessions;
    this.broadcast = broadcast;
    this.ui = ui;
  }

  public Single<AuthUser> signIn(String email, String password) {
    return Single.defer(() -> {
          sessions.clearLogoutMarker();
          return backend.signIn(email, password);
        })
        .doOnSuccess(this::signedIn)
        .onErrorResumeNext(err -> Single.error(
            ErrorClassifier.classify(err, "signIn", Map.of("email", String.valueOf(email)))));
  }

  public Single<AuthUser> signUp(String email, String password) {
    return Single.defer(() -> {
          sessions.clearLogoutMarker();
          return backend.signUp(email, password);
        })
        .doOnSuccess(this::signedIn)
        .onErrorResumeNext(err -> Single.error(
            ErrorClassifier.classify(err, "signUp", Map.of("email", String.valueOf(email)))));
  }

  /**
   * Signs out. Local state is cleared and other contexts are told before the backend call, so a
   * slow or failing network sign-out cannot leave this client looking signed in.
   */
  public Completable signOut() {
    return Completable.defer(() -> {
      sessions.markLoggedOut();
      sessions.resolveSignedOut(SessionNotice.of(SessionNotice.SIGNED_OUT, "Signed out"));
      broadcast.announce(BroadcastType.LOGOUT, "signed_out");
      ui.redirectToLogin("signed_out");
      return backend.signOut()
          .doOnError(err -> log.warn("[linkvault] Backend sign-out failed: {}", err.toString()))
          .onErrorResumeNext(err -> Completable.error(
              ErrorClassifier.classify(err, "signOut", Map.of())));
    });
  }

  /** Asks the backend who is signed in and adopts the answer. */
  public Single<Optional<AuthUser>> refreshUser() {
    return backend.getUser()
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .doOnSuccess(user -> {
          if (user.isPresent()) {
            sessions.resolveSignedIn(user.get());
          } else if (sessions.currentUser().isPresent()) {
            sessions.resolveSignedOut(SessionNotice.of(SessionNotice.SESSION_EXPIRED, "Session ended"));
          }
        })
        .onErrorResumeNext(err -> Single.error(ErrorClassifier.classify(err, "refreshUser", Map.of())));
  }

  /** Follows push notifications from the credential backend. */
  public synchronized void bindAuthStateChanges() {
    disposables.add(backend.authStateChanges().subscribe(this::onAuthStateChange,
        err -> log.warn("[linkvault] Auth state feed stopped: {}", err.toString())));
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
  }

  void onAuthStateChange(AuthStateChange change) {
    log.debug("[linkvault] Auth state change {}", change.event());
    switch (change.event()) {
      case SIGNED_IN:
      case TOKEN_REFRESHED:
      case USER_UPDATED:
        if (change.session().isEmpty()) return;
        if (sessions.isInLogoutCooldown()) {
          log.debug("[linkvault] Ignoring {} inside logout cooldown", change.event());
          return;
        }
        AuthUser user = change.session().get().user();
        if (!sessions.currentUser().equals(Optional.of(user))) {
          sessions.resolveSignedIn(user);
        }
        break;
      case SIGNED_OUT:
        if (sessions.currentUser().isPresent()) {
          sessions.resolveSignedOut(SessionNotice.of(SessionNotice.SIGNED_OUT, "Signed out"));
          ui.redirectToLogin("signed_out");
        }
        break;
      default:
        break;
    }
  }

  private void signedIn(AuthUser user) {
    sessions.resolveSignedIn(user);
    broadcast.announce(BroadcastType.AUTH_STATE_CHANGED, "signed_in");
  }
}
