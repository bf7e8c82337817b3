package cafe.woden.linkvault.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.error.TransientBackendException;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.storage.InMemoryKeyValueStore;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subjects.MaybeSubject;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SessionRecoveryServiceTest {

  private static final AuthUser ALICE = new AuthUser("u-alice", "alice@example.com");

  private final TestScheduler scheduler = new TestScheduler();
  private final LinkVaultProperties props = LinkVaultProperties.defaults();
  private final AuthBackend backend = mock(AuthBackend.class);
  private final LogoutMarker marker =
      new LogoutMarker(new InMemoryKeyValueStore(), scheduler, props);
  private final SessionRecoveryService service =
      new SessionRecoveryService(backend, marker, scheduler, props);

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  @Test
  void concurrentCallersShareOneRecoveryRound() {
    MaybeSubject<BackendSession> pending = MaybeSubject.create();
    when(backend.getSession()).thenReturn(pending);
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));

    Single<SessionState> first = service.recoverSession();
    Single<SessionState> second = service.recoverSession();

    assertThat(second).isSameAs(first);
    assertThat(service.current()).isEqualTo(new SessionState.Recovering(1));

    pending.onSuccess(new BackendSession(ALICE, null));

    assertThat(first.blockingGet()).isEqualTo(SessionState.Ready.signedIn(ALICE));
    assertThat(second.blockingGet()).isEqualTo(SessionState.Ready.signedIn(ALICE));
    verify(backend, times(1)).getSession();
    assertThat(service.isSessionReady()).isTrue();
  }

  @Test
  void finishedRoundAllowsAFreshOne() {
    when(backend.getSession()).thenReturn(Maybe.just(new BackendSession(ALICE, null)));
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));

    Single<SessionState> first = service.recoverSession();
    first.blockingGet();
    Single<SessionState> second = service.recoverSession();

    assertThat(second).isNotSameAs(first);
    verify(backend, times(2)).getSession();
  }

  @Test
  void logoutCooldownSkipsTheBackendEntirely() {
    service.markLoggedOut();

    SessionState state = service.recoverSession().blockingGet();

    assertThat(state).isEqualTo(SessionState.Ready.signedOut());
    verify(backend, never()).getSession();
    verify(backend, never()).getUser();
  }

  @Test
  void cooldownExpiresAfterConfiguredWindow() {
    when(backend.getSession()).thenReturn(Maybe.just(new BackendSession(ALICE, null)));
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));
    service.markLoggedOut();

    scheduler.advanceTimeBy(props.session().logoutCooldownMs(), TimeUnit.MILLISECONDS);

    assertThat(service.isInLogoutCooldown()).isFalse();
    assertThat(service.recoverSession().blockingGet().user()).contains(ALICE);
  }

  @Test
  void primaryFailuresAreRetriedThenFallBackToUserLookup() {
    AtomicInteger calls = new AtomicInteger();
    when(backend.getSession()).thenReturn(Maybe.defer(() -> {
      calls.incrementAndGet();
      return Maybe.error(new TransientBackendException("flaky"));
    }));
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));

    TestObserver<SessionState> result = service.recoverSession().test();
    result.assertNotComplete();

    scheduler.advanceTimeBy(props.session().retryDelayMs(), TimeUnit.MILLISECONDS);

    result.assertValue(SessionState.Ready.signedIn(ALICE));
    assertThat(calls.get()).isEqualTo(props.session().primaryAttempts());
  }

  @Test
  void authenticationErrorIsNotRetried() {
    when(backend.getSession()).thenReturn(
        Maybe.error(new AuthenticationRequiredException("token revoked")));
    when(backend.getUser()).thenReturn(Maybe.empty());

    SessionState state = service.recoverSession().blockingGet();

    assertThat(state).isEqualTo(SessionState.Ready.signedOut());
    verify(backend, times(1)).getSession();
  }

  @Test
  void hardTimeoutResolvesSignedOutWithNotice() {
    when(backend.getSession()).thenReturn(Maybe.never());
    when(backend.getUser()).thenReturn(Maybe.never());

    TestObserver<SessionState> result = service.recoverSession().test();
    scheduler.advanceTimeBy(props.session().initTimeoutMs(), TimeUnit.MILLISECONDS);

    result.assertValueCount(1);
    SessionState.Ready ready = (SessionState.Ready) result.values().get(0);
    assertThat(ready.user()).isEmpty();
    assertThat(ready.notice()).map(SessionNotice::code).contains(SessionNotice.INIT_TIMEOUT);
  }

  @Test
  void logoutDuringRecoveryWinsOverLateSuccess() {
    MaybeSubject<BackendSession> pending = MaybeSubject.create();
    when(backend.getSession()).thenReturn(pending);
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));

    Single<SessionState> run = service.recoverSession();
    service.markLoggedOut();
    pending.onSuccess(new BackendSession(ALICE, null));

    assertThat(run.blockingGet()).isEqualTo(SessionState.Ready.signedOut());
  }

  @Test
  void explicitTransitionDiscardsStaleRecovery() {
    MaybeSubject<BackendSession> pending = MaybeSubject.create();
    when(backend.getSession()).thenReturn(pending);
    when(backend.getUser()).thenReturn(Maybe.just(ALICE));

    Single<SessionState> run = service.recoverSession();
    service.resolveSignedOut(SessionNotice.of(SessionNotice.REMOTE_LOGOUT, "elsewhere"));
    pending.onSuccess(new BackendSession(ALICE, null));

    SessionState settled = run.blockingGet();
    assertThat(settled.user()).isEmpty();
    assertThat(service.current().user()).isEmpty();
  }

  @Test
  void signInDuringRetryDelayIsNotOverwrittenByLaterAttempts() {
    when(backend.getSession()).thenReturn(Maybe.error(new TransientBackendException("flaky")));
    when(backend.getUser()).thenReturn(Maybe.error(new TransientBackendException("flaky")));

    TestObserver<SessionState> run = service.recoverSession().test();
    assertThat(service.current()).isEqualTo(new SessionState.Recovering(1));

    service.resolveSignedIn(ALICE);
    scheduler.advanceTimeBy(16, TimeUnit.SECONDS);

    run.assertValue(SessionState.Ready.signedIn(ALICE));
    assertThat(service.current()).isEqualTo(SessionState.Ready.signedIn(ALICE));
    assertThat(service.isSessionReady()).isTrue();
  }

  @Test
  void statesStreamNeverShowsReadyWithoutAnAnswer() {
    when(backend.getSession()).thenReturn(Maybe.empty());
    when(backend.getUser()).thenReturn(Maybe.empty());
    TestSubscriber<SessionState> states = service.states().test();

    service.recoverSession().blockingGet();

    assertThat(states.values()).first().isEqualTo(new SessionState.Unknown());
    assertThat(states.values()).last().isEqualTo(SessionState.Ready.signedOut());
    assertThat(states.values()).filteredOn(SessionState::isReady).hasSize(1);
  }

  @Test
  void validateSessionSeparatesExpiryFromNetworkTrouble() {
    when(backend.getSession()).thenReturn(
        Maybe.just(new BackendSession(ALICE, Instant.ofEpochMilli(0))));
    assertThat(service.validateSession().blockingGet()).isFalse();

    when(backend.getSession()).thenReturn(Maybe.empty());
    assertThat(service.validateSession().blockingGet()).isFalse();

    when(backend.getSession()).thenReturn(Maybe.error(new TransientBackendException("offline")));
    assertThat(service.validateSession().blockingGet()).isTrue();

    when(backend.getSession()).thenReturn(
        Maybe.just(new BackendSession(ALICE, Instant.ofEpochMilli(60_000))));
    assertThat(service.validateSession().blockingGet()).isTrue();
  }
}
