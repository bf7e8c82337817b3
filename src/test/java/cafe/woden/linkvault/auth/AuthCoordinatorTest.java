package cafe.woden.linkvault.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.linkvault.app.UiPort;
import cafe.woden.linkvault.broadcast.BroadcastChannel;
import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.error.TransientBackendException;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.session.AuthBackend;
import cafe.woden.linkvault.session.AuthStateChange;
import cafe.woden.linkvault.session.BackendSession;
import cafe.woden.linkvault.session.LogoutMarker;
import cafe.woden.linkvault.session.SessionRecoveryService;
import cafe.woden.linkvault.storage.InMemoryKeyValueStore;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class AuthCoordinatorTest {

  private static final AuthUser KIM = new AuthUser("u-kim", "kim@example.com");

  private final TestScheduler scheduler = new TestScheduler();
  private final LinkVaultProperties props = LinkVaultProperties.defaults();
  private final AuthBackend backend = mock(AuthBackend.class);
  private final UiPort ui = mock(UiPort.class);
  private final SessionRecoveryService sessions = new SessionRecoveryService(
      backend, new LogoutMarker(new InMemoryKeyValueStore(), scheduler, props), scheduler, props);
  private final BroadcastSync broadcast = new BroadcastSync(
      new StaticListableBeanFactory().getBeanProvider(BroadcastChannel.class), sessions, ui);
  private final AuthCoordinator auth = new AuthCoordinator(backend, sessions, broadcast, ui);

  @Test
  void signInResolvesTheSessionAndClearsAnOldLogout() {
    sessions.markLoggedOut();
    when(backend.signIn("kim@example.com", "pw123456")).thenReturn(Single.just(KIM));

    auth.signIn("kim@example.com", "pw123456").blockingGet();

    assertThat(sessions.currentUser()).contains(KIM);
    assertThat(sessions.isInLogoutCooldown()).isFalse();
  }

  @Test
  void rejectedCredentialsSurfaceAsAuthenticationError() {
    when(backend.signIn("kim@example.com", "nope")).thenReturn(
        Single.error(new AuthenticationRequiredException("Invalid email or password")));

    auth.signIn("kim@example.com", "nope").test().assertError(AuthenticationRequiredException.class);
    assertThat(sessions.currentUser()).isEmpty();
  }

  @Test
  void failedBackendSignOutStillSignsOutLocally() {
    sessions.resolveSignedIn(KIM);
    when(backend.signOut()).thenReturn(Completable.error(new TransientBackendException("offline")));

    auth.signOut().test().assertError(TransientBackendException.class);

    assertThat(sessions.currentUser()).isEmpty();
    assertThat(sessions.isInLogoutCooldown()).isTrue();
    verify(ui).redirectToLogin("signed_out");
  }

  @Test
  void pushedSignInIsIgnoredDuringLogoutCooldown() {
    sessions.markLoggedOut();

    auth.onAuthStateChange(AuthStateChange.of(
        AuthStateChange.Event.TOKEN_REFRESHED, new BackendSession(KIM, null)));

    assertThat(sessions.currentUser()).isEmpty();
  }

  @Test
  void pushedSignOutRedirects() {
    sessions.resolveSignedIn(KIM);

    auth.onAuthStateChange(AuthStateChange.of(AuthStateChange.Event.SIGNED_OUT, null));

    assertThat(sessions.currentUser()).isEmpty();
    verify(ui).redirectToLogin("signed_out");
  }
}
