package cafe.woden.linkvault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import cafe.woden.linkvault.app.UiPort;
import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.data.RemoteLinkRepository;
import cafe.woden.linkvault.data.StorageSource;
import cafe.woden.linkvault.loopback.LoopbackBackend;
import cafe.woden.linkvault.mode.Mode;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.storage.InMemoryKeyValueStore;
import cafe.woden.linkvault.util.BackoffPolicy;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GuestToAccountHandoffTest {

  private final TestScheduler scheduler = new TestScheduler();
  private final LoopbackBackend backend = new LoopbackBackend();
  private final InMemoryKeyValueStore storage = new InMemoryKeyValueStore();
  private TestClientContext ctx;

  @BeforeEach
  void start() {
    ctx = new TestClientContext("tab-1", backend, storage, null, scheduler, mock(UiPort.class),
        LinkVaultProperties.defaults());
    ctx.client.start().blockingGet();
    scheduler.triggerActions();
  }

  @Test
  void guestDataSurvivesSigningInAndComingBack() {
    ctx.reconciler.enterGuestMode();
    ctx.commands.addLink("https://one.example", "One", null).blockingGet();
    ctx.commands.addLink("https://two.example", "Two", null).blockingGet();
    ctx.commands.addLink("https://three.example", "Three", null).blockingGet();
    assertThat(ctx.store.activeLinks()).hasSize(3);

    ctx.auth.signUp("carol@example.com", "s3cret!").blockingGet();
    scheduler.triggerActions();

    assertThat(ctx.reconciler.current().mode()).isEqualTo(Mode.AUTHENTICATED);
    assertThat(ctx.reconciler.activeRepository().source()).isEqualTo(StorageSource.REMOTE);
    assertThat(ctx.store.activeLinks()).isEmpty();
    assertThat(ctx.guestSessions.isActive()).isFalse();
    assertThat(ctx.guestSessions.hasGuestData()).isTrue();

    ctx.reconciler.enterGuestMode();

    assertThat(ctx.reconciler.current().mode()).isEqualTo(Mode.GUEST);
    assertThat(ctx.store.activeLinks())
        .extracting(Link::title)
        .containsExactlyInAnyOrder("One", "Two", "Three");
  }

  @Test
  void accountLinksStayRemoteAndGuestStaysLocal() {
    ctx.auth.signUp("dan@example.com", "s3cret!").blockingGet();
    scheduler.triggerActions();
    ctx.commands.addLink("https://remote.example", "Remote", null).blockingGet();

    ctx.reconciler.enterGuestMode();
    assertThat(ctx.store.activeLinks()).isEmpty();

    ctx.reconciler.leaveGuestMode();
    assertThat(ctx.reconciler.current().mode()).isEqualTo(Mode.AUTHENTICATED);
    assertThat(ctx.store.activeLinks()).extracting(Link::title).containsExactly("Remote");
  }

  @Test
  void signingOutClearsTheMirror() {
    ctx.auth.signUp("erin@example.com", "s3cret!").blockingGet();
    scheduler.triggerActions();
    ctx.commands.addLink("https://remote.example", "Remote", null).blockingGet();

    ctx.auth.signOut().blockingAwait();

    assertThat(ctx.reconciler.current().mode()).isEqualTo(Mode.SIGNED_OUT);
    assertThat(ctx.store.snapshot().links()).isEmpty();
  }

  @Test
  void persistedGuestSessionIsRestoredOnStartup() {
    ctx.reconciler.enterGuestMode();
    ctx.commands.addLink("https://kept.example", "Kept", null).blockingGet();

    TestClientContext restarted = new TestClientContext("tab-1b", backend, storage, null, scheduler,
        mock(UiPort.class), LinkVaultProperties.defaults());
    restarted.client.start().blockingGet();

    assertThat(restarted.reconciler.current().mode()).isEqualTo(Mode.GUEST);
    assertThat(restarted.store.activeLinks()).extracting(Link::title).containsExactly("Kept");
  }

  @Test
  void realtimeChangesFromAnotherWriterReachTheMirror() {
    ctx.auth.signUp("fay@example.com", "s3cret!").blockingGet();
    scheduler.triggerActions();
    assertThat(ctx.realtimeBinder.isBound()).isTrue();

    String userId = ctx.sessions.currentUser().orElseThrow().id();
    new RemoteLinkRepository(backend, userId, BackoffPolicy.none(), scheduler)
        .addLink(Link.of("elsewhere", "https://other.example", "Other", null, Instant.EPOCH))
        .blockingGet();
    assertThat(ctx.store.link("elsewhere")).isEmpty();

    scheduler.advanceTimeBy(ctx.props.realtime().defaultDebounce().delayMs(), TimeUnit.MILLISECONDS);

    assertThat(ctx.store.link("elsewhere")).isPresent();
  }
}
