package cafe.woden.linkvault.session;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.storage.InMemoryKeyValueStore;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LogoutMarkerTest {

  private final TestScheduler scheduler = new TestScheduler();
  private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
  private final LogoutMarker marker =
      new LogoutMarker(store, scheduler, LinkVaultProperties.defaults());

  @Test
  void markIsVisibleThroughTheSharedStore() {
    scheduler.advanceTimeBy(1_000, TimeUnit.MILLISECONDS);
    marker.mark();

    LogoutMarker sibling = new LogoutMarker(store, scheduler, LinkVaultProperties.defaults());
    assertThat(sibling.withinCooldown()).isTrue();
    assertThat(sibling.markedAt()).contains(1_000L);
  }

  @Test
  void clearEndsTheCooldown() {
    marker.mark();
    marker.clear();

    assertThat(marker.withinCooldown()).isFalse();
    assertThat(store.get(LogoutMarker.KEY)).isEmpty();
  }

  @Test
  void garbageValueIsDropped() {
    store.put(LogoutMarker.KEY, "yesterday");

    assertThat(marker.withinCooldown()).isFalse();
    assertThat(store.keys()).doesNotContain(LogoutMarker.KEY);
  }
}
