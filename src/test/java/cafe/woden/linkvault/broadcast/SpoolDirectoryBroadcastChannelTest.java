package cafe.woden.linkvault.broadcast;

import static org.assertj.core.api.Assertions.assertThat;

import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpoolDirectoryBroadcastChannelTest {

  @TempDir
  Path spool;

  private final TestScheduler scheduler = new TestScheduler();

  @Test
  void messageReachesSiblingButNotItsSender() {
    SpoolDirectoryBroadcastChannel a = channel("proc-a");
    SpoolDirectoryBroadcastChannel b = channel("proc-b");
    TestSubscriber<BroadcastMessage> atA = a.messages().test();
    TestSubscriber<BroadcastMessage> atB = b.messages().test();

    a.publish(BroadcastType.LOGOUT, Map.of("reason", "signed_out"));
    scheduler.advanceTimeBy(250, TimeUnit.MILLISECONDS);

    atA.assertNoValues();
    atB.assertValueCount(1);
    BroadcastMessage got = atB.values().get(0);
    assertThat(got.type()).isEqualTo(BroadcastType.LOGOUT);
    assertThat(got.originId()).isEqualTo("proc-a");
    assertThat(got.payload()).containsEntry("reason", "signed_out");

    scheduler.advanceTimeBy(250, TimeUnit.MILLISECONDS);
    atB.assertValueCount(1);
  }

  @Test
  void historyIsNotReplayedToNewChannels() {
    SpoolDirectoryBroadcastChannel a = channel("proc-a");
    a.publish(BroadcastType.SESSION_EXPIRED, Map.of());

    SpoolDirectoryBroadcastChannel late = channel("proc-late");
    TestSubscriber<BroadcastMessage> atLate = late.messages().test();
    scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

    atLate.assertNoValues();
  }

  @Test
  void oldFilesArePruned() throws IOException {
    SpoolDirectoryBroadcastChannel a = channel("proc-a");
    a.messages().test();
    a.publish(BroadcastType.AUTH_STATE_CHANGED, Map.of());
    assertThat(messageFiles()).isEqualTo(1);

    scheduler.advanceTimeBy(2, TimeUnit.SECONDS);

    assertThat(messageFiles()).isZero();
  }

  @Test
  void unreadableFileIsSkipped() throws IOException {
    SpoolDirectoryBroadcastChannel b = channel("proc-b");
    TestSubscriber<BroadcastMessage> atB = b.messages().test();
    Files.writeString(spool.resolve("0-garbage" + SpoolDirectoryBroadcastChannel.SUFFIX), "{oops");
    channel("proc-a").publish(BroadcastType.LOGOUT, Map.of());

    scheduler.advanceTimeBy(250, TimeUnit.MILLISECONDS);

    atB.assertValueCount(1);
  }

  @Test
  void closedChannelStopsPublishingAndPolling() {
    SpoolDirectoryBroadcastChannel a = channel("proc-a");
    SpoolDirectoryBroadcastChannel b = channel("proc-b");
    TestSubscriber<BroadcastMessage> atB = b.messages().test();

    b.close();
    a.publish(BroadcastType.LOGOUT, Map.of());
    scheduler.advanceTimeBy(500, TimeUnit.MILLISECONDS);

    atB.assertNoValues();
    atB.assertComplete();
  }

  private SpoolDirectoryBroadcastChannel channel(String id) {
    return new SpoolDirectoryBroadcastChannel(spool, id, scheduler, 250, 1_000);
  }

  private long messageFiles() throws IOException {
    try (Stream<Path> files = Files.list(spool)) {
      return files.filter(p -> p.toString().endsWith(SpoolDirectoryBroadcastChannel.SUFFIX)).count();
    }
  }
}
