package cafe.woden.linkvault.broadcast;

import static org.assertj.core.api.Assertions.assertThat;

import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InProcessBroadcastHubTest {

  @Test
  void endpointsSeeEachOtherButNotThemselves() {
    TestScheduler scheduler = new TestScheduler();
    InProcessBroadcastHub hub = new InProcessBroadcastHub();
    BroadcastChannel a = hub.join("a", scheduler);
    BroadcastChannel b = hub.join("b", scheduler);
    BroadcastChannel c = hub.join("c", scheduler);
    TestSubscriber<BroadcastMessage> atA = a.messages().test();
    TestSubscriber<BroadcastMessage> atB = b.messages().test();
    TestSubscriber<BroadcastMessage> atC = c.messages().test();

    c.close();
    a.publish(BroadcastType.LOGOUT, Map.of());
    scheduler.triggerActions();

    atA.assertNoValues();
    atB.assertValueCount(1);
    atC.assertNoValues();
    assertThat(atB.values().get(0).originId()).isEqualTo("a");
  }
}
