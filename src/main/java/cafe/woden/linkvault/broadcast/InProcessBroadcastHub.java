package cafe.woden.linkvault.broadcast;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Connects several client contexts living in one JVM. */
public final class InProcessBroadcastHub {

  private static final InProcessBroadcastHub JVM_WIDE = new InProcessBroadcastHub();

  private final FlowableProcessor<BroadcastMessage> bus =
      PublishProcessor.<BroadcastMessage>create().toSerialized();

  public static InProcessBroadcastHub jvmWide() {
    return JVM_WIDE;
  }

  /**
   * An endpoint for one context. Its {@link BroadcastChannel#messages()} observes on
   * {@code scheduler}, so receivers handle messages on their own event loop.
   */
  public BroadcastChannel join(String contextId, Scheduler scheduler) {
    return new Endpoint(contextId, scheduler);
  }

  private final class Endpoint implements BroadcastChannel {
    private final String contextId;
    private final Scheduler scheduler;
    private final AtomicBoolean closed = new AtomicBoolean();

    Endpoint(String contextId, Scheduler scheduler) {
      this.contextId = Objects.requireNonNull(contextId, "contextId");
      this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public String contextId() {
      return contextId;
    }

    @Override
    public void publish(BroadcastType type, Map<String, String> payload) {
      if (closed.get()) return;
      bus.onNext(new BroadcastMessage(type, payload, contextId,
          Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS))));
    }

    @Override
    public Flowable<BroadcastMessage> messages() {
      return bus.onBackpressureBuffer()
          .filter(m -> !closed.get() && !contextId.equals(m.originId()))
          .observeOn(scheduler);
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
