package cafe.woden.linkvault.realtime;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.error.ErrorClassifier;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.session.SessionState;
import cafe.woden.linkvault.session.SessionStatePort;
import cafe.woden.linkvault.util.BackoffPolicy;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of live change feeds for this client context.
 *
 * <p>Each subscription owns one {@link Scheduler.Worker}: transport callbacks are marshalled onto
 * it, so events are handled in arrival order per subscription, and its debounce and reconnect
 * timers die with it on unsubscribe. The manager validates and forwards events; it never touches
 * application data.
 *
 * <p>Subscribing requires a signed-in user. When the session ends (or switches user) every
 * subscription is torn down.
 */
@Component
@ApplicationLayer
public class RealtimeSubscriptionManager {
  private static final Logger log = LoggerFactory.getLogger(RealtimeSubscriptionManager.class);

  private final ChangeFeedTransport transport;
  private final SessionStatePort session;
  private final Scheduler scheduler;
  private final SubscribeOptions defaultOptions;

  private final Map<String, ManagedSubscription> subscriptions = new ConcurrentHashMap<>();
  private final FlowableProcessor<SubscriptionStateChange> stateChanges =
      PublishProcessor.<SubscriptionStateChange>create().toSerialized();
  private final CompositeDisposable disposables = new CompositeDisposable();
  private final AtomicLong seq = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong coalesced = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  public RealtimeSubscriptionManager(
      ChangeFeedTransport transport,
      SessionStatePort session,
      Scheduler scheduler,
      LinkVaultProperties props
  ) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.session = Objects.requireNonNull(session, "session");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    LinkVaultProperties.Realtime rt = props.realtime();
    this.defaultOptions = SubscribeOptions.immediate(rt.reconnect().toPolicy());
  }

  /** Tears every subscription down once the signed-in user goes away or changes. */
  @PostConstruct
  public void bindSessionLifecycle() {
    AtomicReference<String> lastUser = new AtomicReference<>();
    disposables.add(session.states()
        .filter(SessionState::isReady)
        .subscribe(s -> {
          String now = s.user().map(AuthUser::id).orElse(null);
          String before = lastUser.getAndSet(now);
          if (before != null && !before.equals(now) && !subscriptions.isEmpty()) {
            log.info("[linkvault] Session for {} ended; closing {} subscription(s)",
                before, subscriptions.size());
            unsubscribeAll();
          }
        }, err -> log.error("[linkvault] Session lifecycle watcher failed", err)));
  }

  /** No debounce and the configured reconnect policy. */
  public SubscribeOptions defaultOptions() {
    return defaultOptions;
  }

  public String subscribe(SubscriptionConfig config, Consumer<ChangeEvent> callback) {
    return subscribe(config, callback, defaultOptions);
  }

  /**
   * Opens a feed and returns its id.
   *
   * @throws AuthenticationRequiredException when no user is signed in
   */
  public String subscribe(
      SubscriptionConfig config, Consumer<ChangeEvent> callback, SubscribeOptions options) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(callback, "callback");
    if (session.currentUser().isEmpty()) {
      throw new AuthenticationRequiredException(
          "Realtime subscriptions need a signed-in session", Map.of("resource", config.resource()), null);
    }
    SubscribeOptions opts = options == null ? defaultOptions : options;
    if (opts.reconnect() == null) opts = opts.withReconnect(defaultOptions.reconnect());

    String id = "sub_" + config.key() + "#" + seq.incrementAndGet();
    ManagedSubscription sub = new ManagedSubscription(id, config, callback, opts);
    subscriptions.put(id, sub);
    log.debug("[linkvault] Subscribing {} (debounce={})", id, opts.debounce().orElse(null));
    try {
      sub.open(true);
    } catch (RuntimeException e) {
      subscriptions.remove(id);
      sub.close();
      throw e;
    }
    return id;
  }

  /**
   * Subscribes every config with a shared callback. Either all members are opened or none are.
   */
  public SubscriptionBatch subscribeAll(
      List<SubscriptionConfig> configs, Consumer<ChangeEvent> callback, SubscribeOptions options) {
    List<String> ids = new ArrayList<>();
    try {
      for (SubscriptionConfig c : configs) {
        ids.add(subscribe(c, callback, options));
      }
    } catch (RuntimeException e) {
      ids.forEach(this::unsubscribe);
      throw e;
    }
    return new SubscriptionBatch(this, ids);
  }

  /**
   * A slot whose config is computed on demand. While the supplier yields nothing the slot stays
   * inert; call {@link ConditionalSubscription#refresh()} when its inputs change.
   */
  public ConditionalSubscription subscribeWhen(
      Supplier<Optional<SubscriptionConfig>> config,
      Consumer<ChangeEvent> callback,
      SubscribeOptions options) {
    ConditionalSubscription slot = new ConditionalSubscription(this, config, callback, options);
    slot.refresh();
    return slot;
  }

  public boolean pauseSubscription(String id) {
    ManagedSubscription sub = id == null ? null : subscriptions.get(id);
    return sub != null && sub.pause();
  }

  public boolean resumeSubscription(String id) {
    ManagedSubscription sub = id == null ? null : subscriptions.get(id);
    return sub != null && sub.resume();
  }

  /** Releases the feed and every timer. Returns false when the id is not (or no longer) known. */
  public boolean unsubscribe(String id) {
    ManagedSubscription sub = id == null ? null : subscriptions.remove(id);
    if (sub == null) return false;
    sub.close();
    return true;
  }

  public void unsubscribeAll() {
    for (String id : List.copyOf(subscriptions.keySet())) {
      unsubscribe(id);
    }
  }

  public Optional<SubscriptionState> stateOf(String id) {
    ManagedSubscription sub = id == null ? null : subscriptions.get(id);
    return sub == null ? Optional.empty() : Optional.of(sub.state());
  }

  public Flowable<SubscriptionStateChange> stateChanges() {
    return stateChanges.onBackpressureBuffer();
  }

  public SubscriptionStatistics statistics() {
    Map<SubscriptionState, Integer> byState = new EnumMap<>(SubscriptionState.class);
    Map<String, Integer> byResource = new LinkedHashMap<>();
    List<ManagedSubscription> all = List.copyOf(subscriptions.values());
    for (ManagedSubscription sub : all) {
      byState.merge(sub.state(), 1, Integer::sum);
      byResource.merge(sub.config.resource(), 1, Integer::sum);
    }
    return new SubscriptionStatistics(all.size(), Map.copyOf(byState), Map.copyOf(byResource),
        delivered.get(), coalesced.get(), dropped.get());
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
    unsubscribeAll();
    stateChanges.onComplete();
  }

  private enum Phase { OPEN, RETRYING, FAILED, CLOSED }

  private final class ManagedSubscription implements FeedListener {
    private final String id;
    private final SubscriptionConfig config;
    private final Consumer<ChangeEvent> callback;
    private final BackoffPolicy reconnect;
    private final Scheduler.Worker worker;
    private final CoalescingQueue<ChangeEvent> queue;

    private Phase phase = Phase.OPEN;
    private boolean paused;
    private int retries;
    private FeedHandle handle;
    private Disposable reconnectTimer;

    ManagedSubscription(
        String id, SubscriptionConfig config, Consumer<ChangeEvent> callback, SubscribeOptions opts) {
      this.id = id;
      this.config = config;
      this.callback = callback;
      this.reconnect = opts.reconnect();
      this.worker = scheduler.createWorker();
      DebounceSpec spec = opts.debounce().filter(d -> d.delayMs() > 0).orElse(null);
      this.queue = spec == null ? null : new CoalescingQueue<>(spec, worker, this::deliver, this::onTimer);
    }

    synchronized SubscriptionState state() {
      switch (phase) {
        case CLOSED:
          return SubscriptionState.CLOSED;
        case FAILED:
          return SubscriptionState.FAILED;
        case RETRYING:
          return SubscriptionState.RETRYING;
        default:
          return paused ? SubscriptionState.PAUSED : SubscriptionState.ACTIVE;
      }
    }

    /**
     * Transient failures are handled like a later drop, so the same bounded reconnect applies.
     * Anything else is rethrown on the first open and fails the subscription on a reconnect.
     */
    synchronized void open(boolean initial) {
      if (phase == Phase.CLOSED || phase == Phase.FAILED) return;
      try {
        handle = transport.open(config, this);
        phase = Phase.OPEN;
      } catch (RuntimeException e) {
        handle = null;
        if (!ErrorClassifier.isTransient(e)) {
          if (initial) throw e;
          phase = Phase.FAILED;
          if (queue != null) queue.cancel();
          log.error("[linkvault] Feed {} cannot be reopened", id, e);
          publishState(e);
          return;
        }
        log.warn("[linkvault] Opening feed {} failed: {}", id, e.toString());
        worker.schedule(() -> connectionLost(e));
      }
    }

    @Override
    public void onRecord(FeedRecord record) {
      worker.schedule(() -> receive(record));
    }

    @Override
    public void onConnected() {
      worker.schedule(() -> log.debug("[linkvault] Feed {} connected", id));
    }

    @Override
    public void onConnectionLost(Throwable cause) {
      worker.schedule(() -> connectionLost(cause));
    }

    synchronized boolean pause() {
      if (phase == Phase.CLOSED || phase == Phase.FAILED || paused) return false;
      paused = true;
      if (queue != null) queue.cancel();
      publishState(null);
      return true;
    }

    synchronized boolean resume() {
      if (phase == Phase.CLOSED || phase == Phase.FAILED || !paused) return false;
      paused = false;
      publishState(null);
      return true;
    }

    synchronized void close() {
      if (phase == Phase.CLOSED) return;
      phase = Phase.CLOSED;
      if (queue != null) queue.cancel();
      if (reconnectTimer != null) reconnectTimer.dispose();
      closeHandle();
      worker.dispose();
      publishState(null);
      log.debug("[linkvault] Unsubscribed {}", id);
    }

    private synchronized void receive(FeedRecord record) {
      if (phase == Phase.CLOSED || phase == Phase.FAILED) return;
      ChangeEvent event = normalize(record);
      if (event == null) return;
      if (paused) {
        dropped.incrementAndGet();
        return;
      }
      if (queue == null) {
        deliver(event);
        return;
      }
      long before = queue.coalescedCount();
      queue.offer(event);
      coalesced.addAndGet(queue.coalescedCount() - before);
    }

    private synchronized void onTimer() {
      if (phase == Phase.CLOSED || queue == null) return;
      queue.flush();
    }

    // Runs with the monitor held, on the worker.
    private void deliver(ChangeEvent event) {
      if (phase == Phase.CLOSED || phase == Phase.FAILED || paused) return;
      retries = 0;
      try {
        callback.accept(event);
        delivered.incrementAndGet();
      } catch (RuntimeException e) {
        log.error("[linkvault] Subscriber of {} threw while handling {} on {}",
            id, event.type(), event.resource(), e);
      }
    }

    private synchronized void connectionLost(Throwable cause) {
      if (phase == Phase.CLOSED || phase == Phase.FAILED) return;
      closeHandle();
      retries++;
      if (!reconnect.allowsRetry(retries)) {
        phase = Phase.FAILED;
        if (queue != null) queue.cancel();
        log.error("[linkvault] Feed {} failed after {} reconnect attempt(s): {}",
            id, retries - 1, String.valueOf(cause));
        publishState(cause);
        return;
      }
      long delayMs = reconnect.delayMs(retries);
      phase = Phase.RETRYING;
      log.warn("[linkvault] Feed {} dropped ({}); reconnect {}/{} in {}ms",
          id, String.valueOf(cause), retries, reconnect.maxRetries(), delayMs);
      publishState(cause);
      reconnectTimer = worker.schedule(this::reconnect, delayMs, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
      reconnectTimer = null;
      if (phase != Phase.RETRYING) return;
      open(false);
      if (phase == Phase.OPEN) publishState(null);
    }

    private void closeHandle() {
      FeedHandle h = handle;
      handle = null;
      if (h == null) return;
      try {
        h.close();
      } catch (RuntimeException e) {
        log.debug("[linkvault] Closing feed {} failed", id, e);
      }
    }

    private void publishState(Throwable cause) {
      stateChanges.onNext(new SubscriptionStateChange(id, config, state(), Optional.ofNullable(cause)));
    }

    private ChangeEvent normalize(FeedRecord record) {
      if (record == null) {
        return drop("null record");
      }
      Optional<ChangeType> type = ChangeType.parse(record.eventType());
      if (type.isEmpty()) {
        return drop("unknown event type " + record.eventType());
      }
      if (!config.event().accepts(type.get())) {
        return null;
      }
      Map<String, Object> row = type.get() == ChangeType.DELETE ? record.before() : record.after();
      if (row == null || row.get("id") == null) {
        return drop(type.get() + " without a row id");
      }
      return new ChangeEvent(config.resource(), type.get(), copy(record.before()), copy(record.after()),
          Instant.ofEpochMilli(worker.now(TimeUnit.MILLISECONDS)));
    }

    private ChangeEvent drop(String why) {
      dropped.incrementAndGet();
      log.warn("[linkvault] Dropping malformed change on {}: {}", id, why);
      return null;
    }

    private Map<String, Object> copy(Map<String, Object> row) {
      if (row == null) return Map.of();
      // Map.copyOf rejects null values, which rows legitimately carry.
      return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }
  }
}
