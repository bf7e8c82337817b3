package cafe.woden.linkvault.realtime;

import cafe.woden.linkvault.error.AuthenticationRequiredException;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A subscription slot whose config is computed lazily. An absent config keeps the slot inert
 * instead of subscribing to a degenerate resource.
 */
public final class ConditionalSubscription implements Disposable {
  private static final Logger log = LoggerFactory.getLogger(ConditionalSubscription.class);

  private final RealtimeSubscriptionManager manager;
  private final Supplier<Optional<SubscriptionConfig>> configSupplier;
  private final Consumer<ChangeEvent> callback;
  private final SubscribeOptions options;

  private SubscriptionConfig currentConfig;
  private String currentId;
  private boolean disposed;

  ConditionalSubscription(
      RealtimeSubscriptionManager manager,
      Supplier<Optional<SubscriptionConfig>> configSupplier,
      Consumer<ChangeEvent> callback,
      SubscribeOptions options) {
    this.manager = manager;
    this.configSupplier = Objects.requireNonNull(configSupplier, "configSupplier");
    this.callback = callback;
    this.options = options;
  }

  /** Re-evaluates the config, swapping the underlying subscription if it changed. */
  public synchronized void refresh() {
    if (disposed) return;
    Optional<SubscriptionConfig> next = configSupplier.get();
    if (next == null) next = Optional.empty();
    if (currentId != null
        && next.isPresent()
        && next.get().equals(currentConfig)
        && manager.stateOf(currentId).filter(s -> !s.isTerminal()).isPresent()) {
      return;
    }
    release();
    if (next.isEmpty()) return;
    try {
      currentId = manager.subscribe(next.get(), callback, options);
      currentConfig = next.get();
    } catch (AuthenticationRequiredException e) {
      log.debug("[linkvault] Conditional subscription on {} stays inert: {}",
          next.get().resource(), e.getMessage());
    }
  }

  public synchronized Optional<String> currentId() {
    return Optional.ofNullable(currentId);
  }

  public synchronized boolean isActive() {
    return currentId != null;
  }

  @Override
  public synchronized void dispose() {
    disposed = true;
    release();
  }

  @Override
  public synchronized boolean isDisposed() {
    return disposed;
  }

  private void release() {
    if (currentId != null) manager.unsubscribe(currentId);
    currentId = null;
    currentConfig = null;
  }
}
