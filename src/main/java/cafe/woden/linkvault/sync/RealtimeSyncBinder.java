package cafe.woden.linkvault.sync;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.config.LinkVaultProperties.SyncStrategy;
import cafe.woden.linkvault.data.LinkRepository;
import cafe.woden.linkvault.error.LinkVaultException;
import cafe.woden.linkvault.mode.Mode;
import cafe.woden.linkvault.mode.ModeReconciler;
import cafe.woden.linkvault.mode.ModeState;
import cafe.woden.linkvault.model.Resources;
import cafe.woden.linkvault.realtime.ChangeEvent;
import cafe.woden.linkvault.realtime.DebounceSpec;
import cafe.woden.linkvault.realtime.RealtimeSubscriptionManager;
import cafe.woden.linkvault.realtime.SubscribeOptions;
import cafe.woden.linkvault.realtime.SubscriptionBatch;
import cafe.woden.linkvault.realtime.SubscriptionConfig;
import cafe.woden.linkvault.store.ChangeEventNormalizer;
import cafe.woden.linkvault.store.LinkVaultStore;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the mirror live while authenticated by subscribing to the user's folder and link feeds.
 *
 * <p>With {@code APPLY_EVENTS} each change is applied as it arrives. With {@code REFETCH} changes
 * are coalesced per table and the table is re-read from the repository, which also heals anything
 * a dropped event would have missed.
 */
@Component
public class RealtimeSyncBinder {
  private static final Logger log = LoggerFactory.getLogger(RealtimeSyncBinder.class);

  private final ModeReconciler reconciler;
  private final RealtimeSubscriptionManager subscriptions;
  private final LinkVaultStore store;
  private final ChangeEventNormalizer normalizer;
  private final SyncStrategy strategy;
  private final DebounceSpec refetchDebounce;

  private final CompositeDisposable disposables = new CompositeDisposable();
  private SubscriptionBatch batch;
  private boolean started;

  public RealtimeSyncBinder(
      ModeReconciler reconciler,
      RealtimeSubscriptionManager subscriptions,
      LinkVaultStore store,
      ChangeEventNormalizer normalizer,
      LinkVaultProperties props
  ) {
    this.reconciler = reconciler;
    this.subscriptions = subscriptions;
    this.store = store;
    this.normalizer = normalizer;
    this.strategy = props.realtime().strategy();
    this.refetchDebounce = DebounceSpec.from(props.realtime().defaultDebounce());
  }

  public synchronized void start() {
    if (started) return;
    started = true;
    disposables.add(reconciler.states()
        .subscribe(this::rebind, err -> log.error("[linkvault] Realtime binder stopped", err)));
  }

  public synchronized boolean isBound() {
    return batch != null && !batch.isDisposed();
  }

  public synchronized Optional<SubscriptionBatch> currentBatch() {
    return Optional.ofNullable(batch);
  }

  @PreDestroy
  synchronized void stop() {
    disposables.dispose();
    release();
  }

  private synchronized void rebind(ModeState state) {
    release();
    if (state.mode() != Mode.AUTHENTICATED || state.userId().isEmpty()) return;

    String filter = "user_id=eq." + state.userId().get();
    List<SubscriptionConfig> configs = List.of(
        SubscriptionConfig.of(Resources.FOLDERS, filter),
        SubscriptionConfig.of(Resources.LINKS, filter));
    SubscribeOptions options = strategy == SyncStrategy.APPLY_EVENTS
        ? subscriptions.defaultOptions()
        : subscriptions.defaultOptions().withDebounce(refetchDebounce);
    try {
      batch = subscriptions.subscribeAll(configs, event -> onEvent(state, event), options);
      log.debug("[linkvault] Realtime bound for {} ({})", state.userId().get(), strategy);
    } catch (LinkVaultException e) {
      log.warn("[linkvault] Could not bind realtime feeds: {}", e.getMessage());
    }
  }

  private void onEvent(ModeState boundTo, ChangeEvent event) {
    if (reconciler.current().generation() != boundTo.generation()) return;
    if (strategy == SyncStrategy.APPLY_EVENTS) {
      normalizer.normalize(event).ifPresent(store::apply);
      return;
    }
    refetch(boundTo, event.resource()).subscribe(
        () -> log.debug("[linkvault] Refetched {}", event.resource()),
        err -> log.warn("[linkvault] Refetch of {} failed: {}", event.resource(), err.toString()));
  }

  private Completable refetch(ModeState boundTo, String resource) {
    LinkRepository repo;
    try {
      repo = reconciler.activeRepository();
    } catch (LinkVaultException e) {
      return Completable.complete();
    }
    if (Resources.FOLDERS.equals(resource)) {
      return repo.listFolders().flatMapCompletable(folders -> Completable.fromAction(() -> {
        if (reconciler.current().generation() == boundTo.generation()) store.replaceFolders(folders);
      }));
    }
    return repo.listLinksIncludingDeleted().flatMapCompletable(links -> Completable.fromAction(() -> {
      if (reconciler.current().generation() == boundTo.generation()) store.replaceLinks(links);
    }));
  }

  private void release() {
    if (batch != null) {
      batch.dispose();
      batch = null;
    }
  }
}
