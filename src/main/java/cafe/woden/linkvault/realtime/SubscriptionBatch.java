package cafe.woden.linkvault.realtime;

import io.reactivex.rxjava3.disposables.Disposable;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** Several subscriptions sharing one callback, torn down together. */
public final class SubscriptionBatch implements Disposable {

  private final RealtimeSubscriptionManager manager;
  private final List<String> ids;
  private final AtomicBoolean disposed = new AtomicBoolean();

  SubscriptionBatch(RealtimeSubscriptionManager manager, List<String> ids) {
    this.manager = manager;
    this.ids = List.copyOf(ids);
  }

  public List<String> ids() {
    return ids;
  }

  public void pause() {
    ids.forEach(manager::pauseSubscription);
  }

  public void resume() {
    ids.forEach(manager::resumeSubscription);
  }

  @Override
  public void dispose() {
    if (disposed.compareAndSet(false, true)) {
      ids.forEach(manager::unsubscribe);
    }
  }

  @Override
  public boolean isDisposed() {
    return disposed.get();
  }
}
