package cafe.woden.linkvault.realtime;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Timer-backed coalescing queue for one subscription.
 *
 * <p>Holds at most one pending item, the latest. A burst starts with the first offered item and
 * ends when the timer fires; the timer is pushed back by {@code delayMs} on every offer but never
 * past {@code burstStart + maxWaitMs}.
 *
 * <p>Not thread-safe. The owner calls it from one thread, and the timer runs on the owner's worker.
 */
final class CoalescingQueue<T> {

  private final DebounceSpec spec;
  private final Scheduler.Worker worker;
  private final Consumer<T> sink;
  private final Runnable onTimer;

  private T pending;
  private long burstStartMs = -1;
  private Disposable timer;
  private long coalesced;

  /**
   * @param onTimer runs on the worker when the timer fires; the owner calls {@link #flush()} from it
   *     while holding its own lock
   */
  CoalescingQueue(DebounceSpec spec, Scheduler.Worker worker, Consumer<T> sink, Runnable onTimer) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.onTimer = Objects.requireNonNull(onTimer, "onTimer");
  }

  void offer(T item) {
    long now = worker.now(TimeUnit.MILLISECONDS);
    if (burstStartMs < 0) {
      burstStartMs = now;
      if (spec.leading()) {
        sink.accept(item);
      } else {
        pending = item;
      }
    } else {
      if (pending != null) coalesced++;
      pending = item;
    }
    reschedule(now);
  }

  /** Drops the pending item and cancels the timer. */
  void cancel() {
    if (timer != null) {
      timer.dispose();
      timer = null;
    }
    pending = null;
    burstStartMs = -1;
  }

  boolean hasPending() {
    return pending != null;
  }

  long coalescedCount() {
    return coalesced;
  }

  /** Called by the owner when the timer fires. */
  void flush() {
    timer = null;
    T out = pending;
    pending = null;
    burstStartMs = -1;
    if (out != null && spec.trailing()) {
      sink.accept(out);
    }
  }

  private void reschedule(long now) {
    if (timer != null) timer.dispose();
    long fireAt = now + spec.delayMs();
    if (spec.maxWaitMs() > 0) {
      fireAt = Math.min(fireAt, burstStartMs + spec.maxWaitMs());
    }
    long wait = Math.max(0, fireAt - now);
    timer = worker.schedule(onTimer, wait, TimeUnit.MILLISECONDS);
  }
}
