package cafe.woden.linkvault.util;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Function;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The one retry-with-backoff implementation.
 *
 * <p>Session recovery, remote repository writes and anything else that re-attempts a fallible
 * operation plug their own {@link BackoffPolicy} in here instead of re-deriving the loop.
 */
public final class RetryWithBackoff {
  private static final Logger log = LoggerFactory.getLogger(RetryWithBackoff.class);

  private RetryWithBackoff() {}

  public static <T> Single<T> single(
      Single<T> operation, BackoffPolicy policy, Scheduler scheduler, Predicate<Throwable> retryable) {
    return operation.retryWhen(handler(policy, scheduler, retryable, "single"));
  }

  public static <T> Maybe<T> maybe(
      Maybe<T> operation, BackoffPolicy policy, Scheduler scheduler, Predicate<Throwable> retryable) {
    return operation.retryWhen(handler(policy, scheduler, retryable, "maybe"));
  }

  public static Completable completable(
      Completable operation, BackoffPolicy policy, Scheduler scheduler, Predicate<Throwable> retryable) {
    return operation.retryWhen(handler(policy, scheduler, retryable, "completable"));
  }

  /**
   * Builds a {@code retryWhen} handler. The attempt counter lives inside the handler, so every
   * subscription to the retried source gets its own budget.
   */
  public static Function<Flowable<Throwable>, Publisher<Long>> handler(
      BackoffPolicy policy, Scheduler scheduler, Predicate<Throwable> retryable, String label) {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(scheduler, "scheduler");
    Predicate<Throwable> shouldRetry = retryable == null ? err -> true : retryable;
    return errors -> {
      AtomicInteger retries = new AtomicInteger();
      return errors.concatMap(err -> {
        int retry = retries.incrementAndGet();
        if (!shouldRetry.test(err) || !policy.allowsRetry(retry)) {
          return Flowable.error(err);
        }
        long delayMs = policy.delayMs(retry);
        log.debug("[linkvault] Retrying {} ({}/{}) in {}ms after: {}",
            label, retry, policy.maxRetries(), delayMs, String.valueOf(err));
        return Flowable.timer(delayMs, TimeUnit.MILLISECONDS, scheduler);
      });
    };
  }
}
