package cafe.woden.linkvault.config;

import cafe.woden.linkvault.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>All timers and state transitions of the sync core run on one single-threaded event loop. The
 * loop is exposed as the only RxJava {@link Scheduler} bean, so components can take a plain
 * {@code Scheduler} constructor argument and tests can hand them a {@code TestScheduler}.
 */
@Configuration
public class ExecutorConfig {
  public static final String SYNC_EVENT_LOOP_EXECUTOR = "syncEventLoopExecutor";

  @Bean(name = SYNC_EVENT_LOOP_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService syncEventLoopExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("linkvault-sync");
  }

  @Bean
  public Scheduler syncScheduler(
      @Qualifier(SYNC_EVENT_LOOP_EXECUTOR) ScheduledExecutorService syncEventLoopExecutor) {
    return Schedulers.from(syncEventLoopExecutor);
  }
}
