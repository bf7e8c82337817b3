package cafe.woden.linkvault.broadcast;

import cafe.woden.linkvault.config.LinkVaultProperties;
import io.reactivex.rxjava3.core.Scheduler;
import java.nio.file.Paths;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the broadcast transport. With {@code linkvault.broadcast.mode=disabled} no channel bean
 * exists and consumers run single-context.
 */
@Configuration
public class BroadcastConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "linkvault.broadcast", name = "mode", havingValue = "spool", matchIfMissing = true)
  public BroadcastChannel spoolBroadcastChannel(LinkVaultProperties props, Scheduler scheduler) {
    LinkVaultProperties.Broadcast b = props.broadcast();
    return new SpoolDirectoryBroadcastChannel(
        Paths.get(b.spoolDirectory()), newContextId(), scheduler, b.pollPeriodMs(), b.retentionMs());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "linkvault.broadcast", name = "mode", havingValue = "in_process")
  public BroadcastChannel inProcessBroadcastChannel(Scheduler scheduler) {
    return InProcessBroadcastHub.jvmWide().join(newContextId(), scheduler);
  }

  private static String newContextId() {
    return "ctx-" + UUID.randomUUID();
  }
}
