package cafe.woden.linkvault.loopback;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory backend unless {@code linkvault.backend.mode=external}, in which case the
 * embedding application provides the backend beans.
 */
@Configuration
@ConditionalOnProperty(prefix = "linkvault.backend", name = "mode", havingValue = "loopback", matchIfMissing = true)
public class LoopbackConfig {

  @Bean
  public LoopbackBackend loopbackBackend() {
    return new LoopbackBackend();
  }
}
