package cafe.woden.linkvault.app;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class UiConfig {

  @Bean
  @ConditionalOnMissingBean(UiPort.class)
  public UiPort loggingUiPort() {
    return new LoggingUiPort();
  }
}
