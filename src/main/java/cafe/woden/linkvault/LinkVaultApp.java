package cafe.woden.linkvault;

import cafe.woden.linkvault.config.LinkVaultProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "LinkVault",
    sharedModules = {"config", "model", "error", "util"})
@EnableConfigurationProperties(LinkVaultProperties.class)
public class LinkVaultApp {
  private static final Logger log = LoggerFactory.getLogger(LinkVaultApp.class);

  public static void main(String[] args) {
    SpringApplication.run(LinkVaultApp.class, args);
  }

  @Bean
  public ApplicationRunner run(LinkVaultClient client) {
    return args -> client.start().subscribe(
        state -> log.info("[linkvault] Client ready: {}", state),
        err -> log.error("[linkvault] Client failed to start", err));
  }
}
