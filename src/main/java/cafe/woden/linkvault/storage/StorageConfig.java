package cafe.woden.linkvault.storage;

import cafe.woden.linkvault.config.LinkVaultProperties;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {
  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  public KeyValueStore localKeyValueStore(LinkVaultProperties props) {
    LinkVaultProperties.Storage storage = props.storage();
    if (storage.inMemory()) {
      log.info("[linkvault] No local store file configured; guest data will not survive a restart");
      return new InMemoryKeyValueStore();
    }
    log.info("[linkvault] Local store: {}", storage.file());
    return new YamlKeyValueStore(Paths.get(storage.file()));
  }
}
