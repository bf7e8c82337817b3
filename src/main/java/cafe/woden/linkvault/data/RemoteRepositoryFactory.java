package cafe.woden.linkvault.data;

import cafe.woden.linkvault.config.LinkVaultProperties;
import io.reactivex.rxjava3.core.Scheduler;
import org.springframework.stereotype.Component;

/** Builds the remote repository for whichever user is signed in. */
@Component
public class RemoteRepositoryFactory {

  private final RemoteDataBackend backend;
  private final Scheduler scheduler;
  private final LinkVaultProperties.Backend settings;

  public RemoteRepositoryFactory(RemoteDataBackend backend, Scheduler scheduler, LinkVaultProperties props) {
    this.backend = backend;
    this.scheduler = scheduler;
    this.settings = props.backend();
  }

  public RemoteLinkRepository forUser(String userId) {
    return new RemoteLinkRepository(backend, userId, settings.retry().toPolicy(), scheduler);
  }
}
