package cafe.woden.linkvault.session;

import cafe.woden.linkvault.model.AuthUser;
import io.reactivex.rxjava3.core.Flowable;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Read side of session state for consumers that must not drive transitions. */
@ApplicationLayer
public interface SessionStatePort {

  SessionState current();

  /** Replays the current state, then every transition. */
  Flowable<SessionState> states();

  default Optional<AuthUser> currentUser() {
    return current().user();
  }
}
