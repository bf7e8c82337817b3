package cafe.woden.linkvault.session;

import cafe.woden.linkvault.model.AuthUser;
import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Credential set held by the backend. {@code expiresAt} may be null when the backend doesn't say. */
@ValueObject
public record BackendSession(AuthUser user, Instant expiresAt) {
  public BackendSession {
    Objects.requireNonNull(user, "user");
  }

  public boolean expiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
