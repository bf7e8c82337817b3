package cafe.woden.linkvault.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Identity of a signed-in user as reported by the credential backend. */
@ValueObject
public record AuthUser(String id, String email) {
  public AuthUser {
    id = Objects.requireNonNull(id, "id").trim();
    if (id.isEmpty()) throw new IllegalArgumentException("user id must not be blank");
    email = Objects.toString(email, "").trim();
  }
}
