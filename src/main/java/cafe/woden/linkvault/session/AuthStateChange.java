package cafe.woden.linkvault.session;

import java.util.Objects;
import java.util.Optional;

/** A push notification from the credential backend. */
public record AuthStateChange(Event event, Optional<BackendSession> session) {

  public enum Event {
    SIGNED_IN,
    SIGNED_OUT,
    TOKEN_REFRESHED,
    USER_UPDATED
  }

  public AuthStateChange {
    Objects.requireNonNull(event, "event");
    session = session == null ? Optional.empty() : session;
  }

  public static AuthStateChange of(Event event, BackendSession session) {
    return new AuthStateChange(event, Optional.ofNullable(session));
  }
}
