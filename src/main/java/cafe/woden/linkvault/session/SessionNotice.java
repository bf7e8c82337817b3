package cafe.woden.linkvault.session;

import org.jmolecules.ddd.annotation.ValueObject;

/** Non-fatal message attached to a resolved session state, for the UI to surface. */
@ValueObject
public record SessionNotice(String code, String message) {
  public static final String INIT_TIMEOUT = "INIT_TIMEOUT";
  public static final String RECOVERY_FAILED = "RECOVERY_FAILED";
  public static final String SESSION_EXPIRED = "SESSION_EXPIRED";
  public static final String SIGNED_OUT = "SIGNED_OUT";
  public static final String REMOTE_LOGOUT = "REMOTE_LOGOUT";

  public static SessionNotice of(String code, String message) {
    return new SessionNotice(code, message);
  }
}
