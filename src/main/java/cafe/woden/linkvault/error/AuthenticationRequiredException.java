package cafe.woden.linkvault.error;

import java.util.Map;

/**
 * The "needs sign-in" signal.
 *
 * <p>Raised for expired or invalid credentials, and when a caller asks for data while neither a
 * session nor guest mode is active. Never retried.
 */
public class AuthenticationRequiredException extends LinkVaultException {
  public static final String CODE = "AUTH_REQUIRED";

  public AuthenticationRequiredException(String message, Map<String, ?> context, Throwable cause) {
    super(CODE, message, context, cause);
  }

  public AuthenticationRequiredException(String message) {
    this(message, Map.of(), null);
  }
}
