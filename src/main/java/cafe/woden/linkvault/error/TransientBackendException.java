package cafe.woden.linkvault.error;

import java.util.Map;

/** Network blip, dropped feed, backend hiccup: worth retrying within a bound. */
public class TransientBackendException extends LinkVaultException {
  public static final String CODE = "TRANSIENT";

  public TransientBackendException(String message, Map<String, ?> context, Throwable cause) {
    super(CODE, message, context, cause);
  }

  public TransientBackendException(String message) {
    this(message, Map.of(), null);
  }
}
