package cafe.woden.linkvault.error;

import java.util.Map;

/** Catch-all for unexpected failures; the UI offers a retry affordance for these. */
public class OperationFailedException extends LinkVaultException {
  public static final String CODE = "OPERATION_FAILED";

  public OperationFailedException(String message, Map<String, ?> context, Throwable cause) {
    super(CODE, message, context, cause);
  }
}
