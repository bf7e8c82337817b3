package cafe.woden.linkvault.error;

import java.util.Map;

/** Local persistent storage could not be read or written. */
public class StorageException extends LinkVaultException {
  public static final String CODE = "STORAGE";

  public StorageException(String message, Map<String, ?> context, Throwable cause) {
    super(CODE, message, context, cause);
  }
}
