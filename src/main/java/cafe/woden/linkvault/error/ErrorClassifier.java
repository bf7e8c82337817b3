package cafe.woden.linkvault.error;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/** Maps arbitrary throwables onto the {@link LinkVaultException} taxonomy. */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  public static LinkVaultException classify(Throwable err, String operation, Map<String, ?> context) {
    Throwable t = unwrap(err);
    if (t instanceof LinkVaultException lve) return lve;
    if (t instanceof TimeoutException || t instanceof IOException) {
      return new TransientBackendException(
          operation + " did not complete: " + t.getMessage(), context, t);
    }
    return new OperationFailedException(
        operation + " failed unexpectedly: " + t.getMessage(), context, t);
  }

  public static boolean isTransient(Throwable err) {
    Throwable t = unwrap(err);
    return t instanceof TransientBackendException
        || t instanceof TimeoutException
        || t instanceof IOException;
  }

  public static boolean isAuthentication(Throwable err) {
    return unwrap(err) instanceof AuthenticationRequiredException;
  }

  private static Throwable unwrap(Throwable err) {
    Throwable t = err;
    // RxJava wraps checked exceptions thrown from lambdas.
    while (t != null && t.getCause() != null
        && (t instanceof RuntimeException)
        && !(t instanceof LinkVaultException)
        && t.getClass() == RuntimeException.class) {
      t = t.getCause();
    }
    return t == null ? new IllegalStateException("unknown error") : t;
  }
}
