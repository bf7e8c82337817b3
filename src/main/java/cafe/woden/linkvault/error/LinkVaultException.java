package cafe.woden.linkvault.error;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every failure the sync core surfaces to its callers.
 *
 * <p>{@link #code()} is stable and machine-readable; {@link #context()} carries the identifiers
 * needed to make a log line useful (folder id, resource, attempt, ...).
 */
public class LinkVaultException extends RuntimeException {

  private final String code;
  private final Map<String, Object> context;
  private final Instant occurredAt;

  public LinkVaultException(String code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNullElse(code, "LINKVAULT_ERROR");
    this.context = copyContext(context);
    this.occurredAt = Instant.now();
  }

  public LinkVaultException(String code, String message) {
    this(code, message, Map.of(), null);
  }

  public String code() {
    return code;
  }

  public Map<String, Object> context() {
    return context;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  /** Flat view for structured logging. */
  public Map<String, Object> details() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", getClass().getSimpleName());
    out.put("code", code);
    out.put("message", getMessage());
    out.put("occurredAt", occurredAt.toString());
    if (!context.isEmpty()) out.put("context", context);
    Throwable cause = getCause();
    if (cause != null) {
      out.put("cause", cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
    return out;
  }

  private static Map<String, Object> copyContext(Map<String, ?> context) {
    if (context == null || context.isEmpty()) return Map.of();
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : context.entrySet()) {
      if (e.getKey() == null || e.getValue() == null) continue;
      copy.put(e.getKey(), e.getValue());
    }
    return Map.copyOf(copy);
  }
}
