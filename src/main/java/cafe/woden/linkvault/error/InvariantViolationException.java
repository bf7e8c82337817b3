package cafe.woden.linkvault.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A mutation was rejected before reaching any storage backend. */
public class InvariantViolationException extends LinkVaultException {
  public static final String CODE = "INVARIANT_VIOLATION";

  public enum Violation {
    CYCLE,
    NESTING_TOO_DEEP,
    SUB_FOLDER_QUOTA,
    UNKNOWN_FOLDER,
    UNKNOWN_LINK,
    DUPLICATE_NAME,
    INVALID_INPUT,
    NOT_AVAILABLE_IN_GUEST_MODE
  }

  private final Violation violation;

  public InvariantViolationException(Violation violation, String message, Map<String, ?> context) {
    super(CODE, message, withViolation(violation, context), null);
    this.violation = Objects.requireNonNull(violation, "violation");
  }

  public InvariantViolationException(Violation violation, String message) {
    this(violation, message, Map.of());
  }

  public Violation violation() {
    return violation;
  }

  private static Map<String, Object> withViolation(Violation violation, Map<String, ?> context) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (context != null) {
      for (Map.Entry<String, ?> e : context.entrySet()) {
        if (e.getKey() != null && e.getValue() != null) out.put(e.getKey(), e.getValue());
      }
    }
    out.put("violation", String.valueOf(violation));
    return out;
  }
}
