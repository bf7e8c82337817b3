package cafe.woden.linkvault.realtime;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** A validated change. {@code before} is empty for inserts, {@code after} for deletes. */
public record ChangeEvent(
    String resource,
    ChangeType type,
    Map<String, Object> before,
    Map<String, Object> after,
    Instant receivedAt
) {
  public ChangeEvent {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(type, "type");
    before = before == null ? Map.of() : before;
    after = after == null ? Map.of() : after;
  }

  /** Id of the affected row, from whichever side carries it. */
  public Optional<String> recordId() {
    Object id = type == ChangeType.DELETE ? before.get("id") : after.get("id");
    if (id == null) id = after.get("id") != null ? after.get("id") : before.get("id");
    return Optional.ofNullable(id).map(String::valueOf);
  }
}
