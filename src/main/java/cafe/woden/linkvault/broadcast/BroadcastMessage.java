package cafe.woden.linkvault.broadcast;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A tagged signal between client contexts. It tells receivers that something happened; it is
 * never a state snapshot, and receivers re-derive their own state.
 */
public record BroadcastMessage(BroadcastType type, Map<String, String> payload, String originId, Instant sentAt) {
  public BroadcastMessage {
    Objects.requireNonNull(type, "type");
    payload = payload == null ? Map.of() : Map.copyOf(payload);
    originId = Objects.toString(originId, "");
  }
}
