package cafe.woden.linkvault.realtime;

import java.util.Locale;
import java.util.Optional;

public enum ChangeType {
  INSERT,
  UPDATE,
  DELETE;

  public static Optional<ChangeType> parse(String raw) {
    if (raw == null) return Optional.empty();
    String s = raw.trim().toUpperCase(Locale.ROOT);
    for (ChangeType t : values()) {
      if (t.name().equals(s)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
