package cafe.woden.linkvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Closed set of platforms a link can be attributed to. Unknown values fold to {@link #OTHER}. */
public enum Platform {
  YOUTUBE,
  TWITTER,
  INSTAGRAM,
  LINKEDIN,
  TIKTOK,
  GITHUB,
  MEDIUM,
  REDDIT,
  FACEBOOK,
  OTHER;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Platform fromWire(String raw) {
    if (raw == null) return OTHER;
    String s = raw.trim().toUpperCase(Locale.ROOT);
    if (s.isEmpty()) return OTHER;
    for (Platform p : values()) {
      if (p.name().equals(s)) return p;
    }
    return OTHER;
  }
}
