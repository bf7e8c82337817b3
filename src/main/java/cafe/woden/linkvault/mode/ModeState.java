package cafe.woden.linkvault.mode;

import java.util.Objects;
import java.util.Optional;

/**
 * The active mode plus the user it belongs to. In {@code GUEST} mode the user may still be
 * present when someone signed in explicitly switched to guest data.
 */
public record ModeState(Mode mode, Optional<String> userId, long generation) {
  public ModeState {
    Objects.requireNonNull(mode, "mode");
    userId = userId == null ? Optional.empty() : userId;
  }

  public static ModeState signedOut(long generation) {
    return new ModeState(Mode.SIGNED_OUT, Optional.empty(), generation);
  }
}
