package cafe.woden.linkvault.session;

import cafe.woden.linkvault.model.AuthUser;
import java.util.Objects;
import java.util.Optional;

/**
 * Where session resolution stands.
 *
 * <pre>
 * Unknown -> Recovering(1..n) -> Ready(user | none)
 * Ready   -> Ready                (explicit sign-in/out, expiry, remote logout)
 * Ready   -> Recovering -> Ready  (re-derivation after a broadcast)
 * </pre>
 *
 * <p>{@link #isReady()} is a property of the state object itself, so a reader can never see
 * "ready" without also seeing the resolved user or its explicit absence.
 */
public sealed interface SessionState {

  default boolean isReady() {
    return false;
  }

  default Optional<AuthUser> user() {
    return Optional.empty();
  }

  record Unknown() implements SessionState {}

  record Recovering(int attempt) implements SessionState {}

  record Ready(Optional<AuthUser> resolvedUser, Optional<SessionNotice> notice)
      implements SessionState {

    public Ready {
      resolvedUser = Objects.requireNonNullElse(resolvedUser, Optional.empty());
      notice = Objects.requireNonNullElse(notice, Optional.empty());
    }

    public static Ready signedIn(AuthUser user) {
      return new Ready(Optional.of(user), Optional.empty());
    }

    public static Ready signedOut() {
      return new Ready(Optional.empty(), Optional.empty());
    }

    public static Ready signedOut(SessionNotice notice) {
      return new Ready(Optional.empty(), Optional.ofNullable(notice));
    }

    @Override
    public boolean isReady() {
      return true;
    }

    @Override
    public Optional<AuthUser> user() {
      return resolvedUser;
    }
  }
}
