package cafe.woden.linkvault.app;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** What the sync core asks of whichever UI embeds it. */
@ApplicationLayer
public interface UiPort {

  /** Navigate to the sign-in screen. {@code reason} is a short code such as {@code expired}. */
  void redirectToLogin(String reason);

  /** Show a non-blocking message. */
  void showNotice(String code, String message);
}
