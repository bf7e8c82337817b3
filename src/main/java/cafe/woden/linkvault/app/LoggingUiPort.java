package cafe.woden.linkvault.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in used when no UI contributes a {@link UiPort}. */
public class LoggingUiPort implements UiPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingUiPort.class);

  @Override
  public void redirectToLogin(String reason) {
    log.info("[linkvault] -> login ({})", reason);
  }

  @Override
  public void showNotice(String code, String message) {
    log.info("[linkvault] notice {}: {}", code, message);
  }
}
