package cafe.woden.linkvault.realtime;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** Push-based change feed over remote tables. */
@ApplicationLayer
public interface ChangeFeedTransport {

  /**
   * Opens a feed. Connection loss, now or later, is reported through
   * {@link FeedListener#onConnectionLost}; an exception thrown from here is treated the same way.
   */
  FeedHandle open(SubscriptionConfig config, FeedListener listener);
}
