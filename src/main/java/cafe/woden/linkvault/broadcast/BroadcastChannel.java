package cafe.woden.linkvault.broadcast;

import io.reactivex.rxjava3.core.Flowable;
import java.util.Map;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Best-effort bus between independent contexts of the same client. Delivery is neither guaranteed
 * nor ordered across publishers, and a context never receives its own messages.
 */
@ApplicationLayer
public interface BroadcastChannel extends AutoCloseable {

  /** Identifies this context as the origin of what it publishes. */
  String contextId();

  void publish(BroadcastType type, Map<String, String> payload);

  Flowable<BroadcastMessage> messages();

  @Override
  void close();
}
