package cafe.woden.linkvault.storage;

import java.util.Optional;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Local persistent key/value storage.
 *
 * <p>Calls are synchronous from the caller's point of view. Used only by guest mode and by the
 * logout marker.
 *
 * @throws cafe.woden.linkvault.error.StorageException from any method when the medium fails
 */
@ApplicationLayer
public interface KeyValueStore {

  Optional<String> get(String key);

  void put(String key, String value);

  void remove(String key);

  /** Removes every key. */
  void clear();

  Set<String> keys();
}
