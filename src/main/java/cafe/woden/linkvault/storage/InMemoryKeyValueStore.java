package cafe.woden.linkvault.storage;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store. Nothing survives a restart. */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(String key, String value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      values.remove(key);
    } else {
      values.put(key, value);
    }
  }

  @Override
  public void remove(String key) {
    if (key != null) values.remove(key);
  }

  @Override
  public void clear() {
    values.clear();
  }

  @Override
  public Set<String> keys() {
    return new TreeSet<>(values.keySet());
  }
}
