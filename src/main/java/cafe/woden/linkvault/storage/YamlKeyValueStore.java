package cafe.woden.linkvault.storage;

import cafe.woden.linkvault.error.StorageException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * A flat YAML document on disk.
 *
 * <p>The file is re-read on every access so that other processes sharing it observe each other's
 * writes (the logout marker depends on this). Writes go to a sibling temp file that is then moved
 * over the original.
 */
public class YamlKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(YamlKeyValueStore.class);

  private final Path file;
  private final Yaml yaml;

  public YamlKeyValueStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    opts.setIndicatorIndent(1);
    // Stored values are JSON documents; keep them on one quoted line.
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.DOUBLE_QUOTED);
    opts.setWidth(Integer.MAX_VALUE);
    this.yaml = new Yaml(opts);
  }

  public Path path() {
    return file;
  }

  @Override
  public synchronized Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    Object v = load().get(key);
    return v == null ? Optional.empty() : Optional.of(String.valueOf(v));
  }

  @Override
  public synchronized void put(String key, String value) {
    Objects.requireNonNull(key, "key");
    Map<String, Object> doc = load();
    if (value == null) {
      doc.remove(key);
    } else {
      doc.put(key, value);
    }
    write(doc);
  }

  @Override
  public synchronized void remove(String key) {
    if (key == null) return;
    Map<String, Object> doc = load();
    if (doc.remove(key) != null) write(doc);
  }

  @Override
  public synchronized void clear() {
    write(new LinkedHashMap<>());
  }

  @Override
  public synchronized Set<String> keys() {
    return new TreeSet<>(load().keySet());
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> load() {
    if (!Files.exists(file)) return new LinkedHashMap<>();
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return new LinkedHashMap<>((Map<String, Object>) m);
      }
      if (o != null) {
        log.warn("[linkvault] Ignoring non-map content in local store '{}'", file);
      }
      return new LinkedHashMap<>();
    } catch (IOException e) {
      throw new StorageException("Could not read local store", Map.of("file", file.toString()), e);
    } catch (RuntimeException e) {
      // Corrupt YAML: treat as empty rather than locking the user out of the client.
      log.warn("[linkvault] Local store '{}' is unreadable; starting from an empty document", file, e);
      return new LinkedHashMap<>();
    }
  }

  private void write(Map<String, Object> doc) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        yaml.dump(doc, w);
      }
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new StorageException("Could not write local store", Map.of("file", file.toString()), e);
    }
  }
}
