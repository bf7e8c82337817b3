package cafe.woden.linkvault.broadcast;

import cafe.woden.linkvault.model.RowCodec;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcast between processes on one machine through a shared spool directory.
 *
 * <p>Every message is one JSON file named {@code <sentAtMillis>-<uuid>.msg}. Readers poll on their
 * own scheduler, remember which files they have seen, and delete files older than the retention
 * window. Files already present when the channel is created are history and are not replayed.
 */
public class SpoolDirectoryBroadcastChannel implements BroadcastChannel {
  private static final Logger log = LoggerFactory.getLogger(SpoolDirectoryBroadcastChannel.class);

  static final String SUFFIX = ".msg";

  private final Path directory;
  private final String contextId;
  private final Scheduler scheduler;
  private final long pollPeriodMs;
  private final long retentionMs;
  private final RowCodec codec = new RowCodec();
  private final Set<String> seen = new HashSet<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Flowable<BroadcastMessage> messages;

  public SpoolDirectoryBroadcastChannel(
      Path directory, String contextId, Scheduler scheduler, long pollPeriodMs, long retentionMs) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.contextId = Objects.requireNonNull(contextId, "contextId");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.pollPeriodMs = Math.max(1, pollPeriodMs);
    this.retentionMs = Math.max(this.pollPeriodMs, retentionMs);
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      log.warn("[linkvault] Broadcast spool '{}' is unavailable; cross-process sync disabled", directory, e);
    }
    synchronized (seen) {
      seen.addAll(listMessageFiles());
    }
    this.messages = Flowable.interval(this.pollPeriodMs, TimeUnit.MILLISECONDS, scheduler)
        .takeWhile(tick -> !closed.get())
        .concatMapIterable(tick -> poll())
        .share();
  }

  @Override
  public String contextId() {
    return contextId;
  }

  public Path directory() {
    return directory;
  }

  @Override
  public void publish(BroadcastType type, Map<String, String> payload) {
    if (closed.get()) return;
    long now = scheduler.now(TimeUnit.MILLISECONDS);
    BroadcastMessage msg = new BroadcastMessage(type, payload, contextId, Instant.ofEpochMilli(now));
    String name = now + "-" + UUID.randomUUID() + SUFFIX;
    synchronized (seen) {
      seen.add(name);
    }
    Path tmp = directory.resolve(name + ".tmp");
    try {
      Files.writeString(tmp, codec.toJson(msg), StandardCharsets.UTF_8);
      try {
        Files.move(tmp, directory.resolve(name), StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, directory.resolve(name));
      }
      log.debug("[linkvault] Broadcast {} as {}", type, name);
    } catch (IOException e) {
      // Best effort: the local context has already acted on the event.
      log.warn("[linkvault] Could not broadcast {} via '{}': {}", type, directory, e.toString());
    }
  }

  @Override
  public Flowable<BroadcastMessage> messages() {
    return messages;
  }

  @Override
  public void close() {
    closed.set(true);
  }

  List<BroadcastMessage> poll() {
    long now = scheduler.now(TimeUnit.MILLISECONDS);
    List<BroadcastMessage> out = new ArrayList<>();
    List<String> present = listMessageFiles();
    synchronized (seen) {
      seen.retainAll(present);
      for (String name : present) {
        long sentAt = sentAtOf(name);
        if (sentAt >= 0 && now - sentAt > retentionMs) {
          deleteQuietly(directory.resolve(name));
          continue;
        }
        if (!seen.add(name)) continue;
        BroadcastMessage msg = read(directory.resolve(name));
        if (msg != null && !contextId.equals(msg.originId())) out.add(msg);
      }
    }
    return out;
  }

  private BroadcastMessage read(Path file) {
    try {
      return codec.readJson(Files.readString(file, StandardCharsets.UTF_8), BroadcastMessage.class);
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException | IllegalArgumentException e) {
      log.warn("[linkvault] Skipping unreadable broadcast file '{}': {}", file, e.toString());
      return null;
    }
  }

  private List<String> listMessageFiles() {
    List<String> names = new ArrayList<>();
    if (!Files.isDirectory(directory)) return names;
    try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path p : ds) names.add(p.getFileName().toString());
    } catch (IOException e) {
      log.debug("[linkvault] Could not list broadcast spool '{}'", directory, e);
    }
    names.sort(null);
    return names;
  }

  private static long sentAtOf(String name) {
    int dash = name.indexOf('-');
    if (dash <= 0) return -1;
    try {
      return Long.parseLong(name.substring(0, dash));
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("[linkvault] Could not prune broadcast file '{}'", file, e);
    }
  }
}
