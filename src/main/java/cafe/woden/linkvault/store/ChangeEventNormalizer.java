package cafe.woden.linkvault.store;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.model.Resources;
import cafe.woden.linkvault.model.RowCodec;
import cafe.woden.linkvault.realtime.ChangeEvent;
import cafe.woden.linkvault.realtime.ChangeType;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Turns feed events on the folder and link tables into mirror changes. */
@Component
public class ChangeEventNormalizer {
  private static final Logger log = LoggerFactory.getLogger(ChangeEventNormalizer.class);

  private final RowCodec codec = new RowCodec();

  public Optional<RecordChange> normalize(ChangeEvent event) {
    if (event == null) return Optional.empty();
    Optional<String> id = event.recordId();
    if (id.isEmpty()) {
      log.warn("[linkvault] Ignoring {} on {} without an id", event.type(), event.resource());
      return Optional.empty();
    }
    try {
      switch (event.resource()) {
        case Resources.FOLDERS:
          return Optional.of(event.type() == ChangeType.DELETE
              ? new RecordChange.FolderDeleted(id.get())
              : new RecordChange.FolderUpserted(codec.fromRow(event.after(), Folder.class)));
        case Resources.LINKS:
          return Optional.of(event.type() == ChangeType.DELETE
              ? new RecordChange.LinkDeleted(id.get())
              : new RecordChange.LinkUpserted(codec.fromRow(event.after(), Link.class)));
        default:
          log.debug("[linkvault] No mirror mapping for resource {}", event.resource());
          return Optional.empty();
      }
    } catch (IllegalArgumentException e) {
      log.warn("[linkvault] Could not decode {} on {} (id {}): {}",
          event.type(), event.resource(), id.get(), e.getMessage());
      return Optional.empty();
    }
  }
}
