package cafe.woden.linkvault.store;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import java.util.List;

/** Immutable copy of the mirror. {@code version} grows by one per effective change. */
public record StoreSnapshot(List<Folder> folders, List<Link> links, long version) {
  public StoreSnapshot {
    folders = List.copyOf(folders);
    links = List.copyOf(links);
  }

  public static StoreSnapshot empty() {
    return new StoreSnapshot(List.of(), List.of(), 0);
  }
}
