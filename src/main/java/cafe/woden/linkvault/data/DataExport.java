package cafe.woden.linkvault.data;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import java.time.Instant;
import java.util.List;

/** Everything a repository holds, trash included. */
public record DataExport(StorageSource source, List<Folder> folders, List<Link> links, Instant exportedAt) {
  public DataExport {
    folders = List.copyOf(folders);
    links = List.copyOf(links);
  }
}
