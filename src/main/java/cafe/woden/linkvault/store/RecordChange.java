package cafe.woden.linkvault.store;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;

/** One change to apply to the local mirror, from a change feed or a local mutation. */
public sealed interface RecordChange {

  String id();

  record FolderUpserted(Folder folder) implements RecordChange {
    @Override
    public String id() {
      return folder.id();
    }
  }

  record FolderDeleted(String id) implements RecordChange {}

  record LinkUpserted(Link link) implements RecordChange {
    @Override
    public String id() {
      return link.id();
    }
  }

  record LinkDeleted(String id) implements RecordChange {}
}
