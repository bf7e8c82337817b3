package cafe.woden.linkvault.data;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.util.Collection;
import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Storage backend for one user's folders and links.
 *
 * <p>Writes take whole records; callers build the new version and the repository persists it.
 * Parentage rules are checked before anything gets here.
 */
@ApplicationLayer
public interface LinkRepository {

  StorageSource source();

  /** A fresh id in this backend's id space. */
  String newLinkId();

  String newFolderId();

  /** Links outside the trash. */
  Single<List<Link>> listLinks();

  Single<List<Link>> listLinksIncludingDeleted();

  Single<Link> addLink(Link link);

  Single<Link> updateLink(Link link);

  /** Moves a link to the trash. */
  Single<Link> trashLink(String linkId);

  Single<Link> restoreLink(String linkId);

  Completable permanentlyDeleteLink(String linkId);

  Completable bulkTrash(Collection<String> linkIds);

  Completable bulkRestore(Collection<String> linkIds);

  Completable bulkMove(Collection<String> linkIds, String folderId);

  /** Permanently deletes every trashed link and returns how many there were. */
  Single<Integer> emptyTrash();

  Single<Integer> restoreAllFromTrash();

  Single<List<Folder>> listFolders();

  Single<Folder> addFolder(Folder folder);

  Single<Folder> updateFolder(Folder folder);

  /** Deletes a folder. Its links become unfiled and its sub-folders become roots. */
  Completable deleteFolder(String folderId);

  Single<DataExport> exportData();
}
