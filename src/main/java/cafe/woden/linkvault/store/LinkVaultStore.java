package cafe.woden.linkvault.store;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.hierarchy.FolderHierarchy;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The local mirror of the active storage backend.
 *
 * <p>{@link #apply} is idempotent: replaying a change, receiving an older version of a record after
 * a newer one, or deleting something already gone leaves the mirror untouched. That is what lets
 * several contexts reconcile independently without coordination.
 */
@Component
@ApplicationLayer
public class LinkVaultStore {
  private static final Logger log = LoggerFactory.getLogger(LinkVaultStore.class);

  private final int maxSubFolders;
  private final Map<String, Folder> folders = new LinkedHashMap<>();
  private final Map<String, Link> links = new LinkedHashMap<>();
  private final BehaviorProcessor<StoreSnapshot> snapshots =
      BehaviorProcessor.createDefault(StoreSnapshot.empty());
  private long version;

  public LinkVaultStore(LinkVaultProperties props) {
    this.maxSubFolders = props.hierarchy().maxSubFolders();
  }

  public Flowable<StoreSnapshot> snapshots() {
    return snapshots.onBackpressureLatest();
  }

  public synchronized StoreSnapshot snapshot() {
    return new StoreSnapshot(new ArrayList<>(folders.values()), new ArrayList<>(links.values()), version);
  }

  public synchronized void replaceAll(Collection<Folder> newFolders, Collection<Link> newLinks) {
    fill(folders, newFolders, Folder::id);
    fill(links, newLinks, Link::id);
    changed();
    log.debug("[linkvault] Mirror reloaded: {} folders, {} links", folders.size(), links.size());
  }

  public synchronized void replaceFolders(Collection<Folder> newFolders) {
    fill(folders, newFolders, Folder::id);
    changed();
  }

  public synchronized void replaceLinks(Collection<Link> newLinks) {
    fill(links, newLinks, Link::id);
    changed();
  }

  public synchronized void clear() {
    if (folders.isEmpty() && links.isEmpty()) return;
    folders.clear();
    links.clear();
    changed();
  }

  /** Applies a change unless it is stale or redundant. Returns whether the mirror changed. */
  public synchronized boolean apply(RecordChange change) {
    return put(change, true);
  }

  /** Puts a previous version back regardless of timestamps; used to undo optimistic writes. */
  public synchronized boolean revert(RecordChange change) {
    return put(change, false);
  }

  public synchronized Optional<Folder> folder(String id) {
    return Optional.ofNullable(id == null ? null : folders.get(id));
  }

  public synchronized Optional<Link> link(String id) {
    return Optional.ofNullable(id == null ? null : links.get(id));
  }

  public synchronized List<Folder> folders() {
    return List.copyOf(folders.values());
  }

  public synchronized List<Link> allLinks() {
    return List.copyOf(links.values());
  }

  public synchronized List<Link> activeLinks() {
    List<Link> out = new ArrayList<>();
    for (Link l : links.values()) {
      if (!l.inTrash()) out.add(l);
    }
    return out;
  }

  public synchronized List<Link> trash() {
    List<Link> out = new ArrayList<>();
    for (Link l : links.values()) {
      if (l.inTrash()) out.add(l);
    }
    return out;
  }

  public synchronized List<Link> favorites() {
    List<Link> out = new ArrayList<>();
    for (Link l : links.values()) {
      if (!l.inTrash() && l.favorite()) out.add(l);
    }
    return out;
  }

  /** Active links filed in the folder, or anywhere below it when {@code includeDescendants}. */
  public synchronized List<Link> linksInFolder(String folderId, boolean includeDescendants) {
    Set<String> ids = includeDescendants ? hierarchy().descendantIds(folderId) : Set.of(folderId);
    List<Link> out = new ArrayList<>();
    for (Link l : links.values()) {
      if (!l.inTrash() && l.folderId() != null && ids.contains(l.folderId())) out.add(l);
    }
    return out;
  }

  /** Active link count per folder id; unfiled links are not counted. */
  public synchronized Map<String, Integer> linkCountsByFolder() {
    Map<String, Integer> out = new LinkedHashMap<>();
    for (Folder f : folders.values()) out.put(f.id(), 0);
    for (Link l : links.values()) {
      if (!l.inTrash() && l.folderId() != null) out.merge(l.folderId(), 1, Integer::sum);
    }
    return out;
  }

  public synchronized FolderHierarchy hierarchy() {
    return FolderHierarchy.of(folders.values(), maxSubFolders);
  }

  private boolean put(RecordChange change, boolean enforceOrder) {
    boolean effective;
    if (change instanceof RecordChange.FolderUpserted fu) {
      effective = upsert(folders, fu.folder().id(), fu.folder(), fu.folder().updatedAt(),
          folders.containsKey(fu.id()) ? folders.get(fu.id()).updatedAt() : null, enforceOrder);
    } else if (change instanceof RecordChange.LinkUpserted lu) {
      effective = upsert(links, lu.link().id(), lu.link(), lu.link().updatedAt(),
          links.containsKey(lu.id()) ? links.get(lu.id()).updatedAt() : null, enforceOrder);
    } else if (change instanceof RecordChange.FolderDeleted) {
      effective = folders.remove(change.id()) != null;
    } else if (change instanceof RecordChange.LinkDeleted) {
      effective = links.remove(change.id()) != null;
    } else {
      effective = false;
    }
    if (effective) changed();
    return effective;
  }

  private static <T> boolean upsert(
      Map<String, T> map, String id, T incoming, Instant incomingAt, Instant currentAt,
      boolean enforceOrder) {
    T current = map.get(id);
    if (Objects.equals(current, incoming)) return false;
    if (enforceOrder && current != null && incomingAt != null && currentAt != null
        && incomingAt.isBefore(currentAt)) {
      log.debug("[linkvault] Ignoring stale version of {} ({} < {})", id, incomingAt, currentAt);
      return false;
    }
    map.put(id, incoming);
    return true;
  }

  private static <T> void fill(Map<String, T> map, Collection<T> values,
      Function<T, String> id) {
    map.clear();
    if (values == null) return;
    for (T v : values) {
      if (v != null) map.put(id.apply(v), v);
    }
  }

  private void changed() {
    version++;
    snapshots.onNext(snapshot());
  }
}
