package cafe.woden.linkvault.data;

import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.model.RowCodec;
import cafe.woden.linkvault.storage.KeyValueStore;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Guest data kept as two JSON arrays in local storage.
 *
 * <p>Guest mode has no sub-folders, and folder names are unique ignoring case.
 */
@Component
public class GuestLinkRepository implements LinkRepository {
  private static final Logger log = LoggerFactory.getLogger(GuestLinkRepository.class);

  private final KeyValueStore store;
  private final GuestSessionStore sessions;
  private final Scheduler scheduler;
  private final RowCodec codec = new RowCodec();
  private final Object lock = new Object();

  public GuestLinkRepository(KeyValueStore store, GuestSessionStore sessions, Scheduler scheduler) {
    this.store = store;
    this.sessions = sessions;
    this.scheduler = scheduler;
  }

  @Override
  public StorageSource source() {
    return StorageSource.GUEST;
  }

  @Override
  public String newLinkId() {
    return "guest_link_" + UUID.randomUUID();
  }

  @Override
  public String newFolderId() {
    return "guest_folder_" + UUID.randomUUID();
  }

  @Override
  public Single<List<Link>> listLinks() {
    return Single.fromCallable(() -> {
      List<Link> out = new ArrayList<>();
      for (Link l : readLinks()) {
        if (!l.inTrash()) out.add(l);
      }
      return out;
    });
  }

  @Override
  public Single<List<Link>> listLinksIncludingDeleted() {
    return Single.fromCallable(this::readLinks);
  }

  @Override
  public Single<Link> addLink(Link link) {
    return Single.fromCallable(() -> {
      synchronized (lock) {
        List<Link> links = readLinks();
        if (link.folderId() != null) requireFolder(readFolders(), link.folderId());
        links.add(0, link.withUserId(null));
        writeLinks(links);
        return links.get(0);
      }
    });
  }

  @Override
  public Single<Link> updateLink(Link link) {
    return Single.fromCallable(() -> {
      if (link.folderId() != null) requireFolder(readFolders(), link.folderId());
      return replaceLink(link.id(), existing -> link.withUserId(null));
    });
  }

  @Override
  public Single<Link> trashLink(String linkId) {
    return Single.fromCallable(() -> replaceLink(linkId, l -> l.withDeletedAt(now(), now())));
  }

  @Override
  public Single<Link> restoreLink(String linkId) {
    return Single.fromCallable(() -> replaceLink(linkId, l -> l.withDeletedAt(null, now())));
  }

  @Override
  public Completable permanentlyDeleteLink(String linkId) {
    return Completable.fromAction(() -> {
      synchronized (lock) {
        List<Link> links = readLinks();
        if (links.removeIf(l -> l.id().equals(linkId))) writeLinks(links);
      }
    });
  }

  @Override
  public Completable bulkTrash(Collection<String> linkIds) {
    return Completable.fromAction(() -> replaceEach(linkIds, l -> l.withDeletedAt(now(), now())));
  }

  @Override
  public Completable bulkRestore(Collection<String> linkIds) {
    return Completable.fromAction(() -> replaceEach(linkIds, l -> l.withDeletedAt(null, now())));
  }

  @Override
  public Completable bulkMove(Collection<String> linkIds, String folderId) {
    return Completable.fromAction(() -> {
      if (folderId != null) requireFolder(readFolders(), folderId);
      replaceEach(linkIds, l -> l.withFolderId(folderId, now()));
    });
  }

  @Override
  public Single<Integer> emptyTrash() {
    return Single.fromCallable(() -> {
      synchronized (lock) {
        List<Link> links = readLinks();
        int before = links.size();
        links.removeIf(Link::inTrash);
        writeLinks(links);
        return before - links.size();
      }
    });
  }

  @Override
  public Single<Integer> restoreAllFromTrash() {
    return Single.fromCallable(() -> {
      synchronized (lock) {
        List<Link> links = readLinks();
        int restored = 0;
        for (int i = 0; i < links.size(); i++) {
          if (links.get(i).inTrash()) {
            links.set(i, links.get(i).withDeletedAt(null, now()));
            restored++;
          }
        }
        writeLinks(links);
        return restored;
      }
    });
  }

  @Override
  public Single<List<Folder>> listFolders() {
    return Single.fromCallable(this::readFolders);
  }

  @Override
  public Single<Folder> addFolder(Folder folder) {
    return Single.fromCallable(() -> {
      synchronized (lock) {
        if (folder.parentId() != null) {
          throw new InvariantViolationException(Violation.NOT_AVAILABLE_IN_GUEST_MODE,
              "Sub-folders are not available in guest mode", Map.of("parentId", folder.parentId()));
        }
        List<Folder> folders = readFolders();
        requireUniqueName(folders, folder);
        Folder stored = folder.withUserId(null);
        folders.add(stored);
        writeFolders(folders);
        return stored;
      }
    });
  }

  @Override
  public Single<Folder> updateFolder(Folder folder) {
    return Single.fromCallable(() -> {
      synchronized (lock) {
        if (folder.parentId() != null) {
          throw new InvariantViolationException(Violation.NOT_AVAILABLE_IN_GUEST_MODE,
              "Sub-folders are not available in guest mode", Map.of("parentId", folder.parentId()));
        }
        List<Folder> folders = readFolders();
        int idx = indexOfFolder(folders, folder.id());
        requireUniqueName(folders, folder);
        Folder stored = folder.withUserId(null);
        folders.set(idx, stored);
        writeFolders(folders);
        return stored;
      }
    });
  }

  @Override
  public Completable deleteFolder(String folderId) {
    return Completable.fromAction(() -> {
      synchronized (lock) {
        List<Folder> folders = readFolders();
        int idx = indexOfFolder(folders, folderId);
        folders.remove(idx);
        Instant now = now();
        for (int i = 0; i < folders.size(); i++) {
          if (folderId.equals(folders.get(i).parentId())) {
            folders.set(i, folders.get(i).withParentId(null, now));
          }
        }
        List<Link> links = readLinks();
        for (int i = 0; i < links.size(); i++) {
          if (folderId.equals(links.get(i).folderId())) {
            links.set(i, links.get(i).withFolderId(null, now));
          }
        }
        writeLinks(links);
        writeFolders(folders);
      }
    });
  }

  @Override
  public Single<DataExport> exportData() {
    return Single.fromCallable(() ->
        new DataExport(StorageSource.GUEST, readFolders(), readLinks(), now()));
  }

  private Link replaceLink(String linkId, UnaryOperator<Link> change) {
    synchronized (lock) {
      List<Link> links = readLinks();
      for (int i = 0; i < links.size(); i++) {
        if (links.get(i).id().equals(linkId)) {
          Link next = change.apply(links.get(i));
          links.set(i, next);
          writeLinks(links);
          return next;
        }
      }
      throw new InvariantViolationException(Violation.UNKNOWN_LINK, "Link does not exist",
          Map.of("linkId", String.valueOf(linkId)));
    }
  }

  private void replaceEach(Collection<String> linkIds, UnaryOperator<Link> change) {
    Set<String> ids = new HashSet<>(linkIds);
    synchronized (lock) {
      List<Link> links = readLinks();
      for (int i = 0; i < links.size(); i++) {
        if (ids.contains(links.get(i).id())) links.set(i, change.apply(links.get(i)));
      }
      writeLinks(links);
    }
  }

  private static void requireUniqueName(List<Folder> folders, Folder candidate) {
    String wanted = candidate.name().toLowerCase(Locale.ROOT);
    for (Folder f : folders) {
      if (!f.id().equals(candidate.id()) && f.name().toLowerCase(Locale.ROOT).equals(wanted)) {
        throw new InvariantViolationException(Violation.DUPLICATE_NAME,
            "A folder with this name already exists", Map.of("name", candidate.name()));
      }
    }
  }

  private static void requireFolder(List<Folder> folders, String folderId) {
    indexOfFolder(folders, folderId);
  }

  private static int indexOfFolder(List<Folder> folders, String folderId) {
    for (int i = 0; i < folders.size(); i++) {
      if (folders.get(i).id().equals(folderId)) return i;
    }
    throw new InvariantViolationException(Violation.UNKNOWN_FOLDER, "Folder does not exist",
        Map.of("folderId", String.valueOf(folderId)));
  }

  private List<Link> readLinks() {
    return codec.readJsonList(store.get(GuestSessionStore.LINKS_KEY).orElse(null), Link.class);
  }

  private List<Folder> readFolders() {
    return codec.readJsonList(store.get(GuestSessionStore.FOLDERS_KEY).orElse(null), Folder.class);
  }

  private void writeLinks(List<Link> links) {
    store.put(GuestSessionStore.LINKS_KEY, codec.toJson(links));
    sessions.touch();
    log.debug("[linkvault] Guest links saved ({})", links.size());
  }

  private void writeFolders(List<Folder> folders) {
    store.put(GuestSessionStore.FOLDERS_KEY, codec.toJson(folders));
    sessions.touch();
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }
}
