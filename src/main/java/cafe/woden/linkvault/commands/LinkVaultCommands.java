package cafe.woden.linkvault.commands;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.data.LinkRepository;
import cafe.woden.linkvault.error.ErrorClassifier;
import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.error.LinkVaultException;
import cafe.woden.linkvault.error.OperationFailedException;
import cafe.woden.linkvault.hierarchy.HierarchyGuard;
import cafe.woden.linkvault.mode.ModeReconciler;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.model.Platform;
import cafe.woden.linkvault.store.LinkVaultStore;
import cafe.woden.linkvault.store.RecordChange;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Function;
import io.reactivex.rxjava3.functions.Supplier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The only way the UI changes folders and links.
 *
 * <p>Each command validates against the mirror first (parentage rules included), applies its
 * result to the mirror optimistically, sends it to the active repository, and puts the previous
 * records back if the backend fails or does not answer within the mutation timeout. Failures come
 * back as {@link LinkVaultException}s; nothing is dropped silently.
 */
@Component
@ApplicationLayer
public class LinkVaultCommands {
  private static final Logger log = LoggerFactory.getLogger(LinkVaultCommands.class);

  private final ModeReconciler reconciler;
  private final LinkVaultStore store;
  private final HierarchyGuard guard;
  private final Scheduler scheduler;
  private final long mutationTimeoutMs;

  public LinkVaultCommands(
      ModeReconciler reconciler,
      LinkVaultStore store,
      HierarchyGuard guard,
      Scheduler scheduler,
      LinkVaultProperties props
  ) {
    this.reconciler = reconciler;
    this.store = store;
    this.guard = guard;
    this.scheduler = scheduler;
    this.mutationTimeoutMs = props.backend().mutationTimeoutMs();
  }

  // Folders

  public Single<Folder> createFolder(String name, String parentId) {
    return createFolder(name, parentId, null, null, null);
  }

  public Single<Folder> createFolder(
      String name, String parentId, String color, String icon, String description) {
    return Single.defer(() -> {
      String trimmed = requireName(name);
      guard.checkCreate(parentId, store.folders());
      LinkRepository repo = reconciler.activeRepository();
      Instant now = now();
      Folder folder = new Folder(repo.newFolderId(), parentId, trimmed, description, color, icon,
          false, null, false, null, null, now, now, null);
      return optimistic("createFolder", Map.of("name", trimmed),
          List.of(new RecordChange.FolderUpserted(folder)),
          List.of(new RecordChange.FolderDeleted(folder.id())),
          () -> repo.addFolder(folder),
          RecordChange.FolderUpserted::new);
    });
  }

  /** Changes name, appearance or sharing. Parentage changes go through {@link #moveFolder}. */
  public Single<Folder> updateFolder(String folderId, UnaryOperator<Folder> change) {
    return Single.defer(() -> {
      Folder before = requireFolder(folderId);
      Folder after = Objects.requireNonNull(change.apply(before), "change result");
      if (!Objects.equals(before.parentId(), after.parentId())) {
        guard.checkReparent(folderId, after.parentId(), store.folders());
      }
      Folder stamped = Objects.equals(before.updatedAt(), after.updatedAt())
          ? after.withUpdatedAt(now())
          : after;
      return saveFolder("updateFolder", before, stamped);
    });
  }

  public Single<Folder> renameFolder(String folderId, String name) {
    return Single.defer(() -> {
      String trimmed = requireName(name);
      return updateFolder(folderId, f -> f.withName(trimmed, now()));
    });
  }

  public Single<Folder> moveFolder(String folderId, String newParentId) {
    return Single.defer(() -> {
      Folder before = requireFolder(folderId);
      guard.checkReparent(folderId, newParentId, store.folders());
      return saveFolder("moveFolder", before, before.withParentId(newParentId, now()));
    });
  }

  public Single<Folder> shareFolder(String folderId) {
    return Single.defer(() -> {
      Folder before = requireFolder(folderId);
      if (before.shareable() && before.shareId() != null) return Single.just(before);
      String shareId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
      return saveFolder("shareFolder", before, before.withSharing(true, shareId, now()));
    });
  }

  public Single<Folder> unshareFolder(String folderId) {
    return Single.defer(() -> {
      Folder before = requireFolder(folderId);
      if (!before.shareable()) return Single.just(before);
      return saveFolder("unshareFolder", before, before.withSharing(false, null, now()));
    });
  }

  /** Deletes a folder; its links become unfiled and its sub-folders become roots. */
  public Completable deleteFolder(String folderId) {
    return Single.defer(() -> {
      Folder folder = requireFolder(folderId);
      LinkRepository repo = reconciler.activeRepository();
      Instant now = now();
      List<RecordChange> apply = new ArrayList<>();
      List<RecordChange> undo = new ArrayList<>();
      for (Link l : store.allLinks()) {
        if (folderId.equals(l.folderId())) {
          apply.add(new RecordChange.LinkUpserted(l.withFolderId(null, now)));
          undo.add(new RecordChange.LinkUpserted(l));
        }
      }
      for (Folder child : store.hierarchy().children(folderId)) {
        apply.add(new RecordChange.FolderUpserted(child.withParentId(null, now)));
        undo.add(new RecordChange.FolderUpserted(child));
      }
      apply.add(new RecordChange.FolderDeleted(folderId));
      undo.add(new RecordChange.FolderUpserted(folder));
      return optimistic("deleteFolder", Map.of("folderId", folderId), apply, undo,
          () -> repo.deleteFolder(folderId).toSingleDefault(Boolean.TRUE), ok -> null);
    }).ignoreElement();
  }

  // Links

  public Single<Link> addLink(String url, String title, String folderId) {
    return addLink(url, title, null, Platform.OTHER, folderId, List.of());
  }

  public Single<Link> addLink(
      String url, String title, String description, Platform platform, String folderId,
      List<String> tags) {
    return Single.defer(() -> {
      String trimmed = url == null ? "" : url.trim();
      if (trimmed.isEmpty()) {
        throw new InvariantViolationException(Violation.INVALID_INPUT, "A link needs a URL");
      }
      if (folderId != null) requireFolder(folderId);
      LinkRepository repo = reconciler.activeRepository();
      Instant now = now();
      Link link = new Link(repo.newLinkId(), trimmed, title, description, null, null, platform,
          folderId, false, tags, null, now, now, null);
      return optimistic("addLink", Map.of("url", trimmed),
          List.of(new RecordChange.LinkUpserted(link)),
          List.of(new RecordChange.LinkDeleted(link.id())),
          () -> repo.addLink(link),
          RecordChange.LinkUpserted::new);
    });
  }

  public Single<Link> updateLink(String linkId, UnaryOperator<Link> change) {
    return Single.defer(() -> {
      Link before = requireLink(linkId);
      Link after = Objects.requireNonNull(change.apply(before), "change result");
      if (after.folderId() != null && !after.folderId().equals(before.folderId())) {
        requireFolder(after.folderId());
      }
      return saveLink("updateLink", before, after);
    });
  }

  public Single<Link> moveLink(String linkId, String folderId) {
    return updateLink(linkId, l -> l.withFolderId(folderId, now()));
  }

  public Single<Link> toggleFavorite(String linkId) {
    return updateLink(linkId, l -> l.withFavorite(!l.favorite(), now()));
  }

  public Single<Link> trashLink(String linkId) {
    return Single.defer(() -> {
      Link before = requireLink(linkId);
      LinkRepository repo = reconciler.activeRepository();
      return optimistic("trashLink", Map.of("linkId", linkId),
          List.of(new RecordChange.LinkUpserted(before.withDeletedAt(now(), now()))),
          List.of(new RecordChange.LinkUpserted(before)),
          () -> repo.trashLink(linkId),
          RecordChange.LinkUpserted::new);
    });
  }

  public Single<Link> restoreLink(String linkId) {
    return Single.defer(() -> {
      Link before = requireLink(linkId);
      LinkRepository repo = reconciler.activeRepository();
      return optimistic("restoreLink", Map.of("linkId", linkId),
          List.of(new RecordChange.LinkUpserted(before.withDeletedAt(null, now()))),
          List.of(new RecordChange.LinkUpserted(before)),
          () -> repo.restoreLink(linkId),
          RecordChange.LinkUpserted::new);
    });
  }

  public Completable permanentlyDeleteLink(String linkId) {
    return Single.defer(() -> {
      Link before = requireLink(linkId);
      LinkRepository repo = reconciler.activeRepository();
      return optimistic("permanentlyDeleteLink", Map.of("linkId", linkId),
          List.of(new RecordChange.LinkDeleted(linkId)),
          List.of(new RecordChange.LinkUpserted(before)),
          () -> repo.permanentlyDeleteLink(linkId).toSingleDefault(Boolean.TRUE),
          ok -> null);
    }).ignoreElement();
  }

  public Completable bulkTrash(Collection<String> linkIds) {
    return bulk("bulkTrash", linkIds, l -> l.withDeletedAt(now(), now()),
        (repo, ids) -> repo.bulkTrash(ids));
  }

  public Completable bulkRestore(Collection<String> linkIds) {
    return bulk("bulkRestore", linkIds, l -> l.withDeletedAt(null, now()),
        (repo, ids) -> repo.bulkRestore(ids));
  }

  public Completable bulkMove(Collection<String> linkIds, String folderId) {
    return Completable.defer(() -> {
      if (folderId != null) requireFolder(folderId);
      return bulk("bulkMove", linkIds, l -> l.withFolderId(folderId, now()),
          (repo, ids) -> repo.bulkMove(ids, folderId));
    });
  }

  /** Permanently deletes everything in the trash; emits how many links went. */
  public Single<Integer> emptyTrash() {
    return Single.defer(() -> {
      LinkRepository repo = reconciler.activeRepository();
      List<RecordChange> apply = new ArrayList<>();
      List<RecordChange> undo = new ArrayList<>();
      for (Link l : store.trash()) {
        apply.add(new RecordChange.LinkDeleted(l.id()));
        undo.add(new RecordChange.LinkUpserted(l));
      }
      return optimistic("emptyTrash", Map.of("count", apply.size()), apply, undo,
          repo::emptyTrash, n -> null);
    });
  }

  public Single<Integer> restoreAllFromTrash() {
    return Single.defer(() -> {
      LinkRepository repo = reconciler.activeRepository();
      List<RecordChange> apply = new ArrayList<>();
      List<RecordChange> undo = new ArrayList<>();
      for (Link l : store.trash()) {
        apply.add(new RecordChange.LinkUpserted(l.withDeletedAt(null, now())));
        undo.add(new RecordChange.LinkUpserted(l));
      }
      return optimistic("restoreAllFromTrash", Map.of("count", apply.size()), apply, undo,
          repo::restoreAllFromTrash, n -> null);
    });
  }

  private interface BulkCall {
    Completable run(LinkRepository repo, List<String> ids);
  }

  private Completable bulk(
      String op, Collection<String> linkIds, UnaryOperator<Link> change, BulkCall call) {
    return Single.defer(() -> {
      LinkRepository repo = reconciler.activeRepository();
      List<String> ids = new ArrayList<>(new LinkedHashSet<>(linkIds));
      List<RecordChange> apply = new ArrayList<>();
      List<RecordChange> undo = new ArrayList<>();
      for (String id : ids) {
        Link before = requireLink(id);
        apply.add(new RecordChange.LinkUpserted(change.apply(before)));
        undo.add(new RecordChange.LinkUpserted(before));
      }
      return optimistic(op, Map.of("count", ids.size()), apply, undo,
          () -> call.run(repo, ids).toSingleDefault(Boolean.TRUE), ok -> null);
    }).ignoreElement();
  }

  private Single<Folder> saveFolder(String op, Folder before, Folder after) {
    LinkRepository repo = reconciler.activeRepository();
    return optimistic(op, Map.of("folderId", before.id()),
        List.of(new RecordChange.FolderUpserted(after)),
        List.of(new RecordChange.FolderUpserted(before)),
        () -> repo.updateFolder(after),
        RecordChange.FolderUpserted::new);
  }

  private Single<Link> saveLink(String op, Link before, Link after) {
    LinkRepository repo = reconciler.activeRepository();
    Link stamped = Objects.equals(before.updatedAt(), after.updatedAt())
        ? after.withUpdatedAt(now())
        : after;
    return optimistic(op, Map.of("linkId", before.id()),
        List.of(new RecordChange.LinkUpserted(stamped)),
        List.of(new RecordChange.LinkUpserted(before)),
        () -> repo.updateLink(stamped),
        RecordChange.LinkUpserted::new);
  }

  /**
   * Applies {@code apply} to the mirror, runs the backend call, and on failure reverts with
   * {@code undo}. {@code confirm} maps the backend's answer to a mirror change, or null for none.
   */
  private <T> Single<T> optimistic(
      String op,
      Map<String, ?> context,
      List<RecordChange> apply,
      List<RecordChange> undo,
      Supplier<Single<T>> call,
      Function<T, RecordChange> confirm) {
    apply.forEach(store::apply);
    return Single.defer(call)
        .timeout(mutationTimeoutMs, TimeUnit.MILLISECONDS, scheduler)
        .doOnSuccess(result -> {
          RecordChange confirmed = confirm.apply(result);
          if (confirmed != null) store.apply(confirmed);
        })
        .onErrorResumeNext(err -> {
          for (int i = undo.size() - 1; i >= 0; i--) store.revert(undo.get(i));
          LinkVaultException classified = ErrorClassifier.classify(err, op, context);
          if (classified instanceof OperationFailedException) {
            log.error("[linkvault] {} failed; local change rolled back {}", op, classified.details(), err);
          } else {
            log.warn("[linkvault] {} rejected ({}); local change rolled back", op, classified.code());
          }
          return Single.error(classified);
        });
  }

  private Folder requireFolder(String folderId) {
    return store.folder(folderId).orElseThrow(() -> new InvariantViolationException(
        Violation.UNKNOWN_FOLDER, "Folder does not exist", Map.of("folderId", String.valueOf(folderId))));
  }

  private Link requireLink(String linkId) {
    return store.link(linkId).orElseThrow(() -> new InvariantViolationException(
        Violation.UNKNOWN_LINK, "Link does not exist", Map.of("linkId", String.valueOf(linkId))));
  }

  private static String requireName(String name) {
    String trimmed = name == null ? "" : name.trim();
    if (trimmed.isEmpty()) {
      throw new InvariantViolationException(Violation.INVALID_INPUT, "A folder needs a name");
    }
    return trimmed;
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }
}
