package cafe.woden.linkvault.data;

import cafe.woden.linkvault.error.ErrorClassifier;
import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.model.Resources;
import cafe.woden.linkvault.model.RowCodec;
import cafe.woden.linkvault.util.BackoffPolicy;
import cafe.woden.linkvault.util.RetryWithBackoff;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Supplier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * One signed-in user's data in the remote store.
 *
 * <p>Every backend call is retried on transient failures with the configured policy; other
 * failures propagate unchanged.
 */
public class RemoteLinkRepository implements LinkRepository {

  private static final Comparator<Link> NEWEST_FIRST =
      Comparator.comparing(Link::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

  private final RemoteDataBackend backend;
  private final String userId;
  private final BackoffPolicy retry;
  private final Scheduler scheduler;
  private final RowCodec codec = new RowCodec();

  public RemoteLinkRepository(
      RemoteDataBackend backend, String userId, BackoffPolicy retry, Scheduler scheduler) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.userId = Objects.requireNonNull(userId, "userId");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public String userId() {
    return userId;
  }

  @Override
  public StorageSource source() {
    return StorageSource.REMOTE;
  }

  @Override
  public String newLinkId() {
    return UUID.randomUUID().toString();
  }

  @Override
  public String newFolderId() {
    return UUID.randomUUID().toString();
  }

  @Override
  public Single<List<Link>> listLinks() {
    return listLinksIncludingDeleted().map(all -> {
      List<Link> out = new ArrayList<>();
      for (Link l : all) {
        if (!l.inTrash()) out.add(l);
      }
      return out;
    });
  }

  @Override
  public Single<List<Link>> listLinksIncludingDeleted() {
    return retrying(() -> backend.select(Resources.LINKS, Map.of("user_id", userId)))
        .map(rows -> {
          List<Link> out = decodeAll(rows, Link.class);
          out.sort(NEWEST_FIRST);
          return out;
        });
  }

  @Override
  public Single<Link> addLink(Link link) {
    return upsertLink(link);
  }

  @Override
  public Single<Link> updateLink(Link link) {
    return findLink(link.id()).flatMap(existing -> upsertLink(link));
  }

  @Override
  public Single<Link> trashLink(String linkId) {
    return changeLink(linkId, l -> l.withDeletedAt(now(), now()));
  }

  @Override
  public Single<Link> restoreLink(String linkId) {
    return changeLink(linkId, l -> l.withDeletedAt(null, now()));
  }

  @Override
  public Completable permanentlyDeleteLink(String linkId) {
    return retryingCompletable(() -> backend.delete(Resources.LINKS, linkId));
  }

  @Override
  public Completable bulkTrash(Collection<String> linkIds) {
    return Flowable.fromIterable(List.copyOf(linkIds))
        .concatMapSingle(this::trashLink)
        .ignoreElements();
  }

  @Override
  public Completable bulkRestore(Collection<String> linkIds) {
    return Flowable.fromIterable(List.copyOf(linkIds))
        .concatMapSingle(this::restoreLink)
        .ignoreElements();
  }

  @Override
  public Completable bulkMove(Collection<String> linkIds, String folderId) {
    return Flowable.fromIterable(List.copyOf(linkIds))
        .concatMapSingle(id -> changeLink(id, l -> l.withFolderId(folderId, now())))
        .ignoreElements();
  }

  @Override
  public Single<Integer> emptyTrash() {
    return listLinksIncludingDeleted().flatMap(all -> Flowable.fromIterable(all)
        .filter(Link::inTrash)
        .concatMapSingle(l -> permanentlyDeleteLink(l.id()).toSingleDefault(1))
        .reduce(0, Integer::sum));
  }

  @Override
  public Single<Integer> restoreAllFromTrash() {
    return listLinksIncludingDeleted().flatMap(all -> Flowable.fromIterable(all)
        .filter(Link::inTrash)
        .concatMapSingle(l -> upsertLink(l.withDeletedAt(null, now())).map(x -> 1))
        .reduce(0, Integer::sum));
  }

  @Override
  public Single<List<Folder>> listFolders() {
    return retrying(() -> backend.select(Resources.FOLDERS, Map.of("user_id", userId)))
        .map(rows -> decodeAll(rows, Folder.class));
  }

  @Override
  public Single<Folder> addFolder(Folder folder) {
    return upsertFolder(folder);
  }

  @Override
  public Single<Folder> updateFolder(Folder folder) {
    return findFolder(folder.id()).flatMap(existing -> upsertFolder(folder));
  }

  @Override
  public Completable deleteFolder(String folderId) {
    Completable detachLinks = retrying(() -> backend.select(Resources.LINKS,
            Map.of("user_id", userId, "folder_id", folderId)))
        .flatMapCompletable(rows -> Flowable.fromIterable(decodeAll(rows, Link.class))
            .concatMapSingle(l -> upsertLink(l.withFolderId(null, now())))
            .ignoreElements());
    Completable promoteChildren = retrying(() -> backend.select(Resources.FOLDERS,
            Map.of("user_id", userId, "parent_id", folderId)))
        .flatMapCompletable(rows -> Flowable.fromIterable(decodeAll(rows, Folder.class))
            .concatMapSingle(f -> upsertFolder(f.withParentId(null, now())))
            .ignoreElements());
    return findFolder(folderId).ignoreElement()
        .andThen(detachLinks)
        .andThen(promoteChildren)
        .andThen(retryingCompletable(() -> backend.delete(Resources.FOLDERS, folderId)));
  }

  @Override
  public Single<DataExport> exportData() {
    return Single.zip(listFolders(), listLinksIncludingDeleted(),
        (folders, links) -> new DataExport(StorageSource.REMOTE, folders, links, now()));
  }

  private Single<Link> findLink(String linkId) {
    return retrying(() -> backend.select(Resources.LINKS, Map.of("user_id", userId, "id", linkId)))
        .map(rows -> {
          if (rows.isEmpty()) {
            throw new InvariantViolationException(Violation.UNKNOWN_LINK, "Link does not exist",
                Map.of("linkId", linkId));
          }
          return codec.fromRow(rows.get(0), Link.class);
        });
  }

  private Single<Folder> findFolder(String folderId) {
    return retrying(() -> backend.select(Resources.FOLDERS, Map.of("user_id", userId, "id", folderId)))
        .map(rows -> {
          if (rows.isEmpty()) {
            throw new InvariantViolationException(Violation.UNKNOWN_FOLDER, "Folder does not exist",
                Map.of("folderId", folderId));
          }
          return codec.fromRow(rows.get(0), Folder.class);
        });
  }

  private Single<Link> changeLink(String linkId, UnaryOperator<Link> change) {
    return findLink(linkId).flatMap(l -> upsertLink(change.apply(l)));
  }

  private Single<Link> upsertLink(Link link) {
    Map<String, Object> row = codec.toRow(link.withUserId(userId));
    return retrying(() -> backend.upsert(Resources.LINKS, row))
        .map(stored -> codec.fromRow(stored, Link.class));
  }

  private Single<Folder> upsertFolder(Folder folder) {
    Map<String, Object> row = codec.toRow(folder.withUserId(userId));
    return retrying(() -> backend.upsert(Resources.FOLDERS, row))
        .map(stored -> codec.fromRow(stored, Folder.class));
  }

  private <T> List<T> decodeAll(List<Map<String, Object>> rows, Class<T> type) {
    List<T> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) out.add(codec.fromRow(row, type));
    return out;
  }

  private <T> Single<T> retrying(Supplier<Single<T>> call) {
    return RetryWithBackoff.single(Single.defer(call), retry, scheduler, ErrorClassifier::isTransient);
  }

  private Completable retryingCompletable(
      Supplier<Completable> call) {
    return RetryWithBackoff.completable(
        Completable.defer(call), retry, scheduler, ErrorClassifier::isTransient);
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }
}
