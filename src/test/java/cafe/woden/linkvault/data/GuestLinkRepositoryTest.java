package cafe.woden.linkvault.data;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.storage.InMemoryKeyValueStore;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GuestLinkRepositoryTest {

  private static final Instant T0 = Instant.EPOCH;

  private final TestScheduler scheduler = new TestScheduler();
  private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
  private final GuestSessionStore sessions = new GuestSessionStore(store, scheduler);
  private final GuestLinkRepository repo = new GuestLinkRepository(store, sessions, scheduler);

  @BeforeEach
  void activate() {
    sessions.activate();
  }

  @Test
  void linksArePersistedNewestFirstWithGuestIds() {
    Link first = repo.addLink(Link.of(repo.newLinkId(), "https://a.example", "A", null, T0)).blockingGet();
    Link second = repo.addLink(Link.of(repo.newLinkId(), "https://b.example", "B", null, T0)).blockingGet();

    assertThat(first.id()).startsWith("guest_link_");
    assertThat(repo.listLinks().blockingGet()).extracting(Link::id).containsExactly(second.id(), first.id());
    assertThat(sessions.hasGuestData()).isTrue();
  }

  @Test
  void subFoldersAreNotAvailable() {
    Folder parent = repo.addFolder(Folder.root(repo.newFolderId(), "Reading", T0)).blockingGet();

    repo.addFolder(Folder.child(repo.newFolderId(), parent.id(), "Later", T0))
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.NOT_AVAILABLE_IN_GUEST_MODE);
  }

  @Test
  void folderNamesAreUniqueIgnoringCase() {
    repo.addFolder(Folder.root(repo.newFolderId(), "Recipes", T0)).blockingGet();

    repo.addFolder(Folder.root(repo.newFolderId(), "recipes", T0))
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.DUPLICATE_NAME);
  }

  @Test
  void renamingAFolderToItsOwnNameIsFine() {
    Folder f = repo.addFolder(Folder.root(repo.newFolderId(), "Recipes", T0)).blockingGet();

    Folder renamed = repo.updateFolder(f.withName("RECIPES", T0)).blockingGet();

    assertThat(renamed.name()).isEqualTo("RECIPES");
  }

  @Test
  void deletingAFolderUnfilesItsLinks() {
    Folder f = repo.addFolder(Folder.root(repo.newFolderId(), "Music", T0)).blockingGet();
    Link l = repo.addLink(Link.of(repo.newLinkId(), "https://m.example", "M", f.id(), T0)).blockingGet();

    repo.deleteFolder(f.id()).blockingAwait();

    assertThat(repo.listFolders().blockingGet()).isEmpty();
    assertThat(repo.listLinks().blockingGet()).singleElement()
        .satisfies(x -> {
          assertThat(x.id()).isEqualTo(l.id());
          assertThat(x.folderId()).isNull();
        });
  }

  @Test
  void linkIntoUnknownFolderIsRejected() {
    repo.addLink(Link.of(repo.newLinkId(), "https://x.example", "X", "nope", T0))
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.UNKNOWN_FOLDER);
  }

  @Test
  void trashLifecycle() {
    Link a = repo.addLink(Link.of(repo.newLinkId(), "https://a.example", "A", null, T0)).blockingGet();
    Link b = repo.addLink(Link.of(repo.newLinkId(), "https://b.example", "B", null, T0)).blockingGet();
    Link c = repo.addLink(Link.of(repo.newLinkId(), "https://c.example", "C", null, T0)).blockingGet();

    repo.bulkTrash(List.of(a.id(), b.id())).blockingAwait();
    assertThat(repo.listLinks().blockingGet()).extracting(Link::id).containsExactly(c.id());

    repo.restoreLink(a.id()).blockingGet();
    assertThat(repo.emptyTrash().blockingGet()).isEqualTo(1);
    assertThat(repo.listLinksIncludingDeleted().blockingGet())
        .extracting(Link::id)
        .containsExactlyInAnyOrder(a.id(), c.id());
    assertThat(repo.restoreAllFromTrash().blockingGet()).isZero();
  }

  @Test
  void unknownLinkIsReported() {
    repo.trashLink("guest_link_missing")
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.UNKNOWN_LINK);
  }

  @Test
  void exportCarriesEverything() {
    repo.addFolder(Folder.root(repo.newFolderId(), "One", T0)).blockingGet();
    repo.addLink(Link.of(repo.newLinkId(), "https://a.example", "A", null, T0)).blockingGet();

    DataExport export = repo.exportData().blockingGet();

    assertThat(export.source()).isEqualTo(StorageSource.GUEST);
    assertThat(export.folders()).hasSize(1);
    assertThat(export.links()).hasSize(1);
  }
}
