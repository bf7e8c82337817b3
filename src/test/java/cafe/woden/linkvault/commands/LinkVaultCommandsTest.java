package cafe.woden.linkvault.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.data.LinkRepository;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.error.OperationFailedException;
import cafe.woden.linkvault.error.TransientBackendException;
import cafe.woden.linkvault.hierarchy.HierarchyGuard;
import cafe.woden.linkvault.mode.ModeReconciler;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.store.LinkVaultStore;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LinkVaultCommandsTest {

  private static final Instant T0 = Instant.EPOCH;

  private final TestScheduler scheduler = new TestScheduler();
  private final LinkVaultProperties props = LinkVaultProperties.defaults();
  private final ModeReconciler reconciler = mock(ModeReconciler.class);
  private final LinkRepository repo = mock(LinkRepository.class);
  private final LinkVaultStore store = new LinkVaultStore(props);
  private final LinkVaultCommands commands =
      new LinkVaultCommands(reconciler, store, new HierarchyGuard(props), scheduler, props);

  @BeforeEach
  void setUp() {
    when(reconciler.activeRepository()).thenReturn(repo);
    when(repo.newFolderId()).thenReturn("new-folder");
    when(repo.newLinkId()).thenReturn("new-link");
    store.replaceAll(
        List.of(Folder.root("work", "Work", T0), Folder.child("docs", "work", "Docs", T0)),
        List.of(Link.of("l1", "https://a.example", "A", "docs", T0)));
  }

  @Test
  void successfulCreateStaysInTheMirror() {
    when(repo.addFolder(any())).thenAnswer(inv -> Single.just(inv.getArgument(0)));

    Folder created = commands.createFolder("  Reading  ", "work").blockingGet();

    assertThat(created.name()).isEqualTo("Reading");
    assertThat(store.folder("new-folder")).contains(created);
  }

  @Test
  void nestingUnderASubFolderIsRejectedBeforeTheBackend() {
    commands.createFolder("Too deep", "docs")
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.NESTING_TOO_DEEP);

    verify(repo, never()).addFolder(any());
    assertThat(store.folders()).hasSize(2);
  }

  @Test
  void movingAParentIntoItsChildIsACycle() {
    commands.moveFolder("work", "docs")
        .test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.CYCLE);
  }

  @Test
  void backendFailureRollsTheMirrorBack() {
    when(repo.updateLink(any())).thenReturn(Single.error(new IllegalStateException("constraint")));

    TestObserver<Link> result = commands.toggleFavorite("l1").test();

    result.assertError(OperationFailedException.class);
    assertThat(store.link("l1")).map(Link::favorite).contains(false);
  }

  @Test
  void transientFailureIsClassifiedAndRolledBack() {
    when(repo.trashLink(anyString())).thenReturn(Single.error(new TransientBackendException("offline")));

    commands.trashLink("l1").test().assertError(TransientBackendException.class);

    assertThat(store.activeLinks()).extracting(Link::id).containsExactly("l1");
  }

  @Test
  void optimisticChangeIsVisibleBeforeTheBackendAnswersAndRevertsOnTimeout() {
    when(repo.addLink(any())).thenReturn(Single.never());

    TestObserver<Link> result = commands.addLink("https://b.example", "B", null).test();
    assertThat(store.link("new-link")).isPresent();

    scheduler.advanceTimeBy(props.backend().mutationTimeoutMs(), TimeUnit.MILLISECONDS);

    result.assertError(TransientBackendException.class);
    assertThat(store.link("new-link")).isEmpty();
  }

  @Test
  void deleteFolderPromotesChildrenAndUnfilesLinksThenRestoresOnFailure() {
    when(repo.deleteFolder("work")).thenReturn(Completable.error(new TransientBackendException("offline")));
    when(repo.deleteFolder("docs")).thenReturn(Completable.complete());

    commands.deleteFolder("work").test().assertError(TransientBackendException.class);
    assertThat(store.folder("docs")).map(Folder::parentId).contains("work");
    assertThat(store.folder("work")).isPresent();

    commands.deleteFolder("docs").test().assertComplete();
    assertThat(store.folder("docs")).isEmpty();
    assertThat(store.link("l1")).map(Link::folderId).isEmpty();
  }

  @Test
  void inputIsValidated() {
    commands.addLink("   ", "blank", null).test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.INVALID_INPUT);
    commands.renameFolder("work", "").test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.INVALID_INPUT);
    commands.trashLink("missing").test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.UNKNOWN_LINK);
    commands.moveLink("l1", "missing").test()
        .assertError(e -> e instanceof InvariantViolationException ive
            && ive.violation() == Violation.UNKNOWN_FOLDER);
  }

  @Test
  void signedOutCommandsNeedAuthentication() {
    when(reconciler.activeRepository()).thenThrow(new AuthenticationRequiredException("signed out"));

    commands.addLink("https://c.example", "C", null).test()
        .assertError(AuthenticationRequiredException.class);
    assertThat(store.activeLinks()).hasSize(1);
  }

  @Test
  void emptyTrashRemovesOnlyTrashedLinks() {
    when(repo.trashLink("l1")).thenAnswer(inv -> Single.just(store.link("l1").orElseThrow()));
    commands.trashLink("l1").blockingGet();
    when(repo.emptyTrash()).thenReturn(Single.just(1));

    assertThat(commands.emptyTrash().blockingGet()).isEqualTo(1);
    assertThat(store.snapshot().links()).isEmpty();
  }
}
