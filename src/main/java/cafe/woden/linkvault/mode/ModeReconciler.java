package cafe.woden.linkvault.mode;

import cafe.woden.linkvault.data.GuestLinkRepository;
import cafe.woden.linkvault.data.GuestSessionStore;
import cafe.woden.linkvault.data.LinkRepository;
import cafe.woden.linkvault.data.RemoteRepositoryFactory;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.session.SessionState;
import cafe.woden.linkvault.session.SessionStatePort;
import cafe.woden.linkvault.store.LinkVaultStore;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which storage backend is authoritative and performs the handoff on every session
 * transition.
 *
 * <pre>
 * SIGNED_OUT    --Ready(user)-------------> AUTHENTICATED
 * GUEST         --Ready(user)-------------> AUTHENTICATED  (guest session off, guest data kept)
 * AUTHENTICATED --Ready(none)-------------> SIGNED_OUT
 * any           --enterGuestMode()--------> GUEST          (explicit only)
 * GUEST         --leaveGuestMode()--------> AUTHENTICATED | SIGNED_OUT
 * </pre>
 *
 * <p>Guest data is never merged into an account and never deleted implicitly. Remote data is never
 * touched by a mode change. Every transition reloads the local mirror from the new backend.
 */
@Component
@ApplicationLayer
public class ModeReconciler {
  private static final Logger log = LoggerFactory.getLogger(ModeReconciler.class);

  private final SessionStatePort session;
  private final GuestSessionStore guestSessions;
  private final GuestLinkRepository guestRepository;
  private final RemoteRepositoryFactory remoteRepositories;
  private final LinkVaultStore store;

  private final BehaviorProcessor<ModeState> states =
      BehaviorProcessor.createDefault(ModeState.signedOut(0));
  private final CompositeDisposable disposables = new CompositeDisposable();

  private ModeState current = ModeState.signedOut(0);
  private LinkRepository repository;
  // Set when a signed-in user explicitly chose guest data; same-user session updates keep it.
  private String guestChosenBy;
  private boolean started;

  public ModeReconciler(
      SessionStatePort session,
      GuestSessionStore guestSessions,
      GuestLinkRepository guestRepository,
      RemoteRepositoryFactory remoteRepositories,
      LinkVaultStore store
  ) {
    this.session = session;
    this.guestSessions = guestSessions;
    this.guestRepository = guestRepository;
    this.remoteRepositories = remoteRepositories;
    this.store = store;
  }

  /** Restores a persisted guest session, then follows session transitions. Idempotent. */
  public synchronized void start() {
    if (started) return;
    started = true;
    if (guestSessions.isActive()) {
      log.info("[linkvault] Restoring guest session");
      transition(Mode.GUEST, session.currentUser().map(AuthUser::id));
    }
    disposables.add(session.states()
        .filter(SessionState::isReady)
        .subscribe(this::onSessionResolved,
            err -> log.error("[linkvault] Mode reconciler stopped following the session", err)));
  }

  public synchronized ModeState current() {
    return current;
  }

  public Flowable<ModeState> states() {
    return states.onBackpressureLatest();
  }

  /**
   * The backend reads and writes must target right now.
   *
   * @throws AuthenticationRequiredException when signed out and not in guest mode
   */
  public synchronized LinkRepository activeRepository() {
    if (current.mode() == Mode.SIGNED_OUT || repository == null) {
      throw new AuthenticationRequiredException("Sign in or continue as a guest first",
          Map.of("mode", current.mode().name()), null);
    }
    return repository;
  }

  /** Explicit switch to local-only data. Remote data is left alone. */
  public synchronized ModeState enterGuestMode() {
    guestSessions.activate();
    guestChosenBy = session.currentUser().map(AuthUser::id).orElse(null);
    return transition(Mode.GUEST, Optional.ofNullable(guestChosenBy));
  }

  /** Ends guest mode, keeping its data. Falls back to the signed-in account if there is one. */
  public synchronized ModeState leaveGuestMode() {
    if (current.mode() != Mode.GUEST) return current;
    guestSessions.deactivate();
    guestChosenBy = null;
    Optional<String> user = session.currentUser().map(AuthUser::id);
    return transition(user.isPresent() ? Mode.AUTHENTICATED : Mode.SIGNED_OUT, user);
  }

  /** The only way guest data is ever deleted. */
  public synchronized void clearGuestData() {
    guestSessions.clearAllGuestData();
    if (current.mode() == Mode.GUEST) {
      guestSessions.activate();
      subscribeReload(current.generation());
    }
  }

  /** Re-reads the active backend into the mirror. */
  public Completable reloadMirror() {
    long generation;
    synchronized (this) {
      generation = current.generation();
    }
    return reload(generation);
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
    states.onComplete();
  }

  private synchronized void onSessionResolved(SessionState state) {
    Optional<String> user = state.user().map(AuthUser::id);
    if (user.isPresent()) {
      if (current.mode() == Mode.AUTHENTICATED && current.userId().equals(user)) return;
      if (current.mode() == Mode.GUEST && user.get().equals(guestChosenBy)) return;
      if (current.mode() == Mode.GUEST) {
        guestSessions.deactivate();
      }
      guestChosenBy = null;
      transition(Mode.AUTHENTICATED, user);
      return;
    }
    guestChosenBy = null;
    if (current.mode() == Mode.AUTHENTICATED) {
      transition(Mode.SIGNED_OUT, Optional.empty());
    }
  }

  private ModeState transition(Mode mode, Optional<String> userId) {
    ModeState prev = current;
    ModeState next = new ModeState(mode, userId, prev.generation() + 1);
    switch (mode) {
      case GUEST:
        repository = guestRepository;
        break;
      case AUTHENTICATED:
        repository = remoteRepositories.forUser(userId.orElseThrow());
        break;
      default:
        repository = null;
        break;
    }
    current = next;
    log.info("[linkvault] Mode {} -> {}{}", prev.mode(), mode,
        userId.map(u -> " (" + u + ")").orElse(""));
    states.onNext(next);
    if (mode == Mode.SIGNED_OUT) {
      store.clear();
    } else {
      subscribeReload(next.generation());
    }
    return next;
  }

  private void subscribeReload(long generation) {
    disposables.add(reload(generation).subscribe(
        () -> log.debug("[linkvault] Mirror reloaded for generation {}", generation),
        err -> log.warn("[linkvault] Mirror reload failed: {}", err.toString())));
  }

  private Completable reload(long generation) {
    LinkRepository repo;
    synchronized (this) {
      repo = repository;
    }
    if (repo == null) {
      return Completable.fromAction(store::clear);
    }
    return Single.zip(repo.listFolders(), repo.listLinksIncludingDeleted(), Snapshot::new)
        .flatMapCompletable(s -> Completable.fromAction(() -> {
          synchronized (this) {
            if (current.generation() != generation || !Objects.equals(repository, repo)) {
              log.debug("[linkvault] Discarding mirror reload from an older mode");
              return;
            }
            store.replaceAll(s.folders(), s.links());
          }
        }));
  }

  private record Snapshot(List<Folder> folders, List<Link> links) {}
}
