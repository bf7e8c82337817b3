package cafe.woden.linkvault.loopback;

import cafe.woden.linkvault.data.RemoteDataBackend;
import cafe.woden.linkvault.error.AuthenticationRequiredException;
import cafe.woden.linkvault.error.TransientBackendException;
import cafe.woden.linkvault.model.AuthUser;
import cafe.woden.linkvault.realtime.ChangeFeedTransport;
import cafe.woden.linkvault.realtime.ChangeType;
import cafe.woden.linkvault.realtime.FeedHandle;
import cafe.woden.linkvault.realtime.FeedListener;
import cafe.woden.linkvault.realtime.FeedRecord;
import cafe.woden.linkvault.realtime.SubscriptionConfig;
import cafe.woden.linkvault.session.AuthBackend;
import cafe.woden.linkvault.session.AuthStateChange;
import cafe.woden.linkvault.session.BackendSession;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory stand-in for the managed backend: credentials, row storage and change feeds.
 *
 * <p>One instance may be shared by several client contexts, which then behave like browser tabs
 * sharing one cookie jar. The {@code drop*}, {@code refuse*}, {@code fail*} and {@code expire*}
 * methods inject the failures the sync core has to survive.
 */
public class LoopbackBackend implements AuthBackend, ChangeFeedTransport, RemoteDataBackend {
  private static final Logger log = LoggerFactory.getLogger(LoopbackBackend.class);

  private static final Duration SESSION_TTL = Duration.ofHours(1);

  private record Account(AuthUser user, String password) {}

  private final Map<String, Account> accounts = new ConcurrentHashMap<>();
  private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();
  private final List<OpenFeed> feeds = new CopyOnWriteArrayList<>();
  private final FlowableProcessor<AuthStateChange> authChanges =
      PublishProcessor.<AuthStateChange>create().toSerialized();
  private final AtomicInteger transientFailures = new AtomicInteger();
  private final AtomicInteger sessionCalls = new AtomicInteger();

  private volatile BackendSession session;
  private volatile boolean refuseConnections;

  // Auth

  @Override
  public Maybe<BackendSession> getSession() {
    return Maybe.defer(() -> {
      sessionCalls.incrementAndGet();
      failIfScheduled("getSession");
      return Maybe.fromOptional(Optional.ofNullable(session));
    });
  }

  @Override
  public Maybe<AuthUser> getUser() {
    return Maybe.defer(() -> {
      failIfScheduled("getUser");
      BackendSession s = session;
      return s == null ? Maybe.empty() : Maybe.just(s.user());
    });
  }

  @Override
  public Single<BackendSession> refreshSession() {
    return Single.defer(() -> {
      BackendSession s = session;
      if (s == null) return Single.error(new AuthenticationRequiredException("No session to refresh"));
      BackendSession refreshed = new BackendSession(s.user(), Instant.now().plus(SESSION_TTL));
      session = refreshed;
      authChanges.onNext(AuthStateChange.of(AuthStateChange.Event.TOKEN_REFRESHED, refreshed));
      return Single.just(refreshed);
    });
  }

  @Override
  public Flowable<AuthStateChange> authStateChanges() {
    return authChanges.onBackpressureBuffer();
  }

  @Override
  public Single<AuthUser> signIn(String email, String password) {
    return Single.defer(() -> {
      Account acct = accounts.get(normalizeEmail(email));
      if (acct == null || !acct.password().equals(password)) {
        return Single.error(new AuthenticationRequiredException("Invalid email or password"));
      }
      startSession(acct.user());
      return Single.just(acct.user());
    });
  }

  @Override
  public Single<AuthUser> signUp(String email, String password) {
    return Single.defer(() -> {
      String key = normalizeEmail(email);
      if (key.isEmpty() || password == null || password.length() < 6) {
        return Single.error(new AuthenticationRequiredException("Email and a 6+ character password are required"));
      }
      AuthUser user = new AuthUser(UUID.randomUUID().toString(), key);
      if (accounts.putIfAbsent(key, new Account(user, password)) != null) {
        return Single.error(new AuthenticationRequiredException("Account already exists"));
      }
      startSession(user);
      return Single.just(user);
    });
  }

  @Override
  public Completable signOut() {
    return Completable.fromAction(() -> {
      if (session == null) return;
      session = null;
      authChanges.onNext(AuthStateChange.of(AuthStateChange.Event.SIGNED_OUT, null));
    });
  }

  /** Forgets the credentials without telling anyone, like a token expiring server-side. */
  public void expireSessionSilently() {
    session = null;
  }

  public int sessionLookups() {
    return sessionCalls.get();
  }

  // Rows

  @Override
  public Single<List<Map<String, Object>>> select(String resource, Map<String, Object> equalTo) {
    return Single.fromCallable(() -> {
      failIfScheduled("select " + resource);
      requireSession();
      List<Map<String, Object>> out = new ArrayList<>();
      for (Map<String, Object> row : table(resource).values()) {
        if (matches(row, equalTo)) out.add(new LinkedHashMap<>(row));
      }
      return out;
    });
  }

  @Override
  public Single<Map<String, Object>> upsert(String resource, Map<String, Object> row) {
    return Single.fromCallable(() -> {
      failIfScheduled("upsert " + resource);
      requireSession();
      String id = String.valueOf(Objects.requireNonNull(row.get("id"), "row id"));
      Map<String, Object> stored = new LinkedHashMap<>(row);
      Map<String, Object> before = table(resource).put(id, stored);
      emit(resource, new FeedRecord(before == null ? "INSERT" : "UPDATE",
          before == null ? null : new LinkedHashMap<>(before), new LinkedHashMap<>(stored)));
      return new LinkedHashMap<>(stored);
    });
  }

  @Override
  public Completable delete(String resource, String id) {
    return Completable.fromAction(() -> {
      failIfScheduled("delete " + resource);
      requireSession();
      Map<String, Object> before = table(resource).remove(id);
      if (before != null) emit(resource, new FeedRecord("DELETE", new LinkedHashMap<>(before), null));
    });
  }

  /** Makes the next {@code count} backend calls fail with a transient error. */
  public void failNextCalls(int count) {
    transientFailures.set(Math.max(0, count));
  }

  // Change feeds

  @Override
  public FeedHandle open(SubscriptionConfig config, FeedListener listener) {
    if (refuseConnections) {
      throw new TransientBackendException("Change feed unavailable",
          Map.of("resource", config.resource()), null);
    }
    OpenFeed feed = new OpenFeed(config, listener);
    feeds.add(feed);
    listener.onConnected();
    return () -> feeds.remove(feed);
  }

  /** Cuts every open feed as if the network went away. */
  public void dropConnections() {
    List<OpenFeed> dropped = new ArrayList<>(feeds);
    feeds.clear();
    for (OpenFeed f : dropped) {
      f.listener().onConnectionLost(new TransientBackendException("Connection lost",
          Map.of("resource", f.config().resource()), null));
    }
    log.debug("[linkvault] Loopback dropped {} feed(s)", dropped.size());
  }

  public void refuseConnections(boolean refuse) {
    this.refuseConnections = refuse;
  }

  public int openFeeds() {
    return feeds.size();
  }

  /** Pushes a raw record to feeds on {@code resource}, bypassing storage. */
  public void pushRaw(String resource, FeedRecord record) {
    for (OpenFeed f : feeds) {
      if (f.config().resource().equals(resource)) f.listener().onRecord(record);
    }
  }

  private void emit(String resource, FeedRecord record) {
    Map<String, Object> row = record.after() != null ? record.after() : record.before();
    for (OpenFeed f : feeds) {
      if (!f.config().resource().equals(resource)) continue;
      boolean wanted = ChangeType.parse(record.eventType())
          .map(t -> f.config().event().accepts(t))
          .orElse(true);
      if (!wanted) continue;
      if (!filterMatches(f.config().filter(), row)) continue;
      f.listener().onRecord(record);
    }
  }

  private void startSession(AuthUser user) {
    BackendSession s = new BackendSession(user, Instant.now().plus(SESSION_TTL));
    session = s;
    authChanges.onNext(AuthStateChange.of(AuthStateChange.Event.SIGNED_IN, s));
  }

  private void requireSession() {
    if (session == null) throw new AuthenticationRequiredException("Not signed in");
  }

  private void failIfScheduled(String what) {
    if (transientFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new TransientBackendException("Simulated failure of " + what);
    }
  }

  private Map<String, Map<String, Object>> table(String resource) {
    return tables.computeIfAbsent(resource, r -> new ConcurrentHashMap<>());
  }

  private static boolean matches(Map<String, Object> row, Map<String, Object> equalTo) {
    if (equalTo == null) return true;
    for (Map.Entry<String, Object> e : equalTo.entrySet()) {
      if (!Objects.equals(String.valueOf(row.get(e.getKey())), String.valueOf(e.getValue()))) {
        return false;
      }
    }
    return true;
  }

  /** Understands {@code column=eq.value}; anything else matches everything. */
  private static boolean filterMatches(String filter, Map<String, Object> row) {
    if (filter == null || row == null) return true;
    int eq = filter.indexOf("=eq.");
    if (eq <= 0) return true;
    String column = filter.substring(0, eq);
    String value = filter.substring(eq + 4);
    return value.equals(String.valueOf(row.get(column)));
  }

  private static String normalizeEmail(String email) {
    return Objects.toString(email, "").trim().toLowerCase(Locale.ROOT);
  }

  private record OpenFeed(SubscriptionConfig config, FeedListener listener) {}
}
