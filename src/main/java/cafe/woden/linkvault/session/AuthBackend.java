package cafe.woden.linkvault.session;

import cafe.woden.linkvault.model.AuthUser;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Credential/session backend.
 *
 * <p>Every operation is fallible and may be slow. An empty {@link Maybe} means "no credentials",
 * which is an answer rather than a failure.
 */
@ApplicationLayer
public interface AuthBackend {

  Maybe<BackendSession> getSession();

  Maybe<AuthUser> getUser();

  Single<BackendSession> refreshSession();

  Flowable<AuthStateChange> authStateChanges();

  Single<AuthUser> signIn(String email, String password);

  Single<AuthUser> signUp(String email, String password);

  Completable signOut();
}
