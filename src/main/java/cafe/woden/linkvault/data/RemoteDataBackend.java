package cafe.woden.linkvault.data;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Row-level access to the remote store. Rows are snake_case column maps.
 *
 * <p>Failures surface as {@code TransientBackendException} when a retry may help and
 * {@code AuthenticationRequiredException} when the credentials are no longer accepted.
 */
@ApplicationLayer
public interface RemoteDataBackend {

  /** Rows of {@code resource} whose columns equal every entry of {@code equalTo}. */
  Single<List<Map<String, Object>>> select(String resource, Map<String, Object> equalTo);

  /** Inserts or replaces the row with the same {@code id}; emits the stored row. */
  Single<Map<String, Object>> upsert(String resource, Map<String, Object> row);

  Completable delete(String resource, String id);
}
