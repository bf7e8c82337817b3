package cafe.woden.linkvault.realtime;

import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * What to listen to.
 *
 * @param resource table or stream name
 * @param event change types of interest
 * @param filter optional row filter in the backend's syntax, e.g. {@code user_id=eq.42}
 * @param schema namespace of the resource
 */
@ValueObject
public record SubscriptionConfig(String resource, EventFilter event, String filter, String schema) {

  public SubscriptionConfig {
    resource = Objects.requireNonNull(resource, "resource").trim();
    if (resource.isEmpty()) throw new IllegalArgumentException("resource must not be blank");
    if (event == null) event = EventFilter.ALL;
    filter = filter == null || filter.isBlank() ? null : filter.trim();
    schema = schema == null || schema.isBlank() ? "public" : schema.trim();
  }

  public static SubscriptionConfig of(String resource) {
    return new SubscriptionConfig(resource, EventFilter.ALL, null, null);
  }

  public static SubscriptionConfig of(String resource, String filter) {
    return new SubscriptionConfig(resource, EventFilter.ALL, filter, null);
  }

  /** Stable key used in subscription ids and log lines. */
  public String key() {
    return resource + "_" + event.name().toLowerCase(Locale.ROOT) + "_" + schema + "_"
        + (filter == null ? "all" : filter);
  }
}
