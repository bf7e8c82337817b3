package cafe.woden.linkvault.realtime;

import cafe.woden.linkvault.util.BackoffPolicy;
import java.util.Optional;

/** Per-subscription tuning. An empty debounce delivers every event as it arrives. */
public record SubscribeOptions(Optional<DebounceSpec> debounce, BackoffPolicy reconnect) {

  public SubscribeOptions {
    debounce = debounce == null ? Optional.empty() : debounce;
  }

  public static SubscribeOptions immediate(BackoffPolicy reconnect) {
    return new SubscribeOptions(Optional.empty(), reconnect);
  }

  public SubscribeOptions withDebounce(DebounceSpec spec) {
    return new SubscribeOptions(Optional.ofNullable(spec), reconnect);
  }

  public SubscribeOptions withReconnect(BackoffPolicy policy) {
    return new SubscribeOptions(debounce, policy);
  }
}
