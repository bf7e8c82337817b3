package cafe.woden.linkvault.realtime;

import java.util.Optional;

public record SubscriptionStateChange(
    String subscriptionId,
    SubscriptionConfig config,
    SubscriptionState state,
    Optional<Throwable> cause
) {}
