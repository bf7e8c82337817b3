package cafe.woden.linkvault.realtime;

import java.util.Map;

/** Point-in-time counters for diagnostics. */
public record SubscriptionStatistics(
    int subscriptions,
    Map<SubscriptionState, Integer> byState,
    Map<String, Integer> byResource,
    long delivered,
    long coalesced,
    long dropped
) {}
