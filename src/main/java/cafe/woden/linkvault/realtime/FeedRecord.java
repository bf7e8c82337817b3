package cafe.woden.linkvault.realtime;

import java.util.Map;

/** A change as the transport hands it over, before validation. Fields may be missing. */
public record FeedRecord(String eventType, Map<String, Object> before, Map<String, Object> after) {}
