package cafe.woden.linkvault.data;

import java.time.Instant;

public record GuestSession(boolean active, Instant activatedAt, Instant lastAccessedAt) {}
