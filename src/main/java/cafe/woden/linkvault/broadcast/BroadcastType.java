package cafe.woden.linkvault.broadcast;

public enum BroadcastType {
  LOGOUT,
  SESSION_EXPIRED,
  AUTH_STATE_CHANGED
}
