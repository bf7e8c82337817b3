package cafe.woden.linkvault.realtime;

public enum SubscriptionState {
  ACTIVE,
  PAUSED,
  /** Feed dropped; a reconnect is scheduled. */
  RETRYING,
  /** Reconnect budget exhausted. Terminal. */
  FAILED,
  /** Unsubscribed. Terminal. */
  CLOSED;

  public boolean isTerminal() {
    return this == FAILED || this == CLOSED;
  }
}
