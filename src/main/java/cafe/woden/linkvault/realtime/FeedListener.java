package cafe.woden.linkvault.realtime;

/** Callbacks from an open change feed. May be invoked on any thread. */
public interface FeedListener {

  void onRecord(FeedRecord record);

  void onConnected();

  /** The feed dropped. The handle is dead; the manager decides whether to reopen. */
  void onConnectionLost(Throwable cause);
}
