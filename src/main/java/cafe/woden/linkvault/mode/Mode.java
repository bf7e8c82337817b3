package cafe.woden.linkvault.mode;

public enum Mode {
  /** Neither a session nor guest mode: reads and writes are refused. */
  SIGNED_OUT,
  /** Data lives in local storage only; no realtime subscriptions. */
  GUEST,
  /** Data lives in the remote store of the signed-in user. */
  AUTHENTICATED
}
