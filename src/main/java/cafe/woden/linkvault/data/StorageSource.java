package cafe.woden.linkvault.data;

/** Which backend a repository talks to. */
public enum StorageSource {
  /** Local persistent storage only. */
  GUEST,
  /** The remote store of a signed-in user. */
  REMOTE
}
