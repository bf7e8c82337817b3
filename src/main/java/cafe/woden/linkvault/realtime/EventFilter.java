package cafe.woden.linkvault.realtime;

/** Which change types a subscription wants. */
public enum EventFilter {
  ALL,
  INSERT,
  UPDATE,
  DELETE;

  public boolean accepts(ChangeType type) {
    return this == ALL || name().equals(type.name());
  }
}
