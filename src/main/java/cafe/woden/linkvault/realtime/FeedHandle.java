package cafe.woden.linkvault.realtime;

/** A live feed. Closing twice is harmless. */
public interface FeedHandle extends AutoCloseable {
  @Override
  void close();
}
