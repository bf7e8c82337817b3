package cafe.woden.linkvault.model;

/** Remote table names, shared by repositories and change feeds. */
public final class Resources {
  public static final String FOLDERS = "folders";
  public static final String LINKS = "links";

  private Resources() {}
}
