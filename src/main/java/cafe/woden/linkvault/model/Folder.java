package cafe.woden.linkvault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A folder row.
 *
 * <p>{@code parentId} is a non-owning back reference. Only root folders (null parent) may have
 * children, and the tree must stay acyclic; both rules are enforced by the hierarchy module, not
 * here.
 */
@ValueObject
public record Folder(
    String id,
    String parentId,
    String name,
    String description,
    String color,
    String icon,
    @JsonProperty("is_platform_folder") boolean platformFolder,
    Platform platform,
    @JsonProperty("is_shareable") boolean shareable,
    String shareId,
    Instant shareCreatedAt,
    Instant createdAt,
    Instant updatedAt,
    String userId
) {

  public Folder {
    id = Objects.requireNonNull(id, "id");
    parentId = blankToNull(parentId);
    name = Objects.toString(name, "").trim();
  }

  public static Folder root(String id, String name, Instant now) {
    return new Folder(id, null, name, null, null, null, false, null, false, null, null, now, now, null);
  }

  public static Folder child(String id, String parentId, String name, Instant now) {
    return new Folder(id, parentId, name, null, null, null, false, null, false, null, null, now, now, null);
  }

  @JsonIgnore
  public boolean isRoot() {
    return parentId == null;
  }

  public Folder withParentId(String newParentId, Instant now) {
    return new Folder(id, newParentId, name, description, color, icon, platformFolder, platform,
        shareable, shareId, shareCreatedAt, createdAt, now, userId);
  }

  public Folder withName(String newName, Instant now) {
    return new Folder(id, parentId, newName, description, color, icon, platformFolder, platform,
        shareable, shareId, shareCreatedAt, createdAt, now, userId);
  }

  public Folder withAppearance(String newColor, String newIcon, String newDescription, Instant now) {
    return new Folder(id, parentId, name, newDescription, newColor, newIcon, platformFolder, platform,
        shareable, shareId, shareCreatedAt, createdAt, now, userId);
  }

  public Folder withSharing(boolean nowShareable, String newShareId, Instant now) {
    return new Folder(id, parentId, name, description, color, icon, platformFolder, platform,
        nowShareable, newShareId, nowShareable ? now : null, createdAt, now, userId);
  }

  public Folder withUpdatedAt(Instant now) {
    return new Folder(id, parentId, name, description, color, icon, platformFolder, platform,
        shareable, shareId, shareCreatedAt, createdAt, now, userId);
  }

  public Folder withUserId(String owner) {
    return new Folder(id, parentId, name, description, color, icon, platformFolder, platform,
        shareable, shareId, shareCreatedAt, createdAt, updatedAt, owner);
  }

  private static String blankToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
