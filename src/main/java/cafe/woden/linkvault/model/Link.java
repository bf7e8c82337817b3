package cafe.woden.linkvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A saved link. A non-null {@code deletedAt} means the link sits in the trash. */
@ValueObject
public record Link(
    String id,
    String url,
    String title,
    String description,
    String thumbnail,
    String faviconUrl,
    Platform platform,
    String folderId,
    @JsonProperty("is_favorite") boolean favorite,
    List<String> tags,
    Instant deletedAt,
    Instant createdAt,
    Instant updatedAt,
    String userId
) {

  public Link {
    id = Objects.requireNonNull(id, "id");
    url = Objects.toString(url, "").trim();
    if (platform == null) platform = Platform.OTHER;
    if (folderId != null && folderId.isBlank()) folderId = null;
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static Link of(String id, String url, String title, String folderId, Instant now) {
    return new Link(id, url, title, null, null, null, Platform.OTHER, folderId, false, List.of(),
        null, now, now, null);
  }

  public boolean inTrash() {
    return deletedAt != null;
  }

  public Link withFolderId(String newFolderId, Instant now) {
    return new Link(id, url, title, description, thumbnail, faviconUrl, platform, newFolderId,
        favorite, tags, deletedAt, createdAt, now, userId);
  }

  public Link withFavorite(boolean fav, Instant now) {
    return new Link(id, url, title, description, thumbnail, faviconUrl, platform, folderId, fav,
        tags, deletedAt, createdAt, now, userId);
  }

  public Link withDeletedAt(Instant when, Instant now) {
    return new Link(id, url, title, description, thumbnail, faviconUrl, platform, folderId,
        favorite, tags, when, createdAt, now, userId);
  }

  public Link withDetails(String newTitle, String newDescription, List<String> newTags, Instant now) {
    return new Link(id, url, newTitle, newDescription, thumbnail, faviconUrl, platform, folderId,
        favorite, newTags, deletedAt, createdAt, now, userId);
  }

  public Link withUpdatedAt(Instant now) {
    return new Link(id, url, title, description, thumbnail, faviconUrl, platform, folderId,
        favorite, tags, deletedAt, createdAt, now, userId);
  }

  public Link withUserId(String owner) {
    return new Link(id, url, title, description, thumbnail, faviconUrl, platform, folderId,
        favorite, tags, deletedAt, createdAt, updatedAt, owner);
  }
}
