package cafe.woden.linkvault.store;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.linkvault.model.Folder;
import cafe.woden.linkvault.model.Link;
import cafe.woden.linkvault.model.Resources;
import cafe.woden.linkvault.model.RowCodec;
import cafe.woden.linkvault.realtime.ChangeEvent;
import cafe.woden.linkvault.realtime.ChangeType;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChangeEventNormalizerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final ChangeEventNormalizer normalizer = new ChangeEventNormalizer();
  private final RowCodec codec = new RowCodec();

  @Test
  void linkInsertBecomesUpsert() {
    Link link = Link.of("l1", "https://a.example", "A", "f1", T0).withFavorite(true, T0);
    ChangeEvent event = new ChangeEvent(Resources.LINKS, ChangeType.INSERT, null, codec.toRow(link), T0);

    assertThat(normalizer.normalize(event)).contains(new RecordChange.LinkUpserted(link));
  }

  @Test
  void folderDeleteUsesTheOldRow() {
    Folder folder = Folder.root("f1", "F", T0);
    ChangeEvent event = new ChangeEvent(Resources.FOLDERS, ChangeType.DELETE, codec.toRow(folder), null, T0);

    assertThat(normalizer.normalize(event)).contains(new RecordChange.FolderDeleted("f1"));
  }

  @Test
  void unknownResourceAndUndecodableRowsAreSkipped() {
    assertThat(normalizer.normalize(new ChangeEvent(
        "profiles", ChangeType.UPDATE, null, Map.of("id", "p1"), T0))).isEmpty();
    assertThat(normalizer.normalize(new ChangeEvent(
        Resources.LINKS, ChangeType.UPDATE, null, Map.of("id", "l1", "created_at", "not a time"), T0)))
        .isEmpty();
  }
}
