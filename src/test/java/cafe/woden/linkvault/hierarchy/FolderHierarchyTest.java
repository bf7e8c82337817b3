package cafe.woden.linkvault.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.linkvault.model.Folder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FolderHierarchyTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void descendantIdsAlwaysContainsTheFolderItself() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("work", "Work", T0),
        Folder.child("docs", "work", "Docs", T0),
        Folder.child("specs", "work", "Specs", T0),
        Folder.root("home", "Home", T0)));

    assertThat(h.descendantIds("work")).containsExactlyInAnyOrder("work", "docs", "specs");
    assertThat(h.descendantIds("home")).containsExactly("home");
    assertThat(h.descendantIds("docs")).containsExactly("docs");
  }

  @Test
  void descendantIdsOfUnknownFolderIsJustTheIdAndRecordsAnomaly() {
    FolderHierarchy h = FolderHierarchy.of(List.of(Folder.root("a", "A", T0)));

    assertThat(h.descendantIds("ghost")).containsExactly("ghost");
    assertThat(h.anomalies())
        .extracting(HierarchyAnomaly::kind)
        .containsExactly(HierarchyAnomaly.Kind.MISSING_FOLDER);
  }

  @Test
  void corruptCycleTerminatesEverywhere() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.child("a", "b", "A", T0),
        Folder.child("b", "a", "B", T0)));

    assertThat(h.descendantIds("a")).containsExactlyInAnyOrder("a", "b");
    assertThat(h.depth("a")).isEqualTo(1);
    assertThat(h.pathFromRoot("a")).extracting(Folder::id).containsExactly("b", "a");
    assertThat(h.descendantIndex()).containsOnlyKeys("a", "b");
    assertThat(h.anomalies())
        .extracting(HierarchyAnomaly::kind)
        .contains(HierarchyAnomaly.Kind.CYCLE);
  }

  @Test
  void selfParentedFolderDoesNotLoop() {
    FolderHierarchy h = FolderHierarchy.of(List.of(Folder.child("x", "x", "X", T0)));

    assertThat(h.descendantIds("x")).containsExactly("x");
    assertThat(h.depth("x")).isZero();
  }

  @Test
  void movingAFolderUnderItselfIsACycle() {
    FolderHierarchy h = FolderHierarchy.of(List.of(Folder.root("a", "A", T0)));

    assertThat(h.wouldCreateCycle("a", "a")).isTrue();
    assertThat(h.wouldCreateCycle("missing", "missing")).isTrue();
  }

  @Test
  void movingUnderADescendantIsACycleAndAnythingElseIsNot() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("a", "A", T0),
        Folder.child("b", "a", "B", T0),
        Folder.root("c", "C", T0)));

    assertThat(h.wouldCreateCycle("a", "b")).isTrue();
    assertThat(h.wouldCreateCycle("b", "c")).isFalse();
    assertThat(h.wouldCreateCycle("c", "a")).isFalse();
    assertThat(h.wouldCreateCycle("a", null)).isFalse();
  }

  @Test
  void subFolderQuotaAllowsTenAndFreesUpAfterRemoval() {
    List<Folder> folders = new ArrayList<>();
    folders.add(Folder.root("root", "Root", T0));
    for (int i = 0; i < 9; i++) {
      folders.add(Folder.child("c" + i, "root", "Child " + i, T0));
    }
    assertThat(FolderHierarchy.of(folders).canAddChild("root")).isTrue();

    folders.add(Folder.child("c9", "root", "Child 9", T0));
    assertThat(FolderHierarchy.of(folders).childCount("root")).isEqualTo(10);
    assertThat(FolderHierarchy.of(folders).canAddChild("root")).isFalse();

    folders.removeIf(f -> f.id().equals("c3"));
    assertThat(FolderHierarchy.of(folders).canAddChild("root")).isTrue();
  }

  @Test
  void onlyRootFoldersTakeChildren() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("a", "A", T0),
        Folder.child("b", "a", "B", T0)));

    assertThat(h.canHaveChildren("a")).isTrue();
    assertThat(h.canHaveChildren("b")).isFalse();
    assertThat(h.canAddChild("b")).isFalse();
    assertThat(h.canHaveChildren("nope")).isFalse();
  }

  @Test
  void quotaHonoursConfiguredLimit() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("a", "A", T0),
        Folder.child("b", "a", "B", T0),
        Folder.child("c", "a", "C", T0)), 2);

    assertThat(h.canAddChild("a")).isFalse();
  }

  @Test
  void orphansShowUpAsRootsButStillCannotTakeChildren() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("a", "A", T0),
        Folder.child("orphan", "deleted-parent", "Orphan", T0)));

    assertThat(h.rootFolders()).extracting(Folder::id).containsExactly("a", "orphan");
    assertThat(h.canHaveChildren("orphan")).isFalse();
    assertThat(h.pathFromRoot("orphan")).extracting(Folder::id).containsExactly("orphan");
    assertThat(h.anomalies())
        .extracting(HierarchyAnomaly::kind)
        .containsExactly(HierarchyAnomaly.Kind.DANGLING_PARENT);
  }

  @Test
  void pathFromRootWalksDownToTheFolder() {
    FolderHierarchy h = FolderHierarchy.of(List.of(
        Folder.root("a", "A", T0),
        Folder.child("b", "a", "B", T0)));

    assertThat(h.pathFromRoot("b")).extracting(Folder::name).containsExactly("A", "B");
    assertThat(h.depth("b")).isEqualTo(1);
    assertThat(h.pathFromRoot("zzz")).isEmpty();
  }
}
