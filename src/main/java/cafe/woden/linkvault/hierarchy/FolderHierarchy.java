package cafe.woden.linkvault.hierarchy;

import cafe.woden.linkvault.model.Folder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only index over one snapshot of a user's folders.
 *
 * <p>Folders nest at most one level: only a folder without a parent may have children. Nothing in
 * here throws for a malformed tree. Cycles and dangling references are walked defensively, recorded
 * in {@link #anomalies()} and logged once each.
 *
 * <p>A folder whose parent is not in the set is treated as a root for navigation, but still cannot
 * take children since its {@code parentId} is non-null.
 */
public final class FolderHierarchy {
  private static final Logger log = LoggerFactory.getLogger(FolderHierarchy.class);

  public static final int DEFAULT_MAX_SUB_FOLDERS = 10;

  private final Map<String, Folder> byId;
  private final Map<String, List<Folder>> childrenByParent;
  private final int maxSubFolders;
  private final Set<HierarchyAnomaly> anomalies = Collections.synchronizedSet(new LinkedHashSet<>());

  private FolderHierarchy(Collection<Folder> folders, int maxSubFolders) {
    this.maxSubFolders = maxSubFolders <= 0 ? DEFAULT_MAX_SUB_FOLDERS : maxSubFolders;
    Map<String, Folder> ids = new LinkedHashMap<>();
    if (folders != null) {
      for (Folder f : folders) {
        if (f != null) ids.put(f.id(), f);
      }
    }
    Map<String, List<Folder>> children = new LinkedHashMap<>();
    for (Folder f : ids.values()) {
      if (f.parentId() == null) continue;
      children.computeIfAbsent(f.parentId(), k -> new ArrayList<>()).add(f);
      if (!ids.containsKey(f.parentId())) {
        record(HierarchyAnomaly.Kind.DANGLING_PARENT, f.id(), "parent " + f.parentId() + " not found");
      }
    }
    this.byId = Collections.unmodifiableMap(ids);
    this.childrenByParent = children;
  }

  public static FolderHierarchy of(Collection<Folder> folders) {
    return new FolderHierarchy(folders, DEFAULT_MAX_SUB_FOLDERS);
  }

  public static FolderHierarchy of(Collection<Folder> folders, int maxSubFolders) {
    return new FolderHierarchy(folders, maxSubFolders);
  }

  public int maxSubFolders() {
    return maxSubFolders;
  }

  public Optional<Folder> find(String folderId) {
    return Optional.ofNullable(folderId == null ? null : byId.get(folderId));
  }

  public Collection<Folder> folders() {
    return byId.values();
  }

  /** The folder itself plus every transitive child. Always contains {@code folderId}. */
  public Set<String> descendantIds(String folderId) {
    Set<String> out = new LinkedHashSet<>();
    if (folderId == null) return out;
    out.add(folderId);
    if (!byId.containsKey(folderId)) {
      record(HierarchyAnomaly.Kind.MISSING_FOLDER, folderId, "descendants of unknown folder");
    }
    Deque<String> pending = new ArrayDeque<>();
    pending.push(folderId);
    while (!pending.isEmpty()) {
      String current = pending.pop();
      for (Folder child : childrenByParent.getOrDefault(current, List.of())) {
        if (!out.add(child.id())) {
          record(HierarchyAnomaly.Kind.CYCLE, child.id(), "revisited below " + folderId);
          continue;
        }
        pending.push(child.id());
      }
    }
    return out;
  }

  /** 0 for a root, 1 for an immediate child. Stops at the first cycle or dangling parent. */
  public int depth(String folderId) {
    Folder current = byId.get(folderId);
    if (current == null) {
      record(HierarchyAnomaly.Kind.MISSING_FOLDER, folderId, "depth of unknown folder");
      return 0;
    }
    Set<String> visited = new HashSet<>();
    visited.add(current.id());
    int depth = 0;
    while (current.parentId() != null) {
      Folder parent = byId.get(current.parentId());
      if (parent == null) break;
      if (!visited.add(parent.id())) {
        record(HierarchyAnomaly.Kind.CYCLE, parent.id(), "revisited computing depth of " + folderId);
        break;
      }
      depth++;
      current = parent;
    }
    return depth;
  }

  /** True only for an existing folder without a parent. */
  public boolean canHaveChildren(String folderId) {
    Folder f = byId.get(folderId);
    if (f == null) {
      record(HierarchyAnomaly.Kind.MISSING_FOLDER, folderId, "child capacity of unknown folder");
      return false;
    }
    return f.parentId() == null;
  }

  public boolean canAddChild(String parentId) {
    return canHaveChildren(parentId) && childCount(parentId) < maxSubFolders;
  }

  public int childCount(String parentId) {
    return children(parentId).size();
  }

  public boolean hasChildren(String folderId) {
    return childCount(folderId) > 0;
  }

  /** Whether placing {@code folderId} under {@code proposedParentId} would close a loop. */
  public boolean wouldCreateCycle(String folderId, String proposedParentId) {
    if (proposedParentId == null) return false;
    if (proposedParentId.equals(folderId)) return true;
    return descendantIds(folderId).contains(proposedParentId);
  }

  /** Roots, including orphans whose parent is not in the set. */
  public List<Folder> rootFolders() {
    List<Folder> out = new ArrayList<>();
    for (Folder f : byId.values()) {
      if (f.parentId() == null || !byId.containsKey(f.parentId())) out.add(f);
    }
    return out;
  }

  public List<Folder> children(String parentId) {
    if (parentId == null) return List.of();
    return List.copyOf(childrenByParent.getOrDefault(parentId, List.of()));
  }

  /**
   * Folders from the top of the tree down to {@code folderId}, inclusive. The walk stops early on
   * a cycle or a dangling parent, so the result may start below the true root. Empty for an unknown
   * folder.
   */
  public List<Folder> pathFromRoot(String folderId) {
    Folder current = byId.get(folderId);
    if (current == null) {
      record(HierarchyAnomaly.Kind.MISSING_FOLDER, folderId, "path of unknown folder");
      return List.of();
    }
    List<Folder> reversed = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    while (current != null && visited.add(current.id())) {
      reversed.add(current);
      String parentId = current.parentId();
      if (parentId == null) break;
      Folder parent = byId.get(parentId);
      if (parent != null && visited.contains(parent.id())) {
        record(HierarchyAnomaly.Kind.CYCLE, parent.id(), "revisited building path of " + folderId);
      }
      current = parent;
    }
    Collections.reverse(reversed);
    return List.copyOf(reversed);
  }

  /** {@link #descendantIds} for every folder in the set. */
  public Map<String, Set<String>> descendantIndex() {
    Map<String, Set<String>> out = new LinkedHashMap<>();
    for (String id : byId.keySet()) {
      out.put(id, Collections.unmodifiableSet(descendantIds(id)));
    }
    return Collections.unmodifiableMap(out);
  }

  public List<HierarchyAnomaly> anomalies() {
    synchronized (anomalies) {
      return List.copyOf(anomalies);
    }
  }

  private void record(HierarchyAnomaly.Kind kind, String folderId, String detail) {
    if (anomalies.add(new HierarchyAnomaly(kind, folderId, detail))) {
      log.warn("[linkvault] Folder hierarchy anomaly {} at {}: {}", kind, folderId, detail);
    }
  }
}
