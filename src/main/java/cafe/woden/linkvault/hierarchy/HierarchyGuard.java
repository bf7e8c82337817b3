package cafe.woden.linkvault.hierarchy;

import cafe.woden.linkvault.config.LinkVaultProperties;
import cafe.woden.linkvault.error.InvariantViolationException;
import cafe.woden.linkvault.error.InvariantViolationException.Violation;
import cafe.woden.linkvault.model.Folder;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * Mutation-boundary checks for folder parentage.
 *
 * <p>Every create or re-parent goes through here before anything reaches a storage backend.
 */
@Component
@ApplicationLayer
public class HierarchyGuard {

  private final int maxSubFolders;

  public HierarchyGuard(LinkVaultProperties props) {
    this.maxSubFolders = props.hierarchy().maxSubFolders();
  }

  public FolderHierarchy snapshot(Collection<Folder> folders) {
    return FolderHierarchy.of(folders, maxSubFolders);
  }

  /** A new folder under {@code parentId} (null for a root folder). */
  public void checkCreate(String parentId, Collection<Folder> folders) {
    if (parentId == null) return;
    FolderHierarchy h = snapshot(folders);
    requireRootParent(h, parentId, null);
    if (!h.canAddChild(parentId)) {
      throw new InvariantViolationException(Violation.SUB_FOLDER_QUOTA,
          "A folder can hold at most " + h.maxSubFolders() + " sub-folders",
          Map.of("parentId", parentId, "limit", h.maxSubFolders()));
    }
  }

  /** Moving {@code folderId} under {@code newParentId} (null to make it a root). */
  public void checkReparent(String folderId, String newParentId, Collection<Folder> folders) {
    FolderHierarchy h = snapshot(folders);
    Folder folder = h.find(folderId).orElseThrow(() -> new InvariantViolationException(
        Violation.UNKNOWN_FOLDER, "Folder does not exist", Map.of("folderId", String.valueOf(folderId))));
    if (newParentId == null) return;
    if (h.wouldCreateCycle(folderId, newParentId)) {
      throw new InvariantViolationException(Violation.CYCLE,
          "A folder cannot be moved into itself or one of its sub-folders",
          Map.of("folderId", folderId, "parentId", newParentId));
    }
    requireRootParent(h, newParentId, folderId);
    if (h.hasChildren(folderId)) {
      throw new InvariantViolationException(Violation.NESTING_TOO_DEEP,
          "A folder that has sub-folders cannot become a sub-folder",
          Map.of("folderId", folderId, "parentId", newParentId));
    }
    if (Objects.equals(folder.parentId(), newParentId)) return;
    if (h.childCount(newParentId) >= h.maxSubFolders()) {
      throw new InvariantViolationException(Violation.SUB_FOLDER_QUOTA,
          "A folder can hold at most " + h.maxSubFolders() + " sub-folders",
          Map.of("parentId", newParentId, "limit", h.maxSubFolders()));
    }
  }

  private static void requireRootParent(FolderHierarchy h, String parentId, String folderId) {
    Folder parent = h.find(parentId).orElseThrow(() -> new InvariantViolationException(
        Violation.UNKNOWN_FOLDER, "Parent folder does not exist", Map.of("parentId", parentId)));
    if (!h.canHaveChildren(parent.id())) {
      throw new InvariantViolationException(Violation.NESTING_TOO_DEEP,
          "Sub-folders cannot contain further sub-folders",
          folderId == null
              ? Map.of("parentId", parentId)
              : Map.of("folderId", folderId, "parentId", parentId));
    }
  }
}
