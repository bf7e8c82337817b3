package cafe.woden.linkvault.hierarchy;

import org.jmolecules.ddd.annotation.ValueObject;

/** A shape problem noticed while reading a folder set. Observed and logged, never thrown. */
@ValueObject
public record HierarchyAnomaly(Kind kind, String folderId, String detail) {

  public enum Kind {
    /** A folder was reached twice while walking the tree. */
    CYCLE,
    /** A query named a folder that is not in the set. */
    MISSING_FOLDER,
    /** A folder points at a parent that is not in the set. */
    DANGLING_PARENT
  }
}
