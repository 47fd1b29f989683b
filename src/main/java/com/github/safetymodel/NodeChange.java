package com.github.safetymodel;

import java.util.Collections;
import java.util.List;

/**
 * A single node change between two snapshots of the same model.
 */
public final class NodeChange {
  public static enum ChangeType {
    ADDED, MODIFIED, REMOVED
  }

  private final ChangeType changeType;
  private final long nodeId;
  private final String kind;
  private final String displayName;
  // only filled for MODIFIED
  private final List<PropertyDiff> propertyDiffs;

  NodeChange(final ChangeType changeType, final long nodeId, final String kind,
      final String displayName, final List<PropertyDiff> propertyDiffs) {
    this.changeType = changeType;
    this.nodeId = nodeId;
    this.kind = kind;
    this.displayName = displayName;
    this.propertyDiffs = Collections.unmodifiableList(propertyDiffs);
  }

  public ChangeType getChangeType() {
    return changeType;
  }

  public long getNodeId() {
    return nodeId;
  }

  public String getKind() {
    return kind;
  }

  public String getDisplayName() {
    return displayName;
  }

  public List<PropertyDiff> getPropertyDiffs() {
    return propertyDiffs;
  }

  public PropertyDiff findDiff(final String property) {
    for (PropertyDiff diff : propertyDiffs) {
      if (diff.getProperty().equals(property)) {
        return diff;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "NodeChange [changeType=" + changeType + ", nodeId=" + nodeId + ", kind=" + kind
        + ", displayName=" + displayName + ", propertyDiffs=" + propertyDiffs + "]";
  }

  /**
   * Old and new value of one property. Shared fields are named "shared.&lt;field&gt;".
   */
  public static final class PropertyDiff {
    private final String property;
    private final Object oldValue;
    private final Object newValue;

    PropertyDiff(final String property, final Object oldValue, final Object newValue) {
      this.property = property;
      this.oldValue = oldValue;
      this.newValue = newValue;
    }

    public String getProperty() {
      return property;
    }

    public Object getOldValue() {
      return oldValue;
    }

    public Object getNewValue() {
      return newValue;
    }

    @Override
    public String toString() {
      return property + ": " + oldValue + " -> " + newValue;
    }
  }
}
