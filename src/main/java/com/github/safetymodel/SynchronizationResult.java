package com.github.safetymodel;

import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of one synchronization fan-out from an edited instance to
 * the other instances of its logical identity.
 *
 * A run that had to skip instances with broken clone chains still succeeds for everything else; it
 * reports {@link #isComplete()} as false and lists the skipped ids.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class SynchronizationResult {
  private final long editedNodeId;
  private final long primaryId;
  private final List<Long> touchedNodeIds;
  private final List<Long> skippedNodeIds;

  SynchronizationResult(final long editedNodeId, final long primaryId,
      final List<Long> touchedNodeIds, final List<Long> skippedNodeIds) {
    this.editedNodeId = editedNodeId;
    this.primaryId = primaryId;
    this.touchedNodeIds = Collections.unmodifiableList(touchedNodeIds);
    this.skippedNodeIds = Collections.unmodifiableList(skippedNodeIds);
  }

  public long getEditedNodeId() {
    return editedNodeId;
  }

  public long getPrimaryId() {
    return primaryId;
  }

  /**
   * Ids of the instances that received the edited values, the edited one excluded.
   */
  public List<Long> getTouchedNodeIds() {
    return touchedNodeIds;
  }

  public List<Long> getSkippedNodeIds() {
    return skippedNodeIds;
  }

  public boolean isComplete() {
    return skippedNodeIds.isEmpty();
  }

  @Override
  public String toString() {
    return "SynchronizationResult [editedNodeId=" + editedNodeId + ", primaryId=" + primaryId
        + ", touchedNodeIds=" + touchedNodeIds + ", skippedNodeIds=" + skippedNodeIds + "]";
  }
}
