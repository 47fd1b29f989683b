package com.github.safetymodel;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * v2: a push continues the gesture when it moved at least one node and changed nothing else. The
 * nodes dragged so far are collected per gesture; a new selection joins the running drag.
 */
final class MovedObjectPolicy extends CoalescingPolicy {
  private final Set<Long> draggedIds = new TreeSet<>();

  @Override
  int record(final List<Snapshot> frames, final int baseIndex, final Snapshot current) {
    final Snapshot top = top(frames);
    final Set<Long> moved = movedIds(top, current);
    if (moved.isEmpty() || !positionOnly(top, current)) {
      draggedIds.clear();
      frames.add(current);
      return frames.size() - 1;
    }
    draggedIds.addAll(moved);
    if (frames.size() - 1 > baseIndex) {
      replaceTop(frames, current);
    } else {
      frames.add(current);
    }
    return baseIndex;
  }

  @Override
  void reset() {
    draggedIds.clear();
  }

  Set<Long> getDraggedIds() {
    return Collections.unmodifiableSet(draggedIds);
  }

  static Set<Long> movedIds(final Snapshot before, final Snapshot after) {
    final Map<Long, double[]> oldPositions = before.positions();
    final Set<Long> moved = new TreeSet<>();
    for (Map.Entry<Long, double[]> entry : after.positions().entrySet()) {
      if (!Arrays.equals(entry.getValue(), oldPositions.get(entry.getKey()))) {
        moved.add(entry.getKey());
      }
    }
    return moved;
  }
}
