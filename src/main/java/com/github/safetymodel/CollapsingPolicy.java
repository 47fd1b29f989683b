package com.github.safetymodel;

import java.util.List;

/**
 * v4: always appends, then drops the middle one of the three newest frames when all three differ
 * only by node positions and the middle one is above the gesture base.
 */
final class CollapsingPolicy extends CoalescingPolicy {

  @Override
  int record(final List<Snapshot> frames, final int baseIndex, final Snapshot current) {
    final boolean contentChanged = !positionOnly(top(frames), current);
    frames.add(current);
    final int last = frames.size() - 1;
    if (contentChanged) {
      return last;
    }
    if (last >= 2 && last - 1 > baseIndex
        && positionOnly(frames.get(last - 2), frames.get(last - 1))) {
      frames.remove(last - 1);
    }
    return baseIndex;
  }
}
