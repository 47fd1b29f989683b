package com.github.safetymodel;

import java.util.List;

/**
 * v3: counts the position-only pushes since the gesture was opened. The first one of a run is
 * appended on top of the base, every later one replaces it.
 */
final class RunLengthPolicy extends CoalescingPolicy {
  private int run;

  @Override
  int record(final List<Snapshot> frames, final int baseIndex, final Snapshot current) {
    if (!positionOnly(top(frames), current)) {
      run = 0;
      frames.add(current);
      return frames.size() - 1;
    }
    run++;
    if (run > 1 && frames.size() - 1 > baseIndex) {
      replaceTop(frames, current);
    } else {
      frames.add(current);
    }
    return baseIndex;
  }

  @Override
  void reset() {
    run = 0;
  }

  int getRun() {
    return run;
  }
}
