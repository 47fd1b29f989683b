package com.github.safetymodel;

import java.util.List;

/**
 * v1: a push continues the gesture when the content digest of the position-free frames is
 * unchanged, ie. only nodes moved.
 */
final class ContentHashPolicy extends CoalescingPolicy {

  @Override
  int record(final List<Snapshot> frames, final int baseIndex, final Snapshot current) {
    final String topDigest = top(frames).withoutPositions().digest();
    if (!topDigest.equals(current.withoutPositions().digest())) {
      frames.add(current);
      return frames.size() - 1;
    }
    if (frames.size() - 1 > baseIndex) {
      replaceTop(frames, current);
    } else {
      frames.add(current);
    }
    return baseIndex;
  }
}
