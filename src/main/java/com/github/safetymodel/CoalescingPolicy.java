package com.github.safetymodel;

import java.util.List;

/**
 * Decides how a snapshot pushed during a gesture lands on the undo stack.
 *
 * The contract of record() is quite simple - given the undo frames, the index of the frame the
 * gesture started from and the new snapshot, implementors either append the snapshot or fold it
 * into the frames above the base, then return the base index that holds afterwards. A content
 * change always starts a new gesture whose base is the appended frame. However the policy tracks
 * the gesture, a run of same-gesture pushes must leave exactly the base frame and the final frame.
 *
 * The manager has already dropped a snapshot identical to the top frame before calling record(),
 * and trims the history after it.
 */
public abstract class CoalescingPolicy {

  /**
   * Record current on top of frames. Frames at or below baseIndex must not be replaced or removed.
   */
  abstract int record(final List<Snapshot> frames, final int baseIndex, final Snapshot current);

  /**
   * Forget any per-gesture state. Called when a gesture is opened or committed.
   */
  void reset() {}

  static CoalescingPolicy forStrategy(final CoalescingStrategy strategy) {
    switch (strategy) {
      case V1:
        return new ContentHashPolicy();
      case V2:
        return new MovedObjectPolicy();
      case V3:
        return new RunLengthPolicy();
      case V4:
      default:
        return new CollapsingPolicy();
    }
  }

  static boolean positionOnly(final Snapshot before, final Snapshot after) {
    return before.withoutPositions().equals(after.withoutPositions());
  }

  static Snapshot top(final List<Snapshot> frames) {
    return frames.get(frames.size() - 1);
  }

  static void replaceTop(final List<Snapshot> frames, final Snapshot current) {
    frames.set(frames.size() - 1, current);
  }
}
