package com.github.safetymodel;

import java.util.Locale;

/**
 * Selects the coalescing policy used by the undo/redo manager to decide whether a push extends the
 * gesture in progress or starts a new one. All four honor the same contract: a run of same-gesture
 * pushes leaves only the pre-gesture frame and the final frame on the undo stack.
 */
public enum CoalescingStrategy {
  // compare content digests of position-free adjacent frames
  V1,
  // track the identity of the objects being moved between consecutive frames
  V2,
  // count the run of position-only pushes since the gesture was bracketed open
  V3,
  // append every frame, then collapse the middle of three position-equivalent frames
  V4;

  /**
   * Parse the wire name used by the GUI layer, eg. "v4".
   */
  public static CoalescingStrategy fromName(final String name) throws SafetyModelException {
    if (name != null) {
      for (CoalescingStrategy strategy : values()) {
        if (strategy.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
          return strategy;
        }
      }
    }
    throw new SafetyModelException(SafetyModelException.Code.UNKNOWN_STRATEGY,
        "Unknown coalescing strategy: " + name);
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
