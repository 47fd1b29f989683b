package com.github.safetymodel;

/**
 * This represents whether the undo/redo manager is in the middle of a coalescable gesture.
 */
public enum GestureState {
  // no gesture pending, the next push starts one
  IDLE,
  // a gesture is in progress, pushes may be merged into its final frame
  GESTURE;
}
