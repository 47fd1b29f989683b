package com.github.safetymodel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Snapshot based undo/redo with gesture coalescing.
 *
 * Notes for users:<br>
 * 1. the GUI calls push() before every mutating action. Drag handlers call it on every motion
 * event, menu actions call it once. commitGesture() ends the gesture (eg. mouse release).<br>
 * 2. the first push of a gesture records the gesture base. Later pushes are handed to the
 * coalescing policy of the chosen strategy, so that a whole drag is a single undo step.<br>
 * 3. commitGesture() folds a trailing move that was never pushed into the gesture's last frame.<br>
 * 4. undo() pops the newest frame and restores it, dropping it first when it equals the live model.
 * Every push clears the redo stack.<br>
 * 5. both stacks hold at most maxHistory frames, the oldest frame is dropped first.<br>
 * 6. not thread-safe, like the model it snapshots.<br>
 */
public final class UndoRedoManager {
  private static final Logger logger = LogManager.getLogger(UndoRedoManager.class.getSimpleName());

  private final String sessionId;
  private final SafetyModel model;
  private final SnapshotCodec codec;
  private final int maxHistory;
  private final SessionStatistics statistics;

  private final Stack<Snapshot> undoStack = new Stack<>();
  private final Stack<Snapshot> redoStack = new Stack<>();
  private final Map<CoalescingStrategy, CoalescingPolicy> policies =
      new EnumMap<>(CoalescingStrategy.class);

  private GestureState state = GestureState.IDLE;
  // frames at or below this index belong to finished gestures
  private int baseIndex = -1;
  private boolean replaying;

  UndoRedoManager(final String sessionId, final SafetyModel model, final SnapshotCodec codec,
      final int maxHistory, final SessionStatistics statistics) {
    this.sessionId = sessionId;
    this.model = model;
    this.codec = codec;
    this.maxHistory = maxHistory;
    this.statistics = statistics;
    for (CoalescingStrategy strategy : CoalescingStrategy.values()) {
      policies.put(strategy, CoalescingPolicy.forStrategy(strategy));
    }
  }

  /**
   * Capture the live model and record it. Returns true if the undo history changed.
   */
  public boolean push(final CoalescingStrategy strategy) throws SafetyModelException {
    if (strategy == null) {
      throw new SafetyModelException(SafetyModelException.Code.UNKNOWN_STRATEGY,
          "Coalescing strategy cannot be null");
    }
    statistics.totalPushes++;
    if (replaying) {
      statistics.totalIgnoredPushes++;
      logDebug(sessionId, "Ignoring push issued while replaying history");
      return false;
    }
    if (!redoStack.isEmpty()) {
      logDebug(sessionId, "New push, dropping " + redoStack.size() + " redo frame(s)");
      redoStack.clear();
    }
    final Snapshot current = codec.export(model);
    final CoalescingPolicy policy = policies.get(strategy);

    if (state == GestureState.IDLE) {
      state = GestureState.GESTURE;
      policy.reset();
      final boolean appended = undoStack.isEmpty() || !undoStack.peek().equals(current);
      if (appended) {
        undoStack.push(current);
        statistics.totalAppendedFrames++;
      } else {
        statistics.totalIgnoredPushes++;
      }
      trim(undoStack);
      baseIndex = undoStack.size() - 1;
      logDebug(sessionId, "Opened gesture at frame " + baseIndex + " using " + strategy);
      return appended;
    }

    if (!undoStack.isEmpty() && undoStack.peek().equals(current)) {
      statistics.totalIgnoredPushes++;
      return false;
    }
    if (undoStack.isEmpty()) {
      // history was cleared mid gesture
      undoStack.push(current);
      statistics.totalAppendedFrames++;
      baseIndex = 0;
      return true;
    }
    final int sizeBefore = undoStack.size();
    baseIndex = policy.record(undoStack, baseIndex, current);
    if (undoStack.size() > sizeBefore) {
      statistics.totalAppendedFrames++;
    } else {
      statistics.totalCoalescedPushes++;
    }
    baseIndex -= trim(undoStack);
    if (logger.isDebugEnabled()) {
      logDebug(sessionId, strategy + " recorded push, frames=" + undoStack.size() + ", base="
          + baseIndex);
    }
    return true;
  }

  /**
   * Close the gesture in progress. No frame is written, but a frame above the gesture base is
   * brought up to the live positions when only nodes moved since the last push.
   */
  public void commitGesture() {
    if (state != GestureState.GESTURE) {
      return;
    }
    final int topIndex = undoStack.size() - 1;
    if (topIndex > baseIndex && baseIndex >= 0) {
      final Snapshot live = codec.export(model);
      final Snapshot top = undoStack.peek();
      if (!top.equals(live) && CoalescingPolicy.positionOnly(top, live)) {
        undoStack.set(topIndex, live);
        logDebug(sessionId, "Gesture tail brought up to the live positions");
      }
    }
    for (CoalescingPolicy policy : policies.values()) {
      policy.reset();
    }
    state = GestureState.IDLE;
    baseIndex = undoStack.size() - 1;
  }

  /**
   * Restore the newest undo frame. A frame equal to the live model is dropped first, so one undo
   * after a gesture restores the pre-gesture state. Returns false, without touching the model or
   * the stacks, when there is nothing to undo.
   */
  public boolean undo(final CoalescingStrategy strategy) throws SafetyModelException {
    commitGesture();
    final Snapshot live = codec.export(model);
    int targetIndex = undoStack.size() - 1;
    if (targetIndex >= 0 && undoStack.get(targetIndex).equals(live)) {
      targetIndex--;
    }
    if (targetIndex < 0) {
      return false;
    }
    replay(undoStack.get(targetIndex));
    undoStack.setSize(targetIndex);
    redoStack.push(live);
    trim(redoStack);
    baseIndex = undoStack.size() - 1;
    statistics.totalUndos++;
    logInfo(sessionId, "Undo via " + strategy + ", undo frames=" + undoStack.size()
        + ", redo frames=" + redoStack.size());
    return true;
  }

  /**
   * Re-apply the newest undone step. Returns false, without touching the model, when there is
   * nothing to redo.
   */
  public boolean redo(final CoalescingStrategy strategy) throws SafetyModelException {
    commitGesture();
    final Snapshot live = codec.export(model);
    int targetIndex = redoStack.size() - 1;
    while (targetIndex >= 0 && redoStack.get(targetIndex).equals(live)) {
      targetIndex--;
    }
    if (targetIndex < 0) {
      return false;
    }
    final Snapshot target = redoStack.get(targetIndex);
    replay(target);
    redoStack.setSize(targetIndex);
    if (undoStack.isEmpty() || !undoStack.peek().equals(live)) {
      undoStack.push(live);
    }
    trim(undoStack);
    baseIndex = undoStack.size() - 1;
    statistics.totalRedos++;
    logInfo(sessionId, "Redo via " + strategy + ", undo frames=" + undoStack.size()
        + ", redo frames=" + redoStack.size());
    return true;
  }

  public boolean canUndo() {
    if (undoStack.size() > 1) {
      return true;
    }
    return undoStack.size() == 1 && !undoStack.peek().equals(codec.export(model));
  }

  public boolean canRedo() {
    return !redoStack.isEmpty();
  }

  public void clearHistory() {
    undoStack.clear();
    redoStack.clear();
    commitGesture();
    baseIndex = -1;
    logInfo(sessionId, "Cleared undo/redo history");
  }

  public GestureState getState() {
    return state;
  }

  public int getUndoDepth() {
    return undoStack.size();
  }

  public int getRedoDepth() {
    return redoStack.size();
  }

  int getBaseIndex() {
    return baseIndex;
  }

  List<Snapshot> undoFrames() {
    return Collections.unmodifiableList(undoStack);
  }

  CoalescingPolicy policy(final CoalescingStrategy strategy) {
    return policies.get(strategy);
  }

  private void replay(final Snapshot target) throws SafetyModelException {
    replaying = true;
    try {
      codec.importInto(model, target);
    } catch (SafetyModelException problem) {
      logError(sessionId, "Failed to restore history frame, history left unchanged", problem);
      throw problem;
    } finally {
      replaying = false;
    }
  }

  // drop the oldest frames, returns how many were dropped
  private int trim(final Stack<Snapshot> frames) {
    int dropped = 0;
    while (frames.size() > maxHistory) {
      frames.remove(0);
      dropped++;
    }
    if (dropped > 0) {
      logDebug(sessionId, "History full, dropped " + dropped + " oldest frame(s)");
    }
    return dropped;
  }

  private static void logError(final String sessionId, final String message,
      final Throwable problem) {
    logger.error(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
        .toString(), problem);
  }

  private static void logInfo(final String sessionId, final String message) {
    logger.info(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String sessionId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
          .toString());
    }
  }
}
