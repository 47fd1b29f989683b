package com.github.safetymodel;

/**
 * Holder of the running counters of one model session. Counters are bumped by the session and its
 * undo/redo manager on the single event thread.
 */
public final class SessionStatistics {
  private final String sessionId;

  SessionStatistics(final String sessionId) {
    this.sessionId = sessionId;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  int totalPushes;
  int totalAppendedFrames;
  int totalCoalescedPushes;
  int totalIgnoredPushes;
  int totalUndos;
  int totalRedos;
  int totalSynchronizations;
  int totalSynchronizationAborts;
  int totalSkippedBrokenClones;

  public String getSessionId() {
    return sessionId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTotalPushes() {
    return totalPushes;
  }

  public int getTotalAppendedFrames() {
    return totalAppendedFrames;
  }

  public int getTotalCoalescedPushes() {
    return totalCoalescedPushes;
  }

  /**
   * Pushes dropped because nothing changed since the top frame or because an undo/redo was being
   * replayed.
   */
  public int getTotalIgnoredPushes() {
    return totalIgnoredPushes;
  }

  public int getTotalUndos() {
    return totalUndos;
  }

  public int getTotalRedos() {
    return totalRedos;
  }

  public int getTotalSynchronizations() {
    return totalSynchronizations;
  }

  public int getTotalSynchronizationAborts() {
    return totalSynchronizationAborts;
  }

  public int getTotalSkippedBrokenClones() {
    return totalSkippedBrokenClones;
  }

  @Override
  public String toString() {
    return "SessionStatistics [sessionId=" + sessionId + ", startTstampMillis=" + startTstampMillis
        + ", totalPushes=" + totalPushes + ", totalAppendedFrames=" + totalAppendedFrames
        + ", totalCoalescedPushes=" + totalCoalescedPushes + ", totalIgnoredPushes="
        + totalIgnoredPushes + ", totalUndos=" + totalUndos + ", totalRedos=" + totalRedos
        + ", totalSynchronizations=" + totalSynchronizations + ", totalSynchronizationAborts="
        + totalSynchronizationAborts + ", totalSkippedBrokenClones=" + totalSkippedBrokenClones
        + "]";
  }
}
