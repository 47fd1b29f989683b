package com.github.safetymodel;

/**
 * This class encapsulates all the configuration parameters for a ModelSession. Use the
 * {@code ModelSessionConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxHistory bounds both the undo and the redo stack. Whole-model snapshots are kept, so this is
 * the ceiling on the memory held by the history. If not set, 20 frames are kept.<br>
 * 2. maxCloneHops bounds the clone resolver on corrupted documents. If not set, 64 hops.<br>
 * 3. cloneOffset is added to both coordinates of a freshly created clone so it does not sit on top
 * of its source. If not set, 100.<br>
 * 4. defaultStrategy is used by the strategy-less push/undo/redo calls. If not set, V4.<br>
 */
public final class ModelSessionConfiguration {
  static final int defaultMaxHistory = 20;
  static final int defaultMaxCloneHops = 64;
  static final double defaultCloneOffset = 100.0;

  private final CoalescingStrategy defaultStrategy;
  private final int maxHistory;
  private final int maxCloneHops;
  private final double cloneOffset;

  public CoalescingStrategy getDefaultStrategy() {
    return defaultStrategy;
  }

  public int getMaxHistory() {
    return maxHistory;
  }

  public int getMaxCloneHops() {
    return maxCloneHops;
  }

  public double getCloneOffset() {
    return cloneOffset;
  }

  /**
   * All defaults.
   */
  public static ModelSessionConfiguration defaults() {
    return new ModelSessionConfiguration(CoalescingStrategy.V4, 0, 0, 0.0);
  }

  public final static class ModelSessionConfigurationBuilder {
    private CoalescingStrategy defaultStrategy = CoalescingStrategy.V4;
    private int maxHistory;
    private int maxCloneHops;
    private double cloneOffset;

    public static ModelSessionConfigurationBuilder newBuilder() {
      return new ModelSessionConfigurationBuilder();
    }

    public ModelSessionConfigurationBuilder defaultStrategy(
        final CoalescingStrategy defaultStrategy) {
      this.defaultStrategy = defaultStrategy;
      return this;
    }

    public ModelSessionConfigurationBuilder maxHistory(final int maxHistory) {
      this.maxHistory = maxHistory;
      return this;
    }

    public ModelSessionConfigurationBuilder maxCloneHops(final int maxCloneHops) {
      this.maxCloneHops = maxCloneHops;
      return this;
    }

    public ModelSessionConfigurationBuilder cloneOffset(final double cloneOffset) {
      this.cloneOffset = cloneOffset;
      return this;
    }

    public ModelSessionConfiguration build() throws SafetyModelException {
      validate(defaultStrategy, maxHistory);
      return new ModelSessionConfiguration(defaultStrategy, maxHistory, maxCloneHops, cloneOffset);
    }

    private ModelSessionConfigurationBuilder() {}
  }

  private static void validate(final CoalescingStrategy defaultStrategy, final int maxHistory)
      throws SafetyModelException {
    StringBuilder messages = new StringBuilder();
    if (defaultStrategy == null) {
      messages.append("DefaultStrategy cannot be null. ");
    }
    // a gesture needs its base frame and its final frame
    if (maxHistory == 1) {
      messages.append("MaxHistory must keep at least 2 frames. ");
    }
    if (messages.length() > 0) {
      throw new SafetyModelException(SafetyModelException.Code.INVALID_SESSION_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "ModelSessionConfiguration [defaultStrategy=" + defaultStrategy + ", maxHistory="
        + maxHistory + ", maxCloneHops=" + maxCloneHops + ", cloneOffset=" + cloneOffset + "]";
  }

  private ModelSessionConfiguration(final CoalescingStrategy defaultStrategy, final int maxHistory,
      final int maxCloneHops, final double cloneOffset) {
    this.defaultStrategy = defaultStrategy;
    this.maxHistory = maxHistory <= 0 ? defaultMaxHistory : maxHistory;
    this.maxCloneHops = maxCloneHops <= 0 ? defaultMaxCloneHops : maxCloneHops;
    this.cloneOffset = cloneOffset <= 0.0 ? defaultCloneOffset : cloneOffset;
  }

}
