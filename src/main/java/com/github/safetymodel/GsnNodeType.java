package com.github.safetymodel;

/**
 * Kinds of GSN argumentation elements. Strategies and modules organize the argument itself and
 * cannot be referenced as away elements from another diagram.
 */
public enum GsnNodeType {
  GOAL(true, false),
  STRATEGY(false, false),
  SOLUTION(true, false),
  CONTEXT(true, true),
  ASSUMPTION(true, true),
  JUSTIFICATION(true, true),
  MODULE(false, false);

  private final boolean clonable;
  private final boolean inContext;

  private GsnNodeType(final boolean clonable, final boolean inContext) {
    this.clonable = clonable;
    this.inContext = inContext;
  }

  public boolean isClonable() {
    return clonable;
  }

  /**
   * Linked to its parent with an in-context-of relation instead of solved-by.
   */
  public boolean isInContext() {
    return inContext;
  }
}
