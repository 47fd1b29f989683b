package com.github.safetymodel;

/**
 * Kinds of fault tree elements. Every kind may be reused as a clone on another page.
 */
public enum FaultTreeNodeType {
  TOP_EVENT(true),
  GATE(true),
  BASIC_EVENT(false),
  UNDEVELOPED_EVENT(false),
  HOUSE_EVENT(false),
  // transfer to another page
  TRIANGLE(false);

  private final boolean gate;

  private FaultTreeNodeType(final boolean gate) {
    this.gate = gate;
  }

  public boolean isGate() {
    return gate;
  }
}
