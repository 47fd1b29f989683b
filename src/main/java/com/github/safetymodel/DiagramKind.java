package com.github.safetymodel;

/**
 * Kind of a diagram page and the node flavor it holds.
 */
public enum DiagramKind {
  FAULT_TREE(FaultTreeNode.FLAVOR),
  GSN(GsnNode.FLAVOR);

  private final String flavor;

  private DiagramKind(final String flavor) {
    this.flavor = flavor;
  }

  public String getFlavor() {
    return flavor;
  }

  public boolean accepts(final Node node) {
    return node != null && flavor.equals(node.getFlavor());
  }
}
