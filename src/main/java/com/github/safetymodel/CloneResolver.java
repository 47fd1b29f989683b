package com.github.safetymodel;

/**
 * Walks a clone chain to the primary instance of its logical identity. The walk is bounded so that a
 * corrupted document with a cycle or a dangling link fails fast instead of looping forever. It has
 * no side effects.
 */
public final class CloneResolver {
  private final int maxHops;

  public CloneResolver(final int maxHops) {
    this.maxHops = maxHops <= 0 ? ModelSessionConfiguration.defaultMaxCloneHops : maxHops;
  }

  public int getMaxHops() {
    return maxHops;
  }

  /**
   * Return the node itself if it is primary, else follow {@link Node#getOriginal()} until a primary
   * is reached.
   */
  public Node resolveOriginal(final Node node) throws SafetyModelException {
    if (node == null) {
      throw new SafetyModelException(SafetyModelException.Code.INVALID_NODE,
          "Cannot resolve the original of a null node");
    }
    Node current = node;
    for (int hops = 0; hops <= maxHops; hops++) {
      if (current.isPrimary()) {
        return current;
      }
      final Node next = current.getOriginal();
      if (next == null) {
        throw SafetyModelException.brokenIdentity(node.getId(),
            "node " + current.getId() + " has no original");
      }
      if (next == current) {
        throw SafetyModelException.brokenIdentity(node.getId(),
            "non-primary node " + current.getId() + " is its own original");
      }
      current = next;
    }
    throw SafetyModelException.brokenIdentity(node.getId(),
        "no primary instance within " + maxHops + " hops");
  }

  public boolean isResolvable(final Node node) {
    try {
      resolveOriginal(node);
      return true;
    } catch (SafetyModelException broken) {
      return false;
    }
  }
}
