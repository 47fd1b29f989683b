package com.github.safetymodel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * One diagram page. It owns the root of one node tree plus the nodes placed on the page that are not
 * connected yet. Membership is structural: a node belongs to the page iff it is reachable from the
 * root or from one of the detached nodes.
 */
public final class Diagram {
  private final String id;
  private final DiagramKind kind;
  private String name;
  private Node root;
  private final List<Node> detached = new ArrayList<>();

  Diagram(final String id, final DiagramKind kind, final String name, final Node root) {
    this.id = id;
    this.kind = kind;
    this.name = name;
    this.root = root;
  }

  public String getId() {
    return id;
  }

  public DiagramKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  /**
   * Null once the root instance has been deleted.
   */
  public Node getRoot() {
    return root;
  }

  public List<Node> getDetached() {
    return Collections.unmodifiableList(detached);
  }

  /**
   * Every node on the page in a stable order: the root tree depth-first, then each detached tree.
   * A node reachable through several parents is listed once.
   */
  public List<Node> getNodes() {
    final List<Node> nodes = new ArrayList<>();
    final Map<Node, Boolean> visited = new IdentityHashMap<>();
    if (root != null) {
      collect(root, nodes, visited);
    }
    for (Node node : detached) {
      collect(node, nodes, visited);
    }
    return nodes;
  }

  public boolean contains(final Node node) {
    for (Node candidate : getNodes()) {
      if (candidate == node) {
        return true;
      }
    }
    return false;
  }

  void setRoot(final Node root) {
    this.root = root;
  }

  List<Node> mutableDetached() {
    return detached;
  }

  private static void collect(final Node start, final List<Node> nodes,
      final Map<Node, Boolean> visited) {
    final Deque<Node> pending = new ArrayDeque<>();
    pending.push(start);
    while (!pending.isEmpty()) {
      final Node node = pending.pop();
      if (visited.put(node, Boolean.TRUE) != null) {
        continue;
      }
      nodes.add(node);
      final List<Node> children = node.getChildren();
      for (int iter = children.size() - 1; iter >= 0; iter--) {
        pending.push(children.get(iter));
      }
    }
  }

  @Override
  public String toString() {
    return "Diagram [id=" + id + ", kind=" + kind + ", name=" + name + ", rootId="
        + (root == null ? null : root.getId()) + ", detached=" + detached.size() + "]";
  }
}
