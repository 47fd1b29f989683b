package com.github.safetymodel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.safetymodel.SafetyModelException.Code;

/**
 * The model forest: every diagram page, every FMEA table and the flat registry of all node
 * instances placed in them.
 *
 * Notes for users:<br>
 * 1. nodes are created detached via newFaultTreeNode()/newGsnNode() and become part of the model
 * once placed with createDiagram(), attach(), addDetached() or addFmeaEntry().<br>
 * 2. the registry maps id to instance for every placed node. It never owns anything: pages own their
 * trees and tables own their rows.<br>
 * 3. deleting a primary instance promotes its newest surviving clone to primary and re-points the
 * other clones to it. Clones are neither deleted with it nor left orphaned.<br>
 * 4. not thread-safe. All calls are expected on the single UI event thread.<br>
 */
public final class SafetyModel {
  private static final Logger logger = LogManager.getLogger(SafetyModel.class.getSimpleName());

  private final String modelId = UUID.randomUUID().toString();

  private final CloneResolver resolver;
  private final double cloneOffset;

  private long nextId = 1L;
  private final List<Diagram> diagrams = new ArrayList<>();
  private final List<FmeaTable> fmeaTables = new ArrayList<>();

  // K=node.id, V=node, in placement order
  private final Map<Long, Node> registry = new LinkedHashMap<>();

  public SafetyModel() {
    this(new CloneResolver(ModelSessionConfiguration.defaultMaxCloneHops),
        ModelSessionConfiguration.defaultCloneOffset);
  }

  SafetyModel(final CloneResolver resolver, final double cloneOffset) {
    this.resolver = resolver;
    this.cloneOffset = cloneOffset;
  }

  public String getId() {
    return modelId;
  }

  public CloneResolver getResolver() {
    return resolver;
  }

  ///// Node creation /////

  public FaultTreeNode newFaultTreeNode(final FaultTreeNodeType type, final String name) {
    return new FaultTreeNode(nextId++, type, name);
  }

  public GsnNode newGsnNode(final GsnNodeType type, final String name) {
    return new GsnNode(nextId++, type, name);
  }

  ///// Placement /////

  public Diagram createDiagram(final DiagramKind kind, final String name, final Node root)
      throws SafetyModelException {
    if (kind == null || !kind.accepts(root)) {
      throw new SafetyModelException(Code.INVALID_NODE,
          "Root " + root + " cannot start a " + kind + " diagram");
    }
    requireUnplaced(root);
    final Diagram diagram = new Diagram(UUID.randomUUID().toString(), kind, name, root);
    diagrams.add(diagram);
    registerTree(root);
    logDebug(modelId, "Created " + diagram);
    return diagram;
  }

  /**
   * Link child under parent. The child is either a fresh detached node, which is placed on the
   * parent's page, or a node already on that page, which gains a second parent.
   */
  public void attach(final Node parent, final Node child) throws SafetyModelException {
    final Diagram diagram = requireDiagramOf(parent);
    requirePrimaryParent(parent);
    if (!diagram.getKind().accepts(child)) {
      throw new SafetyModelException(Code.INVALID_NODE,
          child + " cannot be placed on " + diagram);
    }
    if (registry.get(child.getId()) == child) {
      if (!diagram.contains(child)) {
        throw new SafetyModelException(Code.INVALID_NODE,
            child + " already lives on another page");
      }
      if (child == parent || reaches(child, parent)) {
        throw new SafetyModelException(Code.INVALID_NODE,
            "Linking " + child.getId() + " under " + parent.getId() + " would create a cycle");
      }
      diagram.mutableDetached().remove(child);
      parent.linkChild(child);
      return;
    }
    requireUnplaced(child);
    parent.linkChild(child);
    registerTree(child);
  }

  /**
   * Unlink child from parent. A child left without parents stays on the page as a detached node.
   */
  public void detach(final Node parent, final Node child) throws SafetyModelException {
    final Diagram diagram = requireDiagramOf(parent);
    if (!parent.getChildren().contains(child)) {
      throw new SafetyModelException(Code.INVALID_NODE,
          child + " is not a child of " + parent.getId());
    }
    parent.unlinkChild(child);
    if (child.getParents().isEmpty() && diagram.getRoot() != child) {
      diagram.mutableDetached().add(child);
    }
  }

  public void addDetached(final Diagram diagram, final Node node) throws SafetyModelException {
    requireOwnDiagram(diagram);
    if (!diagram.getKind().accepts(node)) {
      throw new SafetyModelException(Code.INVALID_NODE, node + " cannot be placed on " + diagram);
    }
    requireUnplaced(node);
    diagram.mutableDetached().add(node);
    registerTree(node);
  }

  public FmeaTable createFmeaTable(final String name) {
    final FmeaTable table = new FmeaTable(name);
    fmeaTables.add(table);
    return table;
  }

  public void addFmeaEntry(final FmeaTable table, final FaultTreeNode entry)
      throws SafetyModelException {
    requireOwnTable(table);
    requireUnplaced(entry);
    if (!entry.getChildren().isEmpty()) {
      throw new SafetyModelException(Code.INVALID_NODE,
          "FMEA rows cannot carry a subtree: " + entry);
    }
    table.mutableEntries().add(entry);
    registry.put(entry.getId(), entry);
  }

  ///// Cloning /////

  /**
   * Create an away instance of source on the target page, under parent when given, else as a
   * detached node. The clone records the resolved primary as its original and takes its shared
   * values from that primary.
   */
  public Node cloneNode(final Node source, final Diagram target, final Node parent)
      throws SafetyModelException {
    requireRegistered(source);
    requireOwnDiagram(target);
    if (!target.getKind().accepts(source)) {
      throw new SafetyModelException(Code.INVALID_NODE, source + " cannot be placed on " + target);
    }
    if (parent != null && !target.contains(parent)) {
      throw new SafetyModelException(Code.INVALID_NODE,
          "Parent " + parent.getId() + " is not on " + target);
    }
    if (parent != null) {
      requirePrimaryParent(parent);
    }
    final Node clone = newCloneOf(source);
    if (parent != null) {
      parent.linkChild(clone);
    } else {
      target.mutableDetached().add(clone);
    }
    registry.put(clone.getId(), clone);
    logDebug(modelId, "Cloned " + source.getId() + " as " + clone.getId() + " on " + target.getId());
    return clone;
  }

  public FaultTreeNode cloneIntoFmea(final FaultTreeNode source, final FmeaTable table)
      throws SafetyModelException {
    requireRegistered(source);
    requireOwnTable(table);
    final FaultTreeNode clone = (FaultTreeNode) newCloneOf(source);
    table.mutableEntries().add(clone);
    registry.put(clone.getId(), clone);
    return clone;
  }

  private Node newCloneOf(final Node source) throws SafetyModelException {
    if (!source.isClonable()) {
      throw new SafetyModelException(Code.CLONE_NOT_ALLOWED,
          source.getKindName() + " nodes cannot be cloned: " + source);
    }
    final Node primary = resolver.resolveOriginal(source);
    final Node clone = source.newInstance(nextId++);
    for (Map.Entry<String, Object> value : primary.sharedValues().entrySet()) {
      clone.putRawValue(value.getKey(), value.getValue());
    }
    clone.makeClone(primary);
    clone.moveTo(source.getX() + cloneOffset, source.getY() + cloneOffset);
    return clone;
  }

  ///// Deletion /////

  /**
   * Delete this instance together with the part of its page that is only reachable through it.
   * Returns every removed instance.
   */
  public List<Node> remove(final Node node) throws SafetyModelException {
    requireRegistered(node);
    final List<Node> removed = new ArrayList<>();
    final FmeaTable table = findFmeaTable(node);
    if (table != null) {
      table.mutableEntries().remove(node);
      removed.add(node);
    } else {
      final Diagram diagram = requireDiagramOf(node);
      final List<Node> before = diagram.getNodes();
      for (Node parent : new ArrayList<>(node.getParents())) {
        parent.unlinkChild(node);
      }
      if (diagram.getRoot() == node) {
        diagram.setRoot(null);
      }
      diagram.mutableDetached().remove(node);
      final Map<Node, Boolean> after = identitySet(diagram.getNodes());
      for (Node candidate : before) {
        if (!after.containsKey(candidate)) {
          removed.add(candidate);
        }
      }
      // survivors must not keep a parent link into the removed part
      for (Node gone : removed) {
        for (Node child : new ArrayList<>(gone.getChildren())) {
          if (after.containsKey(child)) {
            gone.unlinkChild(child);
          }
        }
      }
    }
    for (Node gone : removed) {
      registry.remove(gone.getId());
    }
    for (Node gone : removed) {
      if (gone.isPrimary()) {
        promoteSuccessor(gone);
      }
    }
    logInfo(modelId, "Removed " + removed.size() + " instance(s) starting at " + node.getId());
    return removed;
  }

  public List<Node> removeDiagram(final Diagram diagram) throws SafetyModelException {
    requireOwnDiagram(diagram);
    final List<Node> removed = diagram.getNodes();
    diagrams.remove(diagram);
    for (Node gone : removed) {
      registry.remove(gone.getId());
    }
    for (Node gone : removed) {
      if (gone.isPrimary()) {
        promoteSuccessor(gone);
      }
    }
    logInfo(modelId, "Removed diagram " + diagram.getId() + " with " + removed.size() + " nodes");
    return removed;
  }

  private void promoteSuccessor(final Node formerPrimary) {
    Node successor = null;
    final List<Node> clones = new ArrayList<>();
    for (Node candidate : registry.values()) {
      if (!candidate.isPrimary() && candidate.getOriginal() == formerPrimary) {
        clones.add(candidate);
        if (successor == null || candidate.getId() > successor.getId()) {
          successor = candidate;
        }
      }
    }
    if (successor == null) {
      return;
    }
    successor.makePrimary();
    for (Node clone : clones) {
      if (clone != successor) {
        clone.makeClone(successor);
      }
    }
    logInfo(modelId, String.format("Promoted clone %d to primary of former %d, %d clone(s) re-pointed",
        successor.getId(), formerPrimary.getId(), clones.size() - 1));
  }

  ///// Lookup /////

  public Node findById(final long id) {
    return registry.get(id);
  }

  /**
   * Every placed instance, in placement order.
   */
  public Collection<Node> allNodes() {
    return Collections.unmodifiableCollection(registry.values());
  }

  /**
   * The primary and all clones of node's logical identity. Instances with broken chains are left
   * out.
   */
  public List<Node> instancesOf(final Node node) throws SafetyModelException {
    final Node primary = resolver.resolveOriginal(node);
    final List<Node> instances = new ArrayList<>();
    for (Node candidate : registry.values()) {
      if (resolver.isResolvable(candidate) && resolver.resolveOriginal(candidate) == primary) {
        instances.add(candidate);
      }
    }
    return instances;
  }

  public List<Diagram> getDiagrams() {
    return Collections.unmodifiableList(diagrams);
  }

  public List<FmeaTable> getFmeaTables() {
    return Collections.unmodifiableList(fmeaTables);
  }

  public Diagram findDiagram(final Node node) {
    for (Diagram diagram : diagrams) {
      if (diagram.contains(node)) {
        return diagram;
      }
    }
    return null;
  }

  public FmeaTable findFmeaTable(final Node node) {
    for (FmeaTable table : fmeaTables) {
      for (FaultTreeNode entry : table.getEntries()) {
        if (entry == node) {
          return table;
        }
      }
    }
    return null;
  }

  long peekNextId() {
    return nextId;
  }

  /**
   * Swap in a forest rebuilt by the snapshot codec. Ids are kept, so the sequence moves past the
   * highest one.
   */
  void replaceContents(final List<Diagram> newDiagrams, final List<FmeaTable> newTables,
      final long newNextId) {
    diagrams.clear();
    diagrams.addAll(newDiagrams);
    fmeaTables.clear();
    fmeaTables.addAll(newTables);
    registry.clear();
    long highest = 0L;
    for (Diagram diagram : diagrams) {
      for (Node node : diagram.getNodes()) {
        registry.put(node.getId(), node);
        highest = Math.max(highest, node.getId());
      }
    }
    for (FmeaTable table : fmeaTables) {
      for (FaultTreeNode entry : table.getEntries()) {
        registry.put(entry.getId(), entry);
        highest = Math.max(highest, entry.getId());
      }
    }
    nextId = Math.max(newNextId, highest + 1);
    logDebug(modelId, "Replaced forest: " + diagrams.size() + " diagrams, " + fmeaTables.size()
        + " fmea tables, " + registry.size() + " nodes");
  }

  private void registerTree(final Node start) throws SafetyModelException {
    final Diagram scratch = new Diagram(null, null, null, start);
    for (Node node : scratch.getNodes()) {
      final Node existing = registry.get(node.getId());
      if (existing != null && existing != node) {
        throw new SafetyModelException(Code.INVALID_NODE, "Duplicate node id " + node.getId());
      }
      registry.put(node.getId(), node);
    }
  }

  private static boolean reaches(final Node from, final Node target) {
    final Diagram scratch = new Diagram(null, null, null, from);
    for (Node node : scratch.getNodes()) {
      if (node == target) {
        return true;
      }
    }
    return false;
  }

  private static Map<Node, Boolean> identitySet(final List<Node> nodes) {
    final Map<Node, Boolean> set = new IdentityHashMap<>();
    for (Node node : nodes) {
      set.put(node, Boolean.TRUE);
    }
    return set;
  }

  private void requireUnplaced(final Node node) throws SafetyModelException {
    if (node == null) {
      throw new SafetyModelException(Code.INVALID_NODE, "Node cannot be null");
    }
    if (registry.containsKey(node.getId())) {
      throw new SafetyModelException(Code.INVALID_NODE, node + " is already placed in the model");
    }
  }

  private void requireRegistered(final Node node) throws SafetyModelException {
    if (node == null || registry.get(node.getId()) != node) {
      throw new SafetyModelException(Code.INVALID_NODE, node + " is not part of this model");
    }
  }

  // children hang off the primary only, clones mirror its subtree through their original
  private static void requirePrimaryParent(final Node parent) throws SafetyModelException {
    if (!parent.isPrimary()) {
      throw new SafetyModelException(Code.INVALID_NODE, "Cannot add to clone " + parent.getId()
          + ", select its original " + parent.getOriginal().getId());
    }
  }

  private Diagram requireDiagramOf(final Node node) throws SafetyModelException {
    requireRegistered(node);
    final Diagram diagram = findDiagram(node);
    if (diagram == null) {
      throw new SafetyModelException(Code.INVALID_NODE, node + " is not on a diagram page");
    }
    return diagram;
  }

  private void requireOwnDiagram(final Diagram diagram) throws SafetyModelException {
    if (diagram == null || !diagrams.contains(diagram)) {
      throw new SafetyModelException(Code.INVALID_NODE, diagram + " is not part of this model");
    }
  }

  private void requireOwnTable(final FmeaTable table) throws SafetyModelException {
    if (table == null || !fmeaTables.contains(table)) {
      throw new SafetyModelException(Code.INVALID_NODE, table + " is not part of this model");
    }
  }

  private static void logInfo(final String modelId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String modelId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
          .toString());
    }
  }

  @Override
  public String toString() {
    return "SafetyModel [modelId=" + modelId + ", diagrams=" + diagrams.size() + ", fmeaTables="
        + fmeaTables.size() + ", nodes=" + registry.size() + ", nextId=" + nextId + "]";
  }
}
