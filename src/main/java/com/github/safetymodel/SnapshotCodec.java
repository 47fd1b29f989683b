package com.github.safetymodel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.safetymodel.SafetyModelException.Code;

/**
 * Converts the whole model forest to and from a {@link Snapshot}.
 *
 * Notes for users:<br>
 * 1. export visits every diagram from its root and its detached nodes, each node once, then every
 * FMEA table.<br>
 * 2. import runs in two passes so that clone links, child and parent lists may point forward. The
 * new forest is built aside and only swapped into the model once both passes succeed.<br>
 * 3. a clone whose original is missing from the snapshot is kept as a broken, self-referencing
 * clone. Synchronization reports it later instead of the import failing.<br>
 */
public final class SnapshotCodec {
  private static final Logger logger = LogManager.getLogger(SnapshotCodec.class.getSimpleName());

  static final int formatVersion = 1;

  private static final String ID = "id";
  private static final String NAME = "name";
  private static final String KIND = "kind";
  private static final String ROOT_ID = "rootId";
  private static final String DETACHED_IDS = "detachedIds";
  private static final String FLAVOR = "flavor";
  private static final String PRIMARY = "primary";
  private static final String ORIGINAL_ID = "originalId";
  private static final String COLLAPSED = "collapsed";
  private static final String SHARED = "shared";
  private static final String CHILD_IDS = "childIds";
  private static final String PARENT_IDS = "parentIds";

  public Snapshot export(final SafetyModel model) {
    final Map<String, Object> root = new LinkedHashMap<>();
    root.put(Snapshot.FORMAT_VERSION, formatVersion);
    root.put(Snapshot.NEXT_ID, model.peekNextId());

    final List<Object> diagrams = new ArrayList<>();
    for (Diagram diagram : model.getDiagrams()) {
      final Map<String, Object> record = new LinkedHashMap<>();
      record.put(ID, diagram.getId());
      record.put(NAME, diagram.getName());
      record.put(KIND, diagram.getKind().name());
      record.put(ROOT_ID, diagram.getRoot() == null ? null : diagram.getRoot().getId());
      record.put(DETACHED_IDS, idsOf(diagram.getDetached()));
      final List<Object> nodes = new ArrayList<>();
      for (Node node : diagram.getNodes()) {
        nodes.add(exportNode(node));
      }
      record.put(Snapshot.NODES, nodes);
      diagrams.add(record);
    }
    root.put(Snapshot.DIAGRAMS, diagrams);

    final List<Object> tables = new ArrayList<>();
    for (FmeaTable table : model.getFmeaTables()) {
      final Map<String, Object> record = new LinkedHashMap<>();
      record.put(NAME, table.getName());
      final List<Object> entries = new ArrayList<>();
      for (FaultTreeNode entry : table.getEntries()) {
        entries.add(exportNode(entry));
      }
      record.put(Snapshot.ENTRIES, entries);
      tables.add(record);
    }
    root.put(Snapshot.FMEA_TABLES, tables);
    return new Snapshot(root);
  }

  /**
   * Replace the model's forest with the one in the snapshot. On failure the model is left as it
   * was.
   */
  public void importInto(final SafetyModel model, final Snapshot snapshot)
      throws SafetyModelException {
    if (snapshot == null) {
      throw new SafetyModelException(Code.INVALID_SNAPSHOT, "Snapshot cannot be null");
    }
    final Map<String, Object> root = snapshot.toMap();
    final Object version = root.get(Snapshot.FORMAT_VERSION);
    if (version != null && !(version instanceof Number
        && ((Number) version).intValue() == formatVersion)) {
      throw invalid("unsupported format version " + version);
    }
    final List<Map<String, Object>> diagramRecords = records(root, Snapshot.DIAGRAMS);
    final List<Map<String, Object>> tableRecords = records(root, Snapshot.FMEA_TABLES);

    // pass 1: every node by id
    final Map<Long, Node> byId = new HashMap<>();
    final Map<Long, Map<String, Object>> recordsById = new HashMap<>();
    for (Map<String, Object> diagram : diagramRecords) {
      for (Map<String, Object> record : records(diagram, Snapshot.NODES)) {
        createNode(model, record, byId, recordsById);
      }
    }
    for (Map<String, Object> table : tableRecords) {
      for (Map<String, Object> record : records(table, Snapshot.ENTRIES)) {
        final Node entry = createNode(model, record, byId, recordsById);
        if (!(entry instanceof FaultTreeNode)) {
          throw invalid("FMEA entry " + entry.getId() + " is not a fault tree node");
        }
      }
    }

    // pass 2: links
    for (Map.Entry<Long, Map<String, Object>> entry : recordsById.entrySet()) {
      final Node node = byId.get(entry.getKey());
      final Map<String, Object> record = entry.getValue();
      if (!requireBoolean(record, PRIMARY)) {
        final Object originalId = record.get(ORIGINAL_ID);
        final Node original = originalId instanceof Number
            ? byId.get(((Number) originalId).longValue()) : null;
        if (original == null) {
          logWarning(model.getId(), "Clone " + node.getId() + " refers to missing original "
              + originalId + ", keeping it as a broken clone");
          node.makeClone(node);
        } else {
          node.makeClone(original);
        }
      }
      for (long childId : idList(record, CHILD_IDS)) {
        node.mutableChildren().add(lookup(byId, childId, "child of " + node.getId()));
      }
      for (long parentId : idList(record, PARENT_IDS)) {
        node.mutableParents().add(lookup(byId, parentId, "parent of " + node.getId()));
      }
    }

    final List<Diagram> diagrams = new ArrayList<>();
    for (Map<String, Object> record : diagramRecords) {
      final DiagramKind kind;
      try {
        kind = DiagramKind.valueOf(requireString(record, KIND));
      } catch (IllegalArgumentException unknown) {
        throw new SafetyModelException(Code.INVALID_SNAPSHOT, unknown);
      }
      final Object rootId = record.get(ROOT_ID);
      final Node rootNode = rootId == null ? null
          : lookup(byId, requireLong(record, ROOT_ID), "root of diagram " + record.get(ID));
      final Object diagramId = record.get(ID);
      final Diagram diagram = new Diagram(diagramId == null ? null : String.valueOf(diagramId),
          kind, (String) record.get(NAME), rootNode);
      for (long detachedId : idList(record, DETACHED_IDS)) {
        diagram.mutableDetached().add(lookup(byId, detachedId, "detached node"));
      }
      diagrams.add(diagram);
    }
    final List<FmeaTable> tables = new ArrayList<>();
    for (Map<String, Object> record : tableRecords) {
      final FmeaTable table = new FmeaTable((String) record.get(NAME));
      for (Map<String, Object> entry : records(record, Snapshot.ENTRIES)) {
        table.mutableEntries().add((FaultTreeNode) byId.get(requireLong(entry, ID)));
      }
      tables.add(table);
    }

    for (Node node : byId.values()) {
      node.refreshDisplayLabel();
    }
    final Object nextId = root.get(Snapshot.NEXT_ID);
    model.replaceContents(diagrams, tables,
        nextId instanceof Number ? ((Number) nextId).longValue() : 0L);
    logDebug(model.getId(), "Imported " + byId.size() + " nodes");
  }

  private static Map<String, Object> exportNode(final Node node) {
    final Map<String, Object> record = new LinkedHashMap<>();
    record.put(ID, node.getId());
    record.put(FLAVOR, node.getFlavor());
    record.put(KIND, node.getKindName());
    record.put(PRIMARY, node.isPrimary());
    if (!node.isPrimary()) {
      record.put(ORIGINAL_ID, node.getOriginal() == null ? null : node.getOriginal().getId());
    }
    record.put(Snapshot.X, node.getX());
    record.put(Snapshot.Y, node.getY());
    record.put(COLLAPSED, node.isCollapsed());
    record.put(SHARED, Snapshot.deepCopy(node.sharedValues()));
    record.put(CHILD_IDS, idsOf(node.getChildren()));
    record.put(PARENT_IDS, idsOf(node.getParents()));
    return record;
  }

  private Node createNode(final SafetyModel model, final Map<String, Object> record,
      final Map<Long, Node> byId, final Map<Long, Map<String, Object>> recordsById)
      throws SafetyModelException {
    final long id = requireLong(record, ID);
    if (byId.containsKey(id)) {
      throw invalid("duplicate node id " + id);
    }
    final String flavor = requireString(record, FLAVOR);
    final String kind = requireString(record, KIND);
    requireBoolean(record, PRIMARY);
    final Node node;
    try {
      if (FaultTreeNode.FLAVOR.equals(flavor)) {
        node = new FaultTreeNode(id, FaultTreeNodeType.valueOf(kind), null);
      } else if (GsnNode.FLAVOR.equals(flavor)) {
        node = new GsnNode(id, GsnNodeType.valueOf(kind), null);
      } else {
        throw invalid("unknown flavor " + flavor + " of node " + id);
      }
    } catch (IllegalArgumentException unknownKind) {
      throw invalid("unknown kind " + kind + " of node " + id);
    }

    final Object x = record.get(Snapshot.X);
    final Object y = record.get(Snapshot.Y);
    node.moveTo(x instanceof Number ? ((Number) x).doubleValue() : Node.defaultPosition,
        y instanceof Number ? ((Number) y).doubleValue() : Node.defaultPosition);
    node.setCollapsed(Boolean.TRUE.equals(record.get(COLLAPSED)));

    final Object shared = record.get(SHARED);
    if (shared != null && !(shared instanceof Map)) {
      throw invalid("shared values of node " + id + " are not a record");
    }
    if (shared != null) {
      for (Map.Entry<String, Object> value : Snapshot.castMap(shared).entrySet()) {
        final SharedField<?> field = node.findField(value.getKey());
        if (field == null) {
          logWarning(model.getId(), "Dropping unknown field '" + value.getKey() + "' of node " + id);
          continue;
        }
        final Object coerced = field.coerce(value.getValue());
        if (!field.accepts(coerced)) {
          logWarning(model.getId(), String.format(
              "Field '%s' of node %d holds %s, expected %s; kept as is", field.getName(), id,
              coerced, field.getType().getSimpleName()));
        }
        node.putRawValue(field.getName(), coerced);
      }
    }
    byId.put(id, node);
    recordsById.put(id, record);
    return node;
  }

  private static List<Object> idsOf(final List<? extends Node> nodes) {
    final List<Object> ids = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      ids.add(node.getId());
    }
    return ids;
  }

  private static List<Map<String, Object>> records(final Map<String, Object> parent,
      final String key) throws SafetyModelException {
    final Object value = parent.get(key);
    if (value == null) {
      return new ArrayList<>();
    }
    if (!(value instanceof List)) {
      throw invalid("'" + key + "' is not a list");
    }
    final List<Map<String, Object>> records = new ArrayList<>();
    for (Object element : (List<?>) value) {
      if (!(element instanceof Map)) {
        throw invalid("'" + key + "' holds a non-record element " + element);
      }
      records.add(Snapshot.castMap(element));
    }
    return records;
  }

  private static List<Long> idList(final Map<String, Object> record, final String key)
      throws SafetyModelException {
    final List<Long> ids = new ArrayList<>();
    final Object value = record.get(key);
    if (value == null) {
      return ids;
    }
    if (!(value instanceof List)) {
      throw invalid("'" + key + "' is not a list");
    }
    for (Object element : (List<?>) value) {
      if (!(element instanceof Number)) {
        throw invalid("'" + key + "' holds a non-numeric id " + element);
      }
      ids.add(((Number) element).longValue());
    }
    return ids;
  }

  private static Node lookup(final Map<Long, Node> byId, final long id, final String role)
      throws SafetyModelException {
    final Node node = byId.get(id);
    if (node == null) {
      throw invalid("unknown node " + id + " referenced as " + role);
    }
    return node;
  }

  private static long requireLong(final Map<String, Object> record, final String key)
      throws SafetyModelException {
    final Object value = record.get(key);
    if (!(value instanceof Number)) {
      throw invalid("missing or non-numeric '" + key + "' in " + record.keySet());
    }
    return ((Number) value).longValue();
  }

  private static String requireString(final Map<String, Object> record, final String key)
      throws SafetyModelException {
    final Object value = record.get(key);
    if (!(value instanceof String)) {
      throw invalid("missing or non-text '" + key + "' in " + record.keySet());
    }
    return (String) value;
  }

  private static boolean requireBoolean(final Map<String, Object> record, final String key)
      throws SafetyModelException {
    final Object value = record.get(key);
    if (!(value instanceof Boolean)) {
      throw invalid("missing or non-boolean '" + key + "' in " + record.keySet());
    }
    return (Boolean) value;
  }

  private static SafetyModelException invalid(final String reason) {
    return new SafetyModelException(Code.INVALID_SNAPSHOT, "Invalid snapshot: " + reason);
  }

  private static void logWarning(final String modelId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String modelId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
          .toString());
    }
  }
}
