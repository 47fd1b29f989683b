package com.github.safetymodel;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Immutable, self-contained capture of a whole model forest as a tree of plain records: maps with
 * String keys, lists, String, Number, Boolean and null. A snapshot shares no reference with the live
 * model, so restoring it later is unaffected by edits made since.
 */
public final class Snapshot {
  static final String FORMAT_VERSION = "formatVersion";
  static final String NEXT_ID = "nextId";
  static final String DIAGRAMS = "diagrams";
  static final String FMEA_TABLES = "fmeaTables";
  static final String NODES = "nodes";
  static final String ENTRIES = "entries";
  static final String X = "x";
  static final String Y = "y";

  private static final ObjectMapper CANONICAL_JSON =
      new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

  private final Map<String, Object> content;
  private String digest;

  public Snapshot(final Map<String, Object> content) {
    if (content == null) {
      throw new IllegalArgumentException("Snapshot content cannot be null");
    }
    this.content = castMap(deepCopy(content));
  }

  /**
   * A fresh mutable copy of the record tree.
   */
  public Map<String, Object> toMap() {
    return castMap(deepCopy(content));
  }

  /**
   * The same forest with every node's x and y removed. Two frames that differ only by where their
   * nodes sit compare equal after this.
   */
  public Snapshot withoutPositions() {
    final Map<String, Object> stripped = castMap(deepCopy(content));
    for (Map<String, Object> node : nodeRecords(stripped)) {
      node.remove(X);
      node.remove(Y);
    }
    return new Snapshot(stripped, true);
  }

  /**
   * Id to (x, y) of every node in the frame.
   */
  public Map<Long, double[]> positions() {
    final Map<Long, double[]> positions = new LinkedHashMap<>();
    for (Map<String, Object> node : nodeRecords(content)) {
      final Object id = node.get("id");
      final Object x = node.get(X);
      final Object y = node.get(Y);
      if (id instanceof Number && x instanceof Number && y instanceof Number) {
        positions.put(((Number) id).longValue(),
            new double[] {((Number) x).doubleValue(), ((Number) y).doubleValue()});
      }
    }
    return positions;
  }

  /**
   * Hex SHA-256 of the canonical JSON form: map keys sorted, list order kept.
   */
  public String digest() {
    if (digest == null) {
      try {
        final byte[] canonical = CANONICAL_JSON.writeValueAsBytes(content);
        final MessageDigest sha = MessageDigest.getInstance("SHA-256");
        final byte[] hash = sha.digest(canonical);
        final StringBuilder hex = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
          hex.append(String.format("%02x", b));
        }
        digest = hex.toString();
      } catch (JsonProcessingException problem) {
        // content holds maps, lists and primitives only
        throw new IllegalStateException("Snapshot content is not serializable", problem);
      } catch (NoSuchAlgorithmException problem) {
        // every JDK ships SHA-256
        throw new IllegalStateException(problem);
      }
    }
    return digest;
  }

  @Override
  public int hashCode() {
    return content.hashCode();
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Snapshot)) {
      return false;
    }
    return content.equals(((Snapshot) obj).content);
  }

  @Override
  public String toString() {
    return "Snapshot [diagrams=" + sizeOf(DIAGRAMS) + ", fmeaTables=" + sizeOf(FMEA_TABLES)
        + ", nodes=" + nodeRecords(content).size() + "]";
  }

  // already a private copy
  private Snapshot(final Map<String, Object> content, final boolean owned) {
    this.content = content;
  }

  Map<String, Object> content() {
    return content;
  }

  private int sizeOf(final String key) {
    final Object value = content.get(key);
    return value instanceof List ? ((List<?>) value).size() : 0;
  }

  /**
   * Every node record of every diagram and FMEA table. Malformed sections are skipped.
   */
  static List<Map<String, Object>> nodeRecords(final Map<String, Object> root) {
    final List<Map<String, Object>> nodes = new ArrayList<>();
    collectNodes(root.get(DIAGRAMS), NODES, nodes);
    collectNodes(root.get(FMEA_TABLES), ENTRIES, nodes);
    return nodes;
  }

  private static void collectNodes(final Object sections, final String key,
      final List<Map<String, Object>> nodes) {
    if (!(sections instanceof List)) {
      return;
    }
    for (Object section : (List<?>) sections) {
      if (!(section instanceof Map)) {
        continue;
      }
      final Object records = ((Map<?, ?>) section).get(key);
      if (!(records instanceof List)) {
        continue;
      }
      for (Object record : (List<?>) records) {
        if (record instanceof Map) {
          nodes.add(castMap(record));
        }
      }
    }
  }

  /**
   * Copy a record tree. Maps keep their key order, lists become fresh ArrayLists and leaves are
   * immutable values already.
   */
  static Object deepCopy(final Object value) {
    if (value instanceof Map) {
      final Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List) {
      final List<Object> copy = new ArrayList<>(((List<?>) value).size());
      for (Object element : (List<?>) value) {
        copy.add(deepCopy(element));
      }
      return copy;
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> castMap(final Object value) {
    return (Map<String, Object>) value;
  }
}
