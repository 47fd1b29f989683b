package com.github.safetymodel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.github.safetymodel.NodeChange.ChangeType;
import com.github.safetymodel.NodeChange.PropertyDiff;

/**
 * Reports which nodes were added, removed or modified between an older and a newer snapshot. Nodes
 * are matched by id across every diagram and FMEA table, so a node that only moved between pages
 * shows up as modified at most.
 */
public final class SnapshotComparator {
  private static final String SHARED = "shared";

  public List<NodeChange> compare(final Snapshot older, final Snapshot newer) {
    final Map<Long, Map<String, Object>> before = indexById(older);
    final Map<Long, Map<String, Object>> after = indexById(newer);
    final List<NodeChange> changes = new ArrayList<>();

    for (Map.Entry<Long, Map<String, Object>> entry : before.entrySet()) {
      final Map<String, Object> newRecord = after.get(entry.getKey());
      if (newRecord == null) {
        changes.add(change(ChangeType.REMOVED, entry.getKey(), entry.getValue(),
            new ArrayList<>()));
        continue;
      }
      final List<PropertyDiff> diffs = diff(flatten(entry.getValue()), flatten(newRecord));
      if (!diffs.isEmpty()) {
        changes.add(change(ChangeType.MODIFIED, entry.getKey(), newRecord, diffs));
      }
    }
    for (Map.Entry<Long, Map<String, Object>> entry : after.entrySet()) {
      if (!before.containsKey(entry.getKey())) {
        changes.add(change(ChangeType.ADDED, entry.getKey(), entry.getValue(), new ArrayList<>()));
      }
    }
    return changes;
  }

  private static Map<Long, Map<String, Object>> indexById(final Snapshot snapshot) {
    final Map<Long, Map<String, Object>> index = new LinkedHashMap<>();
    for (Map<String, Object> record : Snapshot.nodeRecords(snapshot.content())) {
      final Object id = record.get("id");
      if (id instanceof Number) {
        index.put(((Number) id).longValue(), record);
      }
    }
    return index;
  }

  private static Map<String, Object> flatten(final Map<String, Object> record) {
    final Map<String, Object> properties = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : record.entrySet()) {
      if (SHARED.equals(entry.getKey()) && entry.getValue() instanceof Map) {
        for (Map.Entry<String, Object> shared : Snapshot.castMap(entry.getValue()).entrySet()) {
          properties.put(SHARED + "." + shared.getKey(), shared.getValue());
        }
      } else {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
    return properties;
  }

  private static List<PropertyDiff> diff(final Map<String, Object> oldProperties,
      final Map<String, Object> newProperties) {
    final List<PropertyDiff> diffs = new ArrayList<>();
    for (Map.Entry<String, Object> entry : oldProperties.entrySet()) {
      final Object newValue = newProperties.get(entry.getKey());
      if (!Objects.equals(entry.getValue(), newValue)) {
        diffs.add(new PropertyDiff(entry.getKey(), entry.getValue(), newValue));
      }
    }
    for (Map.Entry<String, Object> entry : newProperties.entrySet()) {
      if (!oldProperties.containsKey(entry.getKey())) {
        diffs.add(new PropertyDiff(entry.getKey(), null, entry.getValue()));
      }
    }
    return diffs;
  }

  private static NodeChange change(final ChangeType type, final long id,
      final Map<String, Object> record, final List<PropertyDiff> diffs) {
    String name = null;
    final Object shared = record.get(SHARED);
    if (shared instanceof Map) {
      final Object value = Snapshot.castMap(shared).get(Node.NAME.getName());
      name = value == null ? null : String.valueOf(value);
    }
    final Object kind = record.get("kind");
    return new NodeChange(type, id, kind == null ? null : String.valueOf(kind), name, diffs);
  }
}
