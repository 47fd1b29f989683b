package com.github.safetymodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One instance of a logical entity in the safety model. The entity may appear as many instances
 * across diagrams: exactly one of them is the primary instance and every other one is a clone whose
 * {@link #getOriginal()} is that primary.
 *
 * Notes for users:<br>
 * 1. shared fields are read and written through {@link SharedField} descriptors of the node's
 * flavor. Setting one only changes this instance; call the session's synchronize() to fan the
 * change out to the other instances.<br>
 * 2. local fields (position, collapsed flag) are per instance and never synchronized.<br>
 * 3. children and parents are owned by the diagram tree the instance lives in. A clone and its
 * primary never share child lists.<br>
 * 4. nodes compare by identity. Two instances of the same logical identity are different
 * nodes.<br>
 */
public abstract class Node {
  public static final String CLONE_SUFFIX = " (clone)";

  public static final SharedField<String> NAME = SharedField.ofString("name", "");
  public static final SharedField<String> DESCRIPTION = SharedField.ofString("description", "");

  static final double defaultPosition = 50.0;

  private final long id;
  private final List<SharedField<?>> schema;

  private boolean primary = true;
  private Node original = this;

  private final Map<String, Object> sharedValues = new LinkedHashMap<>();

  // local, never synchronized
  private double x = defaultPosition;
  private double y = defaultPosition;
  private boolean collapsed;

  private final List<Node> children = new ArrayList<>();
  private final List<Node> parents = new ArrayList<>();

  private String displayLabel = "";

  protected Node(final long id, final List<SharedField<?>> schema) {
    this.id = id;
    this.schema = Collections.unmodifiableList(new ArrayList<>(schema));
    for (SharedField<?> field : schema) {
      sharedValues.put(field.getName(), Snapshot.deepCopy(field.getDefaultValue()));
    }
  }

  /**
   * Short tag of the node family, "FTA" or "GSN". Used by the snapshot codec.
   */
  public abstract String getFlavor();

  /**
   * Name of the immutable node kind, eg. BASIC_EVENT or GOAL.
   */
  public abstract String getKindName();

  /**
   * Structural kinds cannot have away instances.
   */
  public abstract boolean isClonable();

  /**
   * Fresh primary of the same flavor and kind with default shared values.
   */
  abstract Node newInstance(final long newId);

  public long getId() {
    return id;
  }

  /**
   * The id of the direct original. For a well-formed model this is the logical identity; use the
   * clone resolver when the chain may be corrupted.
   */
  public long getLogicalId() {
    return primary || original == null ? id : original.id;
  }

  public boolean isPrimary() {
    return primary;
  }

  public Node getOriginal() {
    return original;
  }

  public List<SharedField<?>> getSchema() {
    return schema;
  }

  public SharedField<?> findField(final String fieldName) {
    for (SharedField<?> field : schema) {
      if (field.getName().equals(fieldName)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Typed read. A value that does not match the field type, as found in a corrupted document, reads
   * as the field default; {@link #getRawValue(String)} exposes it unchanged.
   */
  public <T> T get(final SharedField<T> field) {
    requireField(field);
    final Object value = sharedValues.get(field.getName());
    if (!field.accepts(value)) {
      return field.getDefaultValue();
    }
    return field.cast(value);
  }

  public <T> void set(final SharedField<T> field, final T value) {
    requireField(field);
    if (!field.accepts(value)) {
      throw new IllegalArgumentException(
          "Value " + value + " is not valid for " + field + " of node " + id);
    }
    sharedValues.put(field.getName(), Snapshot.deepCopy(value));
    refreshDisplayLabel();
  }

  public Object getRawValue(final String fieldName) {
    return sharedValues.get(fieldName);
  }

  void putRawValue(final String fieldName, final Object value) {
    sharedValues.put(fieldName, Snapshot.deepCopy(value));
  }

  Map<String, Object> sharedValues() {
    return sharedValues;
  }

  public String getName() {
    return get(NAME);
  }

  public void setName(final String name) {
    set(NAME, name);
  }

  public String getDescription() {
    return get(DESCRIPTION);
  }

  public void setDescription(final String description) {
    set(DESCRIPTION, description);
  }

  public String getDisplayLabel() {
    return displayLabel;
  }

  void refreshDisplayLabel() {
    displayLabel = primary ? getName() : getName() + CLONE_SUFFIX;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public void moveTo(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  public boolean isCollapsed() {
    return collapsed;
  }

  public void setCollapsed(final boolean collapsed) {
    this.collapsed = collapsed;
  }

  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public List<Node> getParents() {
    return Collections.unmodifiableList(parents);
  }

  void makeClone(final Node primaryInstance) {
    this.primary = false;
    this.original = primaryInstance;
    refreshDisplayLabel();
  }

  void makePrimary() {
    this.primary = true;
    this.original = this;
    refreshDisplayLabel();
  }

  void linkChild(final Node child) {
    children.add(child);
    child.parents.add(this);
  }

  void unlinkChild(final Node child) {
    children.remove(child);
    child.parents.remove(this);
  }

  // codec only, lists are rebuilt verbatim in their serialized order
  List<Node> mutableChildren() {
    return children;
  }

  List<Node> mutableParents() {
    return parents;
  }

  private void requireField(final SharedField<?> field) {
    if (field == null || findField(field.getName()) != field) {
      throw new IllegalArgumentException(field + " is not a shared field of " + getFlavor());
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [id=" + id + ", kind=" + getKindName() + ", primary="
        + primary + ", originalId=" + (original == null ? null : original.id) + ", name="
        + sharedValues.get(NAME.getName()) + "]";
  }
}
