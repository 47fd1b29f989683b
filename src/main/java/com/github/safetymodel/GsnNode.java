package com.github.safetymodel;

import java.util.List;

/**
 * GSN argumentation flavor of {@link Node}.
 */
public final class GsnNode extends Node {
  public static final String FLAVOR = "GSN";

  public static final SharedField<String> MANAGER_NOTES = SharedField.ofString("managerNotes", "");
  public static final SharedField<List<String>> ANNOTATIONS =
      SharedField.ofStringList("annotations");

  static final List<SharedField<?>> schema =
      List.of(NAME, DESCRIPTION, MANAGER_NOTES, ANNOTATIONS);

  private final GsnNodeType type;

  GsnNode(final long id, final GsnNodeType type, final String name) {
    super(id, schema);
    this.type = type;
    set(NAME, name == null ? "" : name);
  }

  public GsnNodeType getType() {
    return type;
  }

  @Override
  public String getFlavor() {
    return FLAVOR;
  }

  @Override
  public String getKindName() {
    return type.name();
  }

  @Override
  public boolean isClonable() {
    return type.isClonable();
  }

  @Override
  GsnNode newInstance(final long newId) {
    return new GsnNode(newId, type, null);
  }

  public String getManagerNotes() {
    return get(MANAGER_NOTES);
  }

  public void setManagerNotes(final String managerNotes) {
    set(MANAGER_NOTES, managerNotes);
  }
}
