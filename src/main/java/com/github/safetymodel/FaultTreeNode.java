package com.github.safetymodel;

import java.util.List;

/**
 * Fault tree flavor of {@link Node}. Also used for the entries of FMEA tables, where a basic event
 * is listed next to its effect and cause.
 */
public final class FaultTreeNode extends Node {
  public static final String FLAVOR = "FTA";

  public static final SharedField<String> RATIONALE = SharedField.ofString("rationale", "");
  public static final SharedField<String> GATE_TYPE = SharedField.ofString("gateType", "");
  public static final SharedField<Double> QUANT_VALUE =
      SharedField.ofDouble("quantValue", null, true);
  public static final SharedField<Integer> SEVERITY = SharedField.ofInteger("severity", null, true);
  public static final SharedField<Double> FAILURE_PROBABILITY =
      SharedField.ofDouble("failureProbability", 0.0, false);
  public static final SharedField<List<String>> SAFETY_REQUIREMENTS =
      SharedField.ofStringList("safetyRequirements");
  public static final SharedField<Boolean> PAGE = SharedField.ofBoolean("page", false);

  static final List<SharedField<?>> schema = List.of(NAME, DESCRIPTION, RATIONALE, GATE_TYPE,
      QUANT_VALUE, SEVERITY, FAILURE_PROBABILITY, SAFETY_REQUIREMENTS, PAGE);

  private final FaultTreeNodeType type;

  FaultTreeNode(final long id, final FaultTreeNodeType type, final String name) {
    super(id, schema);
    this.type = type;
    if (type.isGate()) {
      set(GATE_TYPE, "AND");
    }
    if (type == FaultTreeNodeType.TOP_EVENT) {
      set(SEVERITY, 1);
    }
    set(NAME, name == null || name.isEmpty() ? "Node " + id : name);
  }

  public FaultTreeNodeType getType() {
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
    return true;
  }

  @Override
  FaultTreeNode newInstance(final long newId) {
    return new FaultTreeNode(newId, type, null);
  }

  public String getRationale() {
    return get(RATIONALE);
  }

  public void setRationale(final String rationale) {
    set(RATIONALE, rationale);
  }

  public List<String> getSafetyRequirements() {
    return get(SAFETY_REQUIREMENTS);
  }

  public void setSafetyRequirements(final List<String> safetyRequirements) {
    set(SAFETY_REQUIREMENTS, safetyRequirements);
  }
}
