package com.github.safetymodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An FMEA worksheet. Its rows are fault tree nodes, either primaries created for the table or clones
 * of basic events that already live on a fault tree page.
 */
public final class FmeaTable {
  private final String name;
  private final List<FaultTreeNode> entries = new ArrayList<>();

  FmeaTable(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public List<FaultTreeNode> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  List<FaultTreeNode> mutableEntries() {
    return entries;
  }

  @Override
  public String toString() {
    return "FmeaTable [name=" + name + ", entries=" + entries.size() + "]";
  }
}
