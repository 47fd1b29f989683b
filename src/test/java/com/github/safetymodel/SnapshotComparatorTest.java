package com.github.safetymodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.safetymodel.NodeChange.ChangeType;
import com.github.safetymodel.NodeChange.PropertyDiff;

/**
 * Tests to maintain the sanity and correctness of SnapshotComparator.
 */
public class SnapshotComparatorTest {
  private final SnapshotCodec codec = new SnapshotCodec();
  private final SnapshotComparator comparator = new SnapshotComparator();

  @Test
  public void testIdenticalSnapshotsHaveNoChanges() throws SafetyModelException {
    final SafetyModel model = SnapshotCodecTest.sampleModel();
    assertTrue(comparator.compare(codec.export(model), codec.export(model)).isEmpty());
  }

  @Test
  public void testAddedRemovedModified() throws SafetyModelException {
    final SafetyModel model = new SafetyModel();
    final FaultTreeNode top = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Top");
    final Diagram page = model.createDiagram(DiagramKind.FAULT_TREE, "Page", top);
    final FaultTreeNode doomed = model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "Doomed");
    model.attach(top, doomed);
    final Snapshot older = codec.export(model);

    model.remove(doomed);
    top.setName("Renamed top");
    top.moveTo(75.0, 50.0);
    final FaultTreeNode added = model.newFaultTreeNode(FaultTreeNodeType.HOUSE_EVENT, "New");
    model.addDetached(page, added);
    final Snapshot newer = codec.export(model);

    final Map<ChangeType, NodeChange> byType = new HashMap<>();
    final List<NodeChange> changes = comparator.compare(older, newer);
    assertEquals(3, changes.size());
    for (NodeChange change : changes) {
      byType.put(change.getChangeType(), change);
    }

    final NodeChange removed = byType.get(ChangeType.REMOVED);
    assertEquals(doomed.getId(), removed.getNodeId());
    assertEquals("Doomed", removed.getDisplayName());

    final NodeChange addedChange = byType.get(ChangeType.ADDED);
    assertEquals(added.getId(), addedChange.getNodeId());
    assertEquals("HOUSE_EVENT", addedChange.getKind());

    final NodeChange modified = byType.get(ChangeType.MODIFIED);
    assertEquals(top.getId(), modified.getNodeId());
    final PropertyDiff name = modified.findDiff("shared.name");
    assertNotNull(name);
    assertEquals("Top", name.getOldValue());
    assertEquals("Renamed top", name.getNewValue());
    assertEquals(75.0, modified.findDiff("x").getNewValue());
    assertNull(modified.findDiff("y"));
    assertNotNull(modified.findDiff("childIds"));
  }
}
