package com.github.safetymodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import com.github.safetymodel.SafetyModelException.Code;

/**
 * Tests to maintain the sanity and correctness of SynchronizationEngine.
 */
public class SynchronizationEngineTest {
  private SafetyModel model;
  private SynchronizationEngine engine;
  private Diagram page1;
  private Diagram page2;
  private FaultTreeNode primary;
  private Node c1;
  private Node c2;

  @Before
  public void setup() throws SafetyModelException {
    model = new SafetyModel();
    engine = new SynchronizationEngine(model);
    final FaultTreeNode top = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Top");
    page1 = model.createDiagram(DiagramKind.FAULT_TREE, "Page 1", top);
    primary = model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "Motor overheats");
    model.attach(top, primary);
    final FaultTreeNode otherTop = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Other");
    page2 = model.createDiagram(DiagramKind.FAULT_TREE, "Page 2", otherTop);
    c1 = model.cloneNode(primary, page2, otherTop);
    c2 = model.cloneNode(primary, page1, null);
  }

  @Test
  public void testEditOnCloneReachesPrimaryAndSiblings() throws SafetyModelException {
    c1.moveTo(300.0, 40.0);
    c1.setName("Motor overheating");
    c1.set(FaultTreeNode.RATIONALE, "Observed in field data");

    final SynchronizationResult result = engine.synchronize(c1);
    assertTrue(result.isComplete());
    assertEquals(primary.getId(), result.getPrimaryId());
    assertEquals(Arrays.asList(primary.getId(), c2.getId()), result.getTouchedNodeIds());

    for (Node instance : Arrays.asList(primary, c1, c2)) {
      assertEquals("Motor overheating", instance.getName());
      assertEquals("Observed in field data", instance.get(FaultTreeNode.RATIONALE));
    }
    assertEquals("Motor overheating", primary.getDisplayLabel());
    assertEquals("Motor overheating" + Node.CLONE_SUFFIX, c2.getDisplayLabel());
    // local fields stay put
    assertEquals(300.0, c1.getX(), 0.0);
    assertEquals(Node.defaultPosition + 100.0, c2.getX(), 0.0);
    assertEquals(Node.defaultPosition, primary.getX(), 0.0);
  }

  @Test
  public void testListValuesAreCopiedNotShared() throws SafetyModelException {
    primary.setSafetyRequirements(Arrays.asList("SR-7"));
    engine.synchronize(primary);
    assertEquals(Arrays.asList("SR-7"), ((FaultTreeNode) c1).getSafetyRequirements());
    c1.set(FaultTreeNode.SAFETY_REQUIREMENTS, Arrays.asList("SR-8"));
    assertEquals(Arrays.asList("SR-7"), primary.getSafetyRequirements());
  }

  @Test
  public void testPrimaryWithoutClones() throws SafetyModelException {
    final FaultTreeNode lonely = model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "Lonely");
    model.addDetached(page1, lonely);
    lonely.setName("Still lonely");
    final SynchronizationResult result = engine.synchronize(lonely);
    assertTrue(result.getTouchedNodeIds().isEmpty());
    assertEquals("Still lonely", lonely.getDisplayLabel());
  }

  @Test
  public void testCorruptedValueAbortsBeforeAnyWrite() {
    c1.putRawValue(Node.NAME.getName(), "Renamed");
    c1.putRawValue(FaultTreeNode.SEVERITY.getName(), "high");
    try {
      engine.synchronize(c1);
      fail("Expected SYNCHRONIZATION_ABORT");
    } catch (SafetyModelException problem) {
      assertEquals(Code.SYNCHRONIZATION_ABORT, problem.getCode());
      assertEquals("severity", problem.getFieldName());
      assertEquals(Long.valueOf(c1.getId()), problem.getNodeId());
    }
    assertEquals("Motor overheats", primary.getName());
    assertEquals("Motor overheats", c2.getName());
  }

  @Test
  public void testBrokenCloneIsSkippedAndReported() throws SafetyModelException {
    final FaultTreeNode orphan = model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "Orphan");
    model.addDetached(page2, orphan);
    orphan.makeClone(orphan);

    primary.setName("Motor stalls");
    final SynchronizationResult result = engine.synchronize(primary);
    assertFalse(result.isComplete());
    assertEquals(Arrays.asList(orphan.getId()), result.getSkippedNodeIds());
    assertEquals(Arrays.asList(c1.getId(), c2.getId()), result.getTouchedNodeIds());
    assertEquals("Orphan", orphan.getName());
    assertEquals("Motor stalls", c2.getName());
  }

  @Test
  public void testBrokenEditedNodeRaises() {
    c1.makeClone(null);
    try {
      engine.synchronize(c1);
      fail("Expected BROKEN_IDENTITY");
    } catch (SafetyModelException problem) {
      assertEquals(Code.BROKEN_IDENTITY, problem.getCode());
    }
  }

  @Test
  public void testGsnInstances() throws SafetyModelException {
    final GsnNode goal = model.newGsnNode(GsnNodeType.GOAL, "System is safe");
    final Diagram argument = model.createDiagram(DiagramKind.GSN, "Argument", goal);
    final Node away = model.cloneNode(goal, argument, null);
    away.set(GsnNode.MANAGER_NOTES, "Review pending");
    away.set(GsnNode.ANNOTATIONS, Arrays.asList("hazard H1"));
    engine.synchronize(away);
    assertEquals("Review pending", goal.getManagerNotes());
    assertEquals(Arrays.asList("hazard H1"), goal.get(GsnNode.ANNOTATIONS));
    // fault tree instances are a different identity
    assertEquals("Motor overheats", primary.getName());
  }
}
