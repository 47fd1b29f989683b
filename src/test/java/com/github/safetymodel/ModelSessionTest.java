package com.github.safetymodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.safetymodel.ModelSession.ModelSessionBuilder;
import com.github.safetymodel.ModelSessionConfiguration.ModelSessionConfigurationBuilder;
import com.github.safetymodel.SafetyModelException.Code;

/**
 * End to end tests of ModelSession: edit, synchronize, push, undo, redo.
 */
public class ModelSessionTest {
  private static final Logger logger = LogManager.getLogger(ModelSessionTest.class.getSimpleName());

  @Test
  public void testEditSynchronizeUndoFlow() throws SafetyModelException {
    // 1. open a session
    final ModelSession session = ModelSessionBuilder.newBuilder().build();
    assertTrue(session.alive());
    final SafetyModel model = session.getModel();

    // 2. build two pages sharing one basic event
    final FaultTreeNode top = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Top");
    final Diagram page1 = model.createDiagram(DiagramKind.FAULT_TREE, "Page 1", top);
    final FaultTreeNode pump = model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "Pump");
    model.attach(top, pump);
    final FaultTreeNode otherTop = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Other");
    model.createDiagram(DiagramKind.FAULT_TREE, "Page 2", otherTop);
    final Node away = model.cloneNode(pump, model.getDiagrams().get(1), otherTop);
    session.push();
    session.commitGesture();

    // 3. rename through the clone
    away.setName("Pump seizes");
    final SynchronizationResult result = session.synchronize(away);
    assertEquals(pump.getId(), result.getPrimaryId());
    assertEquals("Pump seizes", pump.getName());
    session.push();
    session.commitGesture();

    // 4. undo restores both instances
    assertTrue(session.canUndo());
    assertTrue(session.undo());
    assertEquals("Pump", model.findById(pump.getId()).getName());
    assertEquals("Pump", model.findById(away.getId()).getName());

    // 5. redo brings the rename back on every instance
    assertTrue(session.redo());
    assertEquals("Pump seizes", model.findById(pump.getId()).getName());
    assertEquals("Pump seizes" + Node.CLONE_SUFFIX, model.findById(away.getId()).getDisplayLabel());
    assertEquals(page1.getName(), model.getDiagrams().get(0).getName());

    logger.info(session.getStatistics());
    assertEquals(1, session.getStatistics().getTotalSynchronizations());
    assertEquals(1, session.getStatistics().getTotalUndos());
    assertEquals(1, session.getStatistics().getTotalRedos());

    assertTrue(session.close());
    assertFalse(session.alive());
  }

  @Test
  public void testPushBeforeEachEdit() throws SafetyModelException {
    final ModelSession session = ModelSessionBuilder.newBuilder().build();
    final SafetyModel model = session.getModel();
    final GsnNode goal = model.newGsnNode(GsnNodeType.GOAL, "Orig");
    final Diagram argument = model.createDiagram(DiagramKind.GSN, "Argument", goal);
    final Node c1 = model.cloneNode(goal, argument, null);
    final Node c2 = model.cloneNode(goal, argument, null);

    // dialog edit: push, mutate, synchronize
    session.push();
    model.findById(c1.getId()).setName("Updated");
    session.synchronize(model.findById(c1.getId()));
    session.commitGesture();
    assertEquals("Updated", model.findById(c2.getId()).getName());

    // drag of c1: push before every motion event
    final double startX = model.findById(c1.getId()).getX();
    for (int iter = 1; iter <= 10; iter++) {
      session.push();
      model.findById(c1.getId()).moveTo(startX + iter, 0.0);
    }
    session.commitGesture();

    assertTrue(session.undo());
    assertEquals(startX, model.findById(c1.getId()).getX(), 0.0);
    assertEquals("Updated", model.findById(goal.getId()).getName());
    assertTrue(session.undo());
    assertEquals("Orig", model.findById(c2.getId()).getName());

    // a new edit after undo wins over the undone ones
    session.push();
    model.findById(goal.getId()).setName("Replacement");
    session.synchronize(model.findById(goal.getId()));
    session.commitGesture();
    assertFalse(session.canRedo());
    assertFalse(session.redo());
    assertEquals("Replacement", model.findById(c1.getId()).getName());
    session.close();
  }

  @Test
  public void testDragWithNamedStrategies() throws SafetyModelException {
    for (String name : new String[] {"v1", "v2", "v3", "V4"}) {
      final CoalescingStrategy strategy = CoalescingStrategy.fromName(name);
      final ModelSession session = ModelSessionBuilder.newBuilder().build();
      final SafetyModel model = session.getModel();
      final GsnNode goal = model.newGsnNode(GsnNodeType.GOAL, "G1");
      model.createDiagram(DiagramKind.GSN, "Argument", goal);

      session.push(strategy);
      for (int iter = 1; iter <= 9; iter++) {
        model.findById(goal.getId()).moveTo(50.0 + iter, 50.0 + iter);
        session.push(strategy);
      }
      session.commitGesture();
      assertTrue(session.undo(strategy));
      assertEquals(name, 50.0, model.findById(goal.getId()).getY(), 0.0);
      assertFalse(name, session.undo(strategy));
      session.close();
    }
  }

  @Test
  public void testUnknownStrategyName() {
    try {
      CoalescingStrategy.fromName("v9");
      fail("Expected UNKNOWN_STRATEGY");
    } catch (SafetyModelException problem) {
      assertEquals(Code.UNKNOWN_STRATEGY, problem.getCode());
    }
  }

  @Test
  public void testImportStartsFreshHistory() throws SafetyModelException {
    final ModelSession source = ModelSessionBuilder.newBuilder().build();
    source.getModel().createDiagram(DiagramKind.GSN, "Argument",
        source.getModel().newGsnNode(GsnNodeType.GOAL, "G1"));
    final Snapshot file = source.exportSnapshot();

    final ModelSession session = ModelSessionBuilder.newBuilder().build();
    session.push();
    session.getModel().createFmeaTable("Scratch");
    session.push();
    session.commitGesture();
    session.importSnapshot(file);
    assertFalse(session.canUndo());
    assertFalse(session.canRedo());
    assertEquals(1, session.getModel().getDiagrams().size());
    assertTrue(session.getModel().getFmeaTables().isEmpty());
    assertTrue(session.compare(file, session.exportSnapshot()).isEmpty());
  }

  @Test
  public void testInitialSnapshotAndCompare() throws SafetyModelException {
    final Snapshot file = new SnapshotCodec().export(SnapshotCodecTest.sampleModel());
    final ModelSession session = ModelSessionBuilder.newBuilder().initialSnapshot(file).build();
    final Node root = session.getModel().getDiagrams().get(0).getRoot();
    root.setName("Loss of braking on wet road");
    session.synchronize(root);
    final List<NodeChange> changes = session.compare(file, session.exportSnapshot());
    assertEquals(1, changes.size());
    assertEquals(NodeChange.ChangeType.MODIFIED, changes.get(0).getChangeType());
  }

  @Test
  public void testSynchronizationAbortIsCounted() throws SafetyModelException {
    final ModelSession session = ModelSessionBuilder.newBuilder().build();
    final FaultTreeNode top =
        session.getModel().newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Top");
    session.getModel().createDiagram(DiagramKind.FAULT_TREE, "Page", top);
    top.putRawValue(FaultTreeNode.PAGE.getName(), "yes");
    try {
      session.synchronize(top);
      fail("Expected SYNCHRONIZATION_ABORT");
    } catch (SafetyModelException problem) {
      assertEquals(Code.SYNCHRONIZATION_ABORT, problem.getCode());
      assertEquals("page", problem.getFieldName());
    }
    assertEquals(1, session.getStatistics().getTotalSynchronizationAborts());
  }

  @Test
  public void testClosedSessionRefusesRequests() throws SafetyModelException {
    final ModelSession session = ModelSessionBuilder.newBuilder().build();
    assertTrue(session.close());
    assertTrue(session.close());
    try {
      session.undo();
      fail("Expected SESSION_CLOSED");
    } catch (SafetyModelException problem) {
      assertEquals(Code.SESSION_CLOSED, problem.getCode());
    }
    try {
      session.getModel();
      fail("Expected SESSION_CLOSED");
    } catch (SafetyModelException problem) {
      assertEquals(Code.SESSION_CLOSED, problem.getCode());
    }
  }

  @Test
  public void testConfiguration() throws SafetyModelException {
    final ModelSessionConfiguration defaults = ModelSessionConfiguration.defaults();
    assertEquals(CoalescingStrategy.V4, defaults.getDefaultStrategy());
    assertEquals(20, defaults.getMaxHistory());
    assertEquals(64, defaults.getMaxCloneHops());
    assertEquals(100.0, defaults.getCloneOffset(), 0.0);

    final ModelSessionConfiguration config = ModelSessionConfigurationBuilder.newBuilder()
        .defaultStrategy(CoalescingStrategy.V2).maxHistory(3).maxCloneHops(4).cloneOffset(25.0)
        .build();
    final ModelSession session = ModelSessionBuilder.newBuilder().config(config).build();
    assertEquals(CoalescingStrategy.V2, session.getConfiguration().getDefaultStrategy());
    assertEquals(4, session.getModel().getResolver().getMaxHops());

    final SafetyModel model = session.getModel();
    final GsnNode goal = model.newGsnNode(GsnNodeType.GOAL, "G1");
    final Diagram argument = model.createDiagram(DiagramKind.GSN, "Argument", goal);
    final Node clone = model.cloneNode(goal, argument, null);
    assertEquals(goal.getX() + 25.0, clone.getX(), 0.0);

    try {
      ModelSessionConfigurationBuilder.newBuilder().maxHistory(1).build();
      fail("Expected INVALID_SESSION_CONFIG");
    } catch (SafetyModelException problem) {
      assertEquals(Code.INVALID_SESSION_CONFIG, problem.getCode());
    }
    try {
      ModelSessionConfigurationBuilder.newBuilder().defaultStrategy(null).build();
      fail("Expected INVALID_SESSION_CONFIG");
    } catch (SafetyModelException problem) {
      assertEquals(Code.INVALID_SESSION_CONFIG, problem.getCode());
    }
  }
}
