package com.github.safetymodel;

import org.junit.Test;
import org.openjdk.jmh.annotations.Benchmark;

import com.github.safetymodel.ModelSession.ModelSessionBuilder;
import com.github.safetymodel.ModelSessionConfiguration.ModelSessionConfigurationBuilder;

public class UndoRedoBenchmarkTest {

  @Benchmark
  public void testDragAndUndo() throws SafetyModelException {
    // 1. open a session
    final ModelSessionConfiguration config = ModelSessionConfigurationBuilder.newBuilder()
        .defaultStrategy(CoalescingStrategy.V4).maxHistory(50).build();
    final ModelSession session = ModelSessionBuilder.newBuilder().config(config).build();
    final SafetyModel model = session.getModel();

    // 2. a small fault tree with one away instance
    final FaultTreeNode top = model.newFaultTreeNode(FaultTreeNodeType.TOP_EVENT, "Top");
    final Diagram page = model.createDiagram(DiagramKind.FAULT_TREE, "Page", top);
    final FaultTreeNode gate = model.newFaultTreeNode(FaultTreeNodeType.GATE, "Gate");
    model.attach(top, gate);
    for (int iter = 0; iter < 20; iter++) {
      model.attach(gate, model.newFaultTreeNode(FaultTreeNodeType.BASIC_EVENT, "E" + iter));
    }
    model.cloneNode(gate.getChildren().get(0), page, null);

    // 3. drag the gate around
    session.push();
    for (int iter = 1; iter <= 50; iter++) {
      model.findById(gate.getId()).moveTo(50.0 + iter, 50.0);
      session.push();
    }
    session.commitGesture();

    // 4. undo and redo the drag
    boolean undone = session.undo();
    boolean redone = session.redo();

    // 5. close
    boolean closed = session.close();
  }

  // keeps the benchmark body compiling and running with the unit tests
  @Test
  public void testBenchmarkBodyRuns() throws SafetyModelException {
    testDragAndUndo();
  }

  public static void main(String args[]) throws SafetyModelException {
    UndoRedoBenchmarkTest test = new UndoRedoBenchmarkTest();
    test.testDragAndUndo();
  }

}
