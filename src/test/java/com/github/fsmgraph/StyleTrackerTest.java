package com.github.fsmgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StyleTrackerTest {

  @Test
  public void testPreviousTransition() {
    final StyleTracker tracker = new StyleTracker();
    tracker.setNodeStyle("A", StyleClass.ACTIVE);
    tracker.resetStyling();
    assertNull(tracker.getNodeStyle("A"));

    tracker.setPreviousTransition("A", "B");
    assertEquals(StyleClass.PREVIOUS, tracker.getNodeStyle("A"));
    assertEquals(StyleClass.PREVIOUS, tracker.getNodeStyle("B"));
    assertEquals(StyleClass.PREVIOUS, tracker.getEdgeStyle("A", "B"));
    assertNull(tracker.getEdgeStyle("B", "A"));
    assertTrue(tracker.getActiveStates().isEmpty());

    tracker.setNodeStyle("B", StyleClass.ACTIVE);
    assertEquals(1, tracker.getActiveStates().size());
    assertEquals("B", tracker.getActiveStates().get(0));
  }

  @Test
  public void testInternalTransitionHasNoDestination() {
    final StyleTracker tracker = new StyleTracker();
    tracker.setPreviousTransition("A", null);
    assertEquals(StyleClass.PREVIOUS, tracker.getEdgeStyle("A", null));
    assertEquals(1, tracker.getNodeStyles().size());
  }

  @Test
  public void testCopyIsIndependent() {
    final StyleTracker tracker = new StyleTracker();
    tracker.setNodeStyle("A", StyleClass.ACTIVE);
    tracker.setEdgeStyle("A", "B", StyleClass.PREVIOUS);

    final StyleTracker copy = tracker.copy();
    copy.resetStyling();
    copy.setNodeStyle("B", StyleClass.INACTIVE);

    assertEquals(StyleClass.ACTIVE, tracker.getNodeStyle("A"));
    assertEquals(StyleClass.PREVIOUS, tracker.getEdgeStyle("A", "B"));
    assertNull(tracker.getNodeStyle("B"));
    assertNull(copy.getNodeStyle("A"));
  }

  @Test
  public void testResolveFallsBackToBaseline() throws DiagramException {
    final MachineDefinition markup = new MachineDefinition("resolve", false);
    markup.addStates("A");
    markup.addState(StateDescriptor.StateDescriptorBuilder.newBuilder("P").children("x", "y")
        .parallel(true).build());
    markup.addTransition("go", "A", "P");
    final GraphModel model = new GraphModelBuilder(false, false, false).build(markup);

    final StyleTracker tracker = new StyleTracker();
    assertEquals(StyleClass.DEFAULT, tracker.resolve(model.getNode("A")));
    assertEquals(StyleClass.PARALLEL, tracker.resolve(model.getNode("P")));
    assertEquals(StyleClass.DEFAULT, tracker.resolve(model.getEdges().get(0)));

    tracker.setNodeStyle("P", StyleClass.ACTIVE);
    tracker.setEdgeStyle("A", "P", StyleClass.PREVIOUS);
    assertEquals(StyleClass.ACTIVE, tracker.resolve(model.getNode("P")));
    assertEquals(StyleClass.PREVIOUS, tracker.resolve(model.getEdges().get(0)));
  }
}
