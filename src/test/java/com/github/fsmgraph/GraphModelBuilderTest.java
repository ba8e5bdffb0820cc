package com.github.fsmgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.github.fsmgraph.DiagramException.Code;
import com.github.fsmgraph.StateDescriptor.StateDescriptorBuilder;
import com.github.fsmgraph.TransitionDescriptor.TransitionDescriptorBuilder;

/**
 * Tests for graph model building: labels, nodes of nested machines and structural problems.
 */
public class GraphModelBuilderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testStateLabels() throws DiagramException {
    final StateDescriptor state = StateDescriptorBuilder.newBuilder("waiting").label("Waiting")
        .tags("idle", "cheap").onEnter("log_entry", "start_timer").onExit("stop_timer")
        .timeout(5, "give_up").build();

    // 1. plain
    assertEquals("Waiting", new GraphModelBuilder(false, false, false).stateLabel(state));

    // 2. with attributes
    assertEquals(
        "Waiting [idle, cheap]\n- enter:\n  + log_entry\n  + start_timer\n- exit:\n  + stop_timer"
            + "\n- timeout(5s) -> (give_up)",
        new GraphModelBuilder(false, true, false).stateLabel(state));

    // 3. fractional timeouts keep their fraction
    final StateDescriptor quick =
        StateDescriptorBuilder.newBuilder("quick").timeout(0.5, "a", "b").build();
    assertEquals("quick\n- timeout(0.5s) -> (a, b)",
        new GraphModelBuilder(false, true, false).stateLabel(quick));
  }

  @Test
  public void testTransitionLabels() {
    final TransitionDescriptor guarded = TransitionDescriptorBuilder.newBuilder("sprint", "A", "B")
        .conditions("is_fast", "is_rested").unless("is_tired").build();
    assertEquals("sprint", new GraphModelBuilder(false, false, false).transitionLabel(guarded));
    assertEquals("sprint [is_fast & is_rested & !is_tired]",
        new GraphModelBuilder(true, false, false).transitionLabel(guarded));

    final TransitionDescriptor internal =
        TransitionDescriptorBuilder.newBuilder("tick", "A", null).label("Tick").build();
    assertEquals("Tick [internal]",
        new GraphModelBuilder(true, false, false).transitionLabel(internal));
  }

  @Test
  public void testNestedNodes() throws DiagramException {
    final StateDescriptor composite = StateDescriptorBuilder.newBuilder("C").children("1", "2")
        .initial("1").transition(TransitionDescriptorBuilder.newBuilder("go", "1", "2").build())
        .build();
    final StateDescriptor parallel = StateDescriptorBuilder.newBuilder("P")
        .children("left", "right").initial("left", "right").parallel(true).build();
    final MachineDefinition markup = new MachineDefinition("nested");
    markup.addStates("A");
    markup.addState(composite);
    markup.addState(parallel);
    markup.addTransition("enter", "A", "C");

    final GraphModel model = new GraphModelBuilder(DiagramConfiguration.defaults()).build(markup);

    // 1. pre-order, anchor right after its composite
    final List<String> names = new ArrayList<>(model.getNodeNames());
    assertEquals("A", names.get(0));
    assertEquals("C", names.get(1));
    assertEquals("C_anchor", names.get(2));
    assertEquals("C.1", names.get(3));
    assertEquals("C.2", names.get(4));
    assertEquals("P", names.get(5));
    assertEquals(8, names.size());

    // 2. node kinds and parents
    assertTrue(model.getNode("C").isComposite());
    assertTrue(model.getNode("C_anchor").isAnchor());
    assertEquals("C", model.getNode("C.1").getParent().get());
    assertFalse(model.getNode("A").getParent().isPresent());
    assertEquals(StyleClass.PARALLEL, model.getNode("P").getDefaultStyle());
    assertTrue(model.getNode("P").isParallel());
    assertEquals(2, model.getChildren("P").size());
    assertTrue(model.isHierarchical());

    // 3. anchor edge always present, autos hidden
    assertEquals(3, model.getEdges().size());
    assertEquals(1, model.getEdges("C_anchor", "C.1").size());
    assertTrue(model.getEdges("C_anchor", "C.1").get(0).isAnchor());
    assertTrue(model.getProblems().isEmpty());
  }

  @Test
  public void testStructuralProblems() throws DiagramException {
    final MachineDefinition markup = new MachineDefinition("problems", false);
    markup.addStates("A", "B", "A");
    markup.addTransition("go", "A", "B");
    markup.addTransition("nowhere", "A", "Z");
    markup.addTransition("from_nowhere", "Y", "A");

    final GraphModel model = new GraphModelBuilder(false, false, false).build(markup);

    // 1. best effort graph
    assertEquals(2, model.getNodes().size());
    assertEquals(1, model.getEdges().size());
    assertFalse(model.isHierarchical());

    // 2. attributable problems
    assertEquals(3, model.getProblems().size());
    assertEquals(Code.DUPLICATE_STATE_NAME, model.getProblems().get(0).getCode());
    assertEquals("A", model.getProblems().get(0).getSubject());
    assertEquals(Code.UNKNOWN_STATE, model.getProblems().get(1).getCode());
    assertEquals("Z", model.getProblems().get(1).getSubject());
    assertEquals(Code.UNKNOWN_STATE, model.getProblems().get(2).getCode());
    assertEquals("Y", model.getProblems().get(2).getSubject());
  }

  @Test
  public void testBuildIsDeterministic() throws DiagramException {
    final MachineDefinition markup = new MachineDefinition("deterministic");
    markup.addStates("A", "B", "C");
    markup.addTransition("go", MachineDefinition.WILDCARD_ALL, "C");
    final GraphModelBuilder builder = new GraphModelBuilder(true, true, true);
    final GraphModel first = builder.build(markup);
    final GraphModel second = builder.build(markup);
    assertEquals(new ArrayList<>(first.getNodeNames()), new ArrayList<>(second.getNodeNames()));
    assertEquals(first.getEdges().size(), second.getEdges().size());
    for (int i = 0; i < first.getEdges().size(); i++) {
      assertEquals(first.getEdges().get(i).getKey(), second.getEdges().get(i).getKey());
      assertEquals(first.getEdges().get(i).getLabel(), second.getEdges().get(i).getLabel());
    }
  }
}
