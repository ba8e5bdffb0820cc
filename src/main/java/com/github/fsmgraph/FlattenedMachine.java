package com.github.fsmgraph;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of flattening a state hierarchy: the top-level states (each still carrying its sub-tree),
 * every transition with qualified endpoints including the synthetic anchors, and whatever markup
 * problems were skipped on the way.
 */
public final class FlattenedMachine {
  private final List<StateDescriptor> states;
  private final List<TransitionDescriptor> transitions;
  private final List<DiagramException> problems;

  FlattenedMachine(final List<StateDescriptor> states,
      final List<TransitionDescriptor> transitions, final List<DiagramException> problems) {
    this.states = Collections.unmodifiableList(states);
    this.transitions = Collections.unmodifiableList(transitions);
    this.problems = Collections.unmodifiableList(problems);
  }

  public List<StateDescriptor> getStates() {
    return states;
  }

  public List<TransitionDescriptor> getTransitions() {
    return transitions;
  }

  public List<DiagramException> getProblems() {
    return problems;
  }

  public boolean isComplete() {
    return problems.isEmpty();
  }

  @Override
  public String toString() {
    return "FlattenedMachine [states=" + states.size() + ", transitions=" + transitions.size()
        + ", problems=" + problems + "]";
  }
}
