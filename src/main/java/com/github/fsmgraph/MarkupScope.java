package com.github.fsmgraph;

import java.util.List;

/**
 * Read-only markup of one level of a state hierarchy: the machine itself at the root, a composite
 * state below it. Transition endpoints are named relative to the scope that declares them.
 *
 * Implementations are provided by whatever engine executes the machine; {@link MachineDefinition}
 * and {@link StateDescriptor} are the in-process ones.
 */
public interface MarkupScope {

  /**
   * Name of this scope, null for an anonymous root.
   */
  String getName();

  /**
   * Direct sub-states in declaration order. Never null.
   */
  List<StateDescriptor> getChildren();

  /**
   * Transitions declared at this level in declaration order. Never null.
   */
  List<TransitionDescriptor> getTransitions();

}
