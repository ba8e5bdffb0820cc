package com.github.fsmgraph;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Mutable root markup of a machine: its top-level states and the transitions declared at machine
 * level, with endpoints given as qualified names.
 *
 * Two markup shorthands are resolved when a transition is added: a {@value #WILDCARD_ALL} source
 * stands for every state known at that moment, a {@value #WILDCARD_SAME} destination for the source
 * itself. If auto transitions are enabled, a {@code to_<state>} transition from every state to
 * every state is reported in front of the declared ones. They are flagged as auto so diagrams can
 * hide them.
 *
 * Not thread-safe. Structural changes are expected to go through {@link DiagramMachine} so that
 * graphs get rebuilt.
 */
public final class MachineDefinition implements MarkupScope, Serializable {
  private static final long serialVersionUID = 1L;

  public static final String WILDCARD_ALL = "*";
  public static final String WILDCARD_SAME = "=";
  static final String AUTO_TRIGGER_PREFIX = "to_";

  private final String name;
  private final boolean autoTransitions;
  private final List<StateDescriptor> states = new ArrayList<>();
  private final List<TransitionDescriptor> transitions = new ArrayList<>();

  public MachineDefinition(final String name) {
    this(name, true);
  }

  public MachineDefinition(final String name, final boolean autoTransitions) {
    this.name = name;
    this.autoTransitions = autoTransitions;
  }

  @Override
  public String getName() {
    return name;
  }

  public boolean hasAutoTransitions() {
    return autoTransitions;
  }

  public void addState(final StateDescriptor state) throws DiagramException {
    if (state == null) {
      throw new DiagramException(Code.MARKUP_INCOMPLETE, "Null state cannot be added");
    }
    states.add(state);
  }

  /**
   * Adds plain top-level states without attributes.
   */
  public void addStates(final String... names) throws DiagramException {
    for (final String stateName : names) {
      addState(StateDescriptor.of(stateName));
    }
  }

  /**
   * Adds a machine level transition after resolving wildcard sources and reflexive destinations.
   */
  public void addTransition(final TransitionDescriptor transition) throws DiagramException {
    if (transition == null) {
      throw new DiagramException(Code.MARKUP_INCOMPLETE, "Null transition cannot be added");
    }
    final List<String> sources = WILDCARD_ALL.equals(transition.getSource())
        ? getQualifiedStateNames() : Collections.singletonList(transition.getSource());
    for (final String source : sources) {
      final String dest = transition.getDest().orElse(null);
      transitions.add(transition.withEndpoints(source,
          WILDCARD_SAME.equals(dest) ? source : dest));
    }
  }

  public void addTransition(final String trigger, final String source, final String dest)
      throws DiagramException {
    addTransition(TransitionDescriptor.TransitionDescriptorBuilder
        .newBuilder(trigger, source, dest).build());
  }

  @Override
  public List<StateDescriptor> getChildren() {
    return Collections.unmodifiableList(states);
  }

  /**
   * Generated auto transitions first, if enabled, then the declared ones in declaration order.
   */
  @Override
  public List<TransitionDescriptor> getTransitions() {
    if (!autoTransitions) {
      return Collections.unmodifiableList(transitions);
    }
    final List<String> qualifiedNames = getQualifiedStateNames();
    final List<TransitionDescriptor> all =
        new ArrayList<>(qualifiedNames.size() * qualifiedNames.size() + transitions.size());
    for (final String dest : qualifiedNames) {
      for (final String source : qualifiedNames) {
        all.add(TransitionDescriptor.TransitionDescriptorBuilder
            .newBuilder(AUTO_TRIGGER_PREFIX + dest, source, dest).auto(true).build());
      }
    }
    all.addAll(transitions);
    return Collections.unmodifiableList(all);
  }

  /**
   * Qualified names of every state in the hierarchy, parents before their children, in
   * declaration order. States with incomplete markup are left out.
   */
  public List<String> getQualifiedStateNames() {
    final List<String> names = new ArrayList<>();
    final Deque<PendingState> stack = new ArrayDeque<>();
    for (int i = states.size() - 1; i >= 0; i--) {
      stack.push(new PendingState("", states.get(i)));
    }
    while (!stack.isEmpty()) {
      final PendingState pending = stack.pop();
      if (pending.state == null || pending.state.getName() == null) {
        continue;
      }
      final String qualified = HierarchyFlattener.qualify(pending.parent, pending.state.getName());
      names.add(qualified);
      final List<StateDescriptor> children = pending.state.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new PendingState(qualified, children.get(i)));
      }
    }
    return names;
  }

  private final static class PendingState {
    private final String parent;
    private final StateDescriptor state;

    private PendingState(final String parent, final StateDescriptor state) {
      this.parent = parent;
      this.state = state;
    }
  }

  @Override
  public String toString() {
    return "MachineDefinition [name=" + name + ", autoTransitions=" + autoTransitions
        + ", states=" + states.size() + ", transitions=" + transitions.size() + "]";
  }
}
