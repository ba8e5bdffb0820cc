package com.github.fsmgraph;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.fsmgraph.DiagramException.Code;

/**
 * This object represents immutable markup about a state and, for composite states, the sub-tree
 * below it.
 *
 * The name is the raw, unqualified name. It may not contain {@link HierarchyFlattener#SEPARATOR}
 * since qualified names are built by joining ancestor names with it. A null name is tolerated here
 * and reported as incomplete markup when the graph is built.
 */
public final class StateDescriptor implements MarkupScope, Serializable {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final String label;
  private final Set<String> tags;
  private final List<String> onEnter;
  private final List<String> onExit;
  private final Double timeout;
  private final List<String> onTimeout;
  private final boolean parallel;
  private final List<String> initial;
  private final List<StateDescriptor> children;
  private final List<TransitionDescriptor> transitions;

  @Override
  public String getName() {
    return name;
  }

  public Optional<String> getLabel() {
    return Optional.ofNullable(label);
  }

  public Set<String> getTags() {
    return tags;
  }

  public List<String> getOnEnter() {
    return onEnter;
  }

  public List<String> getOnExit() {
    return onExit;
  }

  public Optional<Double> getTimeout() {
    return Optional.ofNullable(timeout);
  }

  public List<String> getOnTimeout() {
    return onTimeout;
  }

  public boolean isParallel() {
    return parallel;
  }

  /**
   * Names of the children entered by default. A single entry for a non parallel state designates
   * the default child.
   */
  public List<String> getInitial() {
    return initial;
  }

  /**
   * The default child, present only if exactly one child is entered by default and this state is
   * not parallel.
   */
  public Optional<String> getDefaultChild() {
    if (parallel || initial.size() != 1) {
      return Optional.empty();
    }
    return Optional.of(initial.get(0));
  }

  public boolean isComposite() {
    return !children.isEmpty();
  }

  @Override
  public List<StateDescriptor> getChildren() {
    return children;
  }

  @Override
  public List<TransitionDescriptor> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return "StateDescriptor [name=" + name + ", tags=" + tags + ", parallel=" + parallel
        + ", initial=" + initial + ", children=" + children.size() + ", transitions="
        + transitions.size() + "]";
  }

  /**
   * Shorthand for a plain state without attributes.
   */
  public static StateDescriptor of(final String name) throws DiagramException {
    return StateDescriptorBuilder.newBuilder(name).build();
  }

  public final static class StateDescriptorBuilder {
    private final String name;
    private String label;
    private final Set<String> tags = new LinkedHashSet<>();
    private final List<String> onEnter = new ArrayList<>();
    private final List<String> onExit = new ArrayList<>();
    private Double timeout;
    private final List<String> onTimeout = new ArrayList<>();
    private boolean parallel;
    private final List<String> initial = new ArrayList<>();
    private final List<StateDescriptor> children = new ArrayList<>();
    private final List<TransitionDescriptor> transitions = new ArrayList<>();

    public static StateDescriptorBuilder newBuilder(final String name) {
      return new StateDescriptorBuilder(name);
    }

    public StateDescriptorBuilder label(final String label) {
      this.label = label;
      return this;
    }

    public StateDescriptorBuilder tags(final String... tags) {
      this.tags.addAll(Arrays.asList(tags));
      return this;
    }

    public StateDescriptorBuilder onEnter(final String... callbacks) {
      this.onEnter.addAll(Arrays.asList(callbacks));
      return this;
    }

    public StateDescriptorBuilder onExit(final String... callbacks) {
      this.onExit.addAll(Arrays.asList(callbacks));
      return this;
    }

    public StateDescriptorBuilder timeout(final double seconds, final String... onTimeout) {
      this.timeout = seconds;
      this.onTimeout.addAll(Arrays.asList(onTimeout));
      return this;
    }

    public StateDescriptorBuilder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public StateDescriptorBuilder initial(final String... initial) {
      this.initial.addAll(Arrays.asList(initial));
      return this;
    }

    public StateDescriptorBuilder child(final StateDescriptor child) {
      this.children.add(child);
      return this;
    }

    /**
     * Adds plain children without attributes.
     */
    public StateDescriptorBuilder children(final String... names) throws DiagramException {
      for (final String childName : names) {
        this.children.add(StateDescriptor.of(childName));
      }
      return this;
    }

    /**
     * Adds a transition between children of this state, named relative to it.
     */
    public StateDescriptorBuilder transition(final TransitionDescriptor transition) {
      this.transitions.add(transition);
      return this;
    }

    public StateDescriptor build() throws DiagramException {
      validateName(name);
      return new StateDescriptor(this);
    }

    private StateDescriptorBuilder(final String name) {
      this.name = name == null ? null : name.trim();
    }
  }

  static void validateName(final String name) throws DiagramException {
    if (name != null && (name.isEmpty() || name.contains(HierarchyFlattener.SEPARATOR))) {
      throw new DiagramException(Code.INVALID_STATE_NAME, name,
          "Invalid state name '" + name + "': " + Code.INVALID_STATE_NAME.getDescription());
    }
  }

  private StateDescriptor(final StateDescriptorBuilder builder) {
    this.name = builder.name;
    this.label = builder.label;
    this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
    this.onEnter = Collections.unmodifiableList(new ArrayList<>(builder.onEnter));
    this.onExit = Collections.unmodifiableList(new ArrayList<>(builder.onExit));
    this.timeout = builder.timeout;
    this.onTimeout = Collections.unmodifiableList(new ArrayList<>(builder.onTimeout));
    this.parallel = builder.parallel;
    this.initial = Collections.unmodifiableList(new ArrayList<>(builder.initial));
    this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(builder.transitions));
  }
}
