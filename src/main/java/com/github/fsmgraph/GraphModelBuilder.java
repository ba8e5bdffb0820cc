package com.github.fsmgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Turns a {@link FlattenedMachine} into a {@link GraphModel}. Pure: the same input and display
 * flags always produce an equal model.
 *
 * Node labels are the state label (or name), optionally followed by tags, enter/exit callbacks and
 * the timeout clause. Edge labels are the label override (or trigger), marked {@code [internal]}
 * for internal transitions and optionally followed by the guard expression, e.g.
 * {@code sprint [is_fast & !is_tired]}.
 */
public final class GraphModelBuilder {
  private static final Logger logger =
      LogManager.getLogger(GraphModelBuilder.class.getSimpleName());

  static final String INTERNAL_SUFFIX = " [internal]";

  private final boolean showConditions;
  private final boolean showStateAttributes;
  private final boolean showAutoTransitions;
  private final HierarchyFlattener flattener = new HierarchyFlattener();

  public GraphModelBuilder(final DiagramConfiguration config) {
    this(config.getShowConditions(), config.getShowStateAttributes(),
        config.getShowAutoTransitions());
  }

  public GraphModelBuilder(final boolean showConditions, final boolean showStateAttributes,
      final boolean showAutoTransitions) {
    this.showConditions = showConditions;
    this.showStateAttributes = showStateAttributes;
    this.showAutoTransitions = showAutoTransitions;
  }

  /**
   * Flattens the markup and builds its model.
   */
  public GraphModel build(final MarkupScope markup) {
    return build(flattener.flatten(markup));
  }

  public GraphModel build(final FlattenedMachine machine) {
    final List<DiagramException> problems = new ArrayList<>(machine.getProblems());
    final Set<String> anchored = new HashSet<>();
    for (final TransitionDescriptor transition : machine.getTransitions()) {
      if (transition.isAnchor()) {
        anchored.add(transition.getSource());
      }
    }

    final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    final Map<StateDescriptor, String> descriptors = new IdentityHashMap<>();
    final Deque<NodeEntry> stack = new ArrayDeque<>();
    final List<StateDescriptor> topLevel = machine.getStates();
    for (int i = topLevel.size() - 1; i >= 0; i--) {
      stack.push(new NodeEntry(null, topLevel.get(i)));
    }
    while (!stack.isEmpty()) {
      final NodeEntry entry = stack.pop();
      final StateDescriptor state = entry.state;
      if (state == null || state.getName() == null) {
        // already reported by the flattener
        continue;
      }
      final String name = HierarchyFlattener.qualify(entry.parent, state.getName());
      if (nodes.containsKey(name)) {
        problems.add(problem(Code.DUPLICATE_STATE_NAME, name,
            "State '" + name + "' is declared more than once, later declaration ignored"));
        continue;
      }
      nodes.put(name, new GraphNode(name, stateLabel(state), entry.parent,
          state.isParallel() ? StyleClass.PARALLEL : StyleClass.DEFAULT, state.isComposite(),
          false));
      descriptors.put(state, name);
      final String anchorName = name + HierarchyFlattener.ANCHOR_SUFFIX;
      if (anchored.contains(anchorName)) {
        nodes.put(anchorName, new GraphNode(anchorName, "", name, StyleClass.DEFAULT, false, true));
      }
      final List<StateDescriptor> children = state.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new NodeEntry(name, children.get(i)));
      }
    }

    final List<GraphEdge> edges = new ArrayList<>();
    for (final TransitionDescriptor transition : machine.getTransitions()) {
      if (transition.isAuto() && !showAutoTransitions) {
        continue;
      }
      final String source = transition.getSource();
      final String dest = transition.getDest().orElse(null);
      if (!nodes.containsKey(source)) {
        problems.add(problem(Code.UNKNOWN_STATE, source, "Transition '" + transition.getTrigger()
            + "' starts at unknown state '" + source + "' and was dropped"));
        continue;
      }
      if (dest != null && !nodes.containsKey(dest)) {
        problems.add(problem(Code.UNKNOWN_STATE, dest, "Transition '" + transition.getTrigger()
            + "' ends at unknown state '" + dest + "' and was dropped"));
        continue;
      }
      edges.add(new GraphEdge(transition.getTrigger(), source, dest, transitionLabel(transition),
          transition.isAuto(), transition.isAnchor()));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Built graph model with " + nodes.size() + " nodes and " + edges.size()
          + " edges");
    }
    return new GraphModel(nodes, edges, problems, descriptors);
  }

  String stateLabel(final StateDescriptor state) {
    final StringBuilder label = new StringBuilder(state.getLabel().orElse(state.getName()));
    if (showStateAttributes) {
      if (!state.getTags().isEmpty()) {
        label.append(" [").append(String.join(", ", state.getTags())).append(']');
      }
      if (!state.getOnEnter().isEmpty()) {
        label.append("\n- enter:\n  + ").append(String.join("\n  + ", state.getOnEnter()));
      }
      if (!state.getOnExit().isEmpty()) {
        label.append("\n- exit:\n  + ").append(String.join("\n  + ", state.getOnExit()));
      }
      if (state.getTimeout().isPresent()) {
        label.append("\n- timeout(").append(formatSeconds(state.getTimeout().get()))
            .append("s) -> (").append(String.join(", ", state.getOnTimeout())).append(')');
      }
    }
    return label.toString();
  }

  String transitionLabel(final TransitionDescriptor transition) {
    final StringBuilder label =
        new StringBuilder(transition.getLabel().orElse(transition.getTrigger()));
    if (transition.isInternal()) {
      label.append(INTERNAL_SUFFIX);
    }
    if (showConditions
        && (!transition.getConditions().isEmpty() || !transition.getUnless().isEmpty())) {
      final List<String> guards = new ArrayList<>(transition.getConditions());
      for (final String unless : transition.getUnless()) {
        guards.add("!" + unless);
      }
      label.append(" [").append(String.join(" & ", guards)).append(']');
    }
    return label.toString();
  }

  private static String formatSeconds(final double seconds) {
    if (seconds == Math.rint(seconds) && !Double.isInfinite(seconds)) {
      return Long.toString((long) seconds);
    }
    return Double.toString(seconds);
  }

  private static DiagramException problem(final Code code, final String subject,
      final String message) {
    logger.warn(message);
    return new DiagramException(code, subject, message);
  }

  private final static class NodeEntry {
    private final String parent;
    private final StateDescriptor state;

    private NodeEntry(final String parent, final StateDescriptor state) {
      this.parent = parent;
      this.state = state;
    }
  }
}
