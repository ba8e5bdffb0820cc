package com.github.fsmgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgraph.DiagramException.Code;

/**
 * Walks a nested markup tree breadth-first and flattens it into top-level states plus transitions
 * whose endpoints are qualified names, i.e. ancestor names joined with {@link #SEPARATOR}.
 *
 * For every composite state with a single default child an anchor transition is synthesized from
 * {@code <qualified-state>_anchor} to {@code <qualified-state>.<default-child>} with an empty
 * trigger. Nested states are not registered at top level; they stay reachable through their parent
 * so that every qualified name shows up exactly once.
 *
 * Incomplete markup never aborts the walk. The offending element is skipped, logged and reported
 * in {@link FlattenedMachine#getProblems()}.
 */
public final class HierarchyFlattener {
  private static final Logger logger =
      LogManager.getLogger(HierarchyFlattener.class.getSimpleName());

  public static final String SEPARATOR = ".";
  public static final String ANCHOR_SUFFIX = "_anchor";

  public FlattenedMachine flatten(final MarkupScope root) {
    final List<StateDescriptor> states = new ArrayList<>();
    final List<TransitionDescriptor> transitions = new ArrayList<>();
    final List<DiagramException> problems = new ArrayList<>();

    final Deque<ScopeEntry> queue = new ArrayDeque<>();
    queue.add(new ScopeEntry("", root));
    while (!queue.isEmpty()) {
      final ScopeEntry entry = queue.poll();
      final String prefix = entry.prefix;

      for (final TransitionDescriptor transition : entry.scope.getTransitions()) {
        if (transition == null || transition.getTrigger() == null) {
          problems.add(problem(Code.MARKUP_INCOMPLETE, prefix,
              "Transition without trigger in scope '" + prefix + "' skipped: " + transition));
          continue;
        }
        if (transition.getSource() == null) {
          problems.add(problem(Code.INVALID_TRANSITION, transition.getTrigger(),
              "Transition '" + transition.getTrigger() + "' has no source and was skipped"));
          continue;
        }
        if (prefix.isEmpty()) {
          transitions.add(transition);
        } else {
          // internal transitions keep their absent destination
          transitions.add(transition.withEndpoints(qualify(prefix, transition.getSource()),
              transition.getDest().map(dest -> qualify(prefix, dest)).orElse(null)));
        }
      }

      for (final StateDescriptor state : entry.scope.getChildren()) {
        if (state == null || state.getName() == null) {
          problems.add(problem(Code.MARKUP_INCOMPLETE, prefix,
              "State without name in scope '" + prefix + "' skipped"));
          continue;
        }
        if (prefix.isEmpty()) {
          states.add(state);
        }
        final String qualified = qualify(prefix, state.getName());
        if (state.getDefaultChild().isPresent() && state.isComposite()) {
          final String initial = state.getDefaultChild().get();
          if (hasChild(state, initial)) {
            transitions.add(TransitionDescriptor.TransitionDescriptorBuilder
                .newBuilder("", qualified + ANCHOR_SUFFIX, qualify(qualified, initial))
                .anchor(true).build());
          } else {
            problems.add(problem(Code.INVALID_INITIAL_STATE, qualified, "Initial state '"
                + initial + "' is not a child of '" + qualified + "', no anchor created"));
          }
        }
        if (state.isComposite()) {
          queue.add(new ScopeEntry(qualified, state));
        }
      }
    }
    if (!problems.isEmpty()) {
      logger.error("Graph creation incomplete! " + problems.size() + " markup problem(s) found");
    }
    return new FlattenedMachine(states, transitions, problems);
  }

  /**
   * Joins a (possibly empty) qualified prefix and a raw name.
   */
  public static String qualify(final String prefix, final String name) {
    if (prefix == null || prefix.isEmpty()) {
      return name;
    }
    return prefix + SEPARATOR + name;
  }

  private static boolean hasChild(final StateDescriptor state, final String name) {
    for (final StateDescriptor child : state.getChildren()) {
      if (child != null && name.equals(child.getName())) {
        return true;
      }
    }
    return false;
  }

  private static DiagramException problem(final Code code, final String subject,
      final String message) {
    logger.warn(message);
    return new DiagramException(code, subject, message);
  }

  private final static class ScopeEntry {
    private final String prefix;
    private final MarkupScope scope;

    private ScopeEntry(final String prefix, final MarkupScope scope) {
      this.prefix = prefix;
      this.scope = scope;
    }
  }
}
