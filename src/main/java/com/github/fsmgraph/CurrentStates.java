package com.github.fsmgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Reads the current state attribute of an observed model and flattens it into the list of state
 * names that are active at the same time. Descriptors are resolved to the qualified name of their
 * node; a descriptor unknown to the graph model stands for the destination of the running
 * transition, if any.
 */
final class CurrentStates {

  /**
   * Empty if the model doesn't expose a current state.
   */
  static Optional<List<String>> of(final Object model, final GraphModel graphModel,
      final String transitionDest) {
    if (!(model instanceof StatefulModel)) {
      return Optional.empty();
    }
    final Object state = ((StatefulModel) model).getState();
    if (state == null) {
      return Optional.empty();
    }
    return Optional.of(flatten(state, graphModel, transitionDest));
  }

  /**
   * Depth-first flattening of nested collections and arrays, keeping element order.
   */
  static List<String> flatten(final Object state, final GraphModel graphModel,
      final String transitionDest) {
    final List<String> names = new ArrayList<>();
    final Deque<Iterator<?>> iterators = new ArrayDeque<>();
    iterators.push(Collections.singletonList(state).iterator());
    while (!iterators.isEmpty()) {
      final Iterator<?> iterator = iterators.peek();
      if (!iterator.hasNext()) {
        iterators.pop();
        continue;
      }
      final Object element = iterator.next();
      if (element instanceof Collection) {
        iterators.push(((Collection<?>) element).iterator());
      } else if (element instanceof Object[]) {
        iterators.push(Arrays.asList((Object[]) element).iterator());
      } else if (element instanceof StateDescriptor) {
        final StateDescriptor descriptor = (StateDescriptor) element;
        names.add(graphModel.getQualifiedName(descriptor)
            .orElse(transitionDest != null ? transitionDest : descriptor.getName()));
      } else if (element != null) {
        names.add(element.toString());
      }
    }
    return names;
  }

  private CurrentStates() {}
}
