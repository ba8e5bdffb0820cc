package com.github.fsmgraph;

/**
 * A model that exposes its current state to the diagram machine. Models that don't implement it
 * still get graphs, just without active styling.
 */
public interface StatefulModel {

  /**
   * The current state: a qualified state name, a {@link StateDescriptor}, or for models with
   * parallel regions a (possibly nested) collection or array of those.
   */
  Object getState();

}
